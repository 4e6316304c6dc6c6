package com.example.allocation.api.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.example.allocation.domain.VoucherType;
import com.example.allocation.service.VoucherPostingService.VoucherRequest;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Body of {@code POST /api/vouchers}. The type is taken as text so the legacy {@code DEPOSIT} name
 * can still be accepted; it is normalized before anything else happens.
 */
public record CreateVoucherRequest(
    @NotBlank(message = "Voucher type is required") String voucherType,
    LocalDate transactionDate,
    @NotNull(message = "Amount is required") BigDecimal amount,
    @NotNull(message = "Debit account is required") Long debitAccountId,
    @NotNull(message = "Credit account is required") Long creditAccountId,
    @Size(max = 255) String description,
    @Size(max = 100) String reference,
    @Size(max = 100) String beneficiaryName) {

  public VoucherRequest toCommand() {
    return new VoucherRequest(
        VoucherType.fromInput(voucherType),
        transactionDate,
        amount,
        debitAccountId,
        creditAccountId,
        description,
        reference,
        beneficiaryName);
  }
}
