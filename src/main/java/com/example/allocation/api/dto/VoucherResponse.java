package com.example.allocation.api.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import com.example.allocation.domain.Voucher;
import com.example.allocation.domain.VoucherType;

public record VoucherResponse(
    Long id,
    String voucherNumber,
    VoucherType type,
    Voucher.Status status,
    BigDecimal amount,
    String debitAccountCode,
    String creditAccountCode,
    LocalDate transactionDate,
    String description,
    String reference,
    String beneficiaryName,
    Instant postedAt,
    Instant reversedAt) {

  public static VoucherResponse from(Voucher voucher) {
    return new VoucherResponse(
        voucher.getId(),
        voucher.getVoucherNumber(),
        voucher.getType(),
        voucher.getStatus(),
        voucher.getAmount(),
        voucher.getDebitAccount().getCode(),
        voucher.getCreditAccount().getCode(),
        voucher.getTransactionDate(),
        voucher.getDescription(),
        voucher.getReference(),
        voucher.getBeneficiaryName(),
        voucher.getPostedAt(),
        voucher.getReversedAt());
  }
}
