package com.example.allocation.api.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import com.example.allocation.domain.AllocationDirection;
import com.example.allocation.domain.AllocationGroup;
import com.example.allocation.domain.AllocationRecord;
import com.example.allocation.domain.AllocationStrategy;
import com.example.allocation.domain.DocumentSettlement;
import com.example.allocation.domain.Voucher;

/** An allocation group with its per-document breakdown. */
public record AllocationResponse(
    Long id,
    AllocationDirection direction,
    AllocationStrategy strategy,
    AllocationGroup.Status status,
    Long counterpartyId,
    String counterpartyName,
    BigDecimal totalAmount,
    BigDecimal allocatedAmount,
    String currency,
    BigDecimal exchangeRate,
    LocalDate paymentDate,
    String cashAccountCode,
    String counterAccountCode,
    Long voucherId,
    String voucherNumber,
    String reference,
    String notes,
    Instant createdAt,
    Instant postedAt,
    Instant reversedAt,
    List<Line> records) {

  public record Line(
      Long id,
      Long documentId,
      String documentNumber,
      BigDecimal amount,
      String note,
      Long settlementId,
      boolean settlementVoided) {

    static Line from(AllocationRecord record) {
      DocumentSettlement settlement = record.getSettlement();
      return new Line(
          record.getId(),
          record.getDocument().getId(),
          record.getDocument().getDocumentNumber(),
          record.getAmount(),
          record.getNote(),
          settlement != null ? settlement.getId() : null,
          settlement != null && settlement.isVoided());
    }
  }

  public static AllocationResponse from(AllocationGroup group) {
    Voucher voucher = group.getVoucher();
    return new AllocationResponse(
        group.getId(),
        group.getDirection(),
        group.getStrategy(),
        group.getStatus(),
        group.getContact().getId(),
        group.getContact().getName(),
        group.getTotalAmount(),
        group.getAllocatedAmount(),
        group.getCurrency(),
        group.getExchangeRate(),
        group.getPaymentDate(),
        group.getCashAccount() != null ? group.getCashAccount().getCode() : null,
        group.getCounterAccount() != null ? group.getCounterAccount().getCode() : null,
        voucher != null ? voucher.getId() : null,
        voucher != null ? voucher.getVoucherNumber() : null,
        group.getReference(),
        group.getNotes(),
        group.getCreatedAt(),
        group.getPostedAt(),
        group.getReversedAt(),
        group.getRecords().stream().map(Line::from).toList());
  }
}
