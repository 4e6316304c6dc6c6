package com.example.allocation.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import com.example.allocation.domain.AllocationDirection;
import com.example.allocation.domain.AllocationStrategy;

/**
 * Everything needed to create an allocation. When {@code lines} is empty and the strategy is not
 * MANUAL, the lines are derived from the strategy over the counterparty's outstanding documents.
 *
 * @param currency optional; defaults to the tenant currency
 * @param exchangeRate optional; recorded as supplied, defaults to 1
 */
public record AllocationRequest(
    AllocationDirection direction,
    AllocationStrategy strategy,
    BigDecimal totalAmount,
    LocalDate paymentDate,
    Long cashAccountId,
    Long counterpartyId,
    List<Line> lines,
    String reference,
    String notes,
    String currency,
    BigDecimal exchangeRate) {

  public AllocationRequest {
    lines = lines == null ? List.of() : List.copyOf(lines);
  }

  /** One requested document share. */
  public record Line(Long documentId, BigDecimal amount, String note) {

    public Line(Long documentId, BigDecimal amount) {
      this(documentId, amount, null);
    }
  }
}
