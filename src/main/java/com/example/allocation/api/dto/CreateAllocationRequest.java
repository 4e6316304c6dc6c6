package com.example.allocation.api.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import com.example.allocation.domain.AllocationDirection;
import com.example.allocation.domain.AllocationStrategy;
import com.example.allocation.service.AllocationRequest;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * Body of {@code POST /api/allocations}. Leave {@code lines} empty to let FIFO or PRO_RATA derive
 * them from the counterparty's outstanding documents.
 */
public record CreateAllocationRequest(
    @NotNull(message = "Direction is required") AllocationDirection direction,
    @NotNull(message = "Strategy is required") AllocationStrategy strategy,
    @NotNull(message = "Total amount is required") BigDecimal totalAmount,
    LocalDate paymentDate,
    Long cashAccountId,
    @NotNull(message = "Counterparty is required") Long counterpartyId,
    @Valid List<LineRequest> lines,
    String reference,
    String notes,
    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
        String currency,
    BigDecimal exchangeRate) {

  public record LineRequest(
      @NotNull(message = "Document is required") Long documentId,
      @NotNull(message = "Amount is required") BigDecimal amount,
      String note) {}

  public AllocationRequest toCommand() {
    List<AllocationRequest.Line> commandLines =
        lines == null
            ? List.of()
            : lines.stream()
                .map(l -> new AllocationRequest.Line(l.documentId(), l.amount(), l.note()))
                .toList();
    return new AllocationRequest(
        direction,
        strategy,
        totalAmount,
        paymentDate,
        cashAccountId,
        counterpartyId,
        commandLines,
        reference,
        notes,
        currency,
        exchangeRate);
  }
}
