package com.example.allocation.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.springframework.stereotype.Component;

import com.example.allocation.domain.AllocationStrategy;
import com.example.allocation.service.AllocationProposal.ProposedLine;

/**
 * Spreads a lump-sum amount across outstanding documents. Pure and deterministic: the same
 * documents and amount always give the same proposal, and nothing is read or written.
 *
 * <p>Documents are always considered in due-date order, ties broken by document number and then
 * id. Documents with nothing due are ignored.
 */
@Component
public class PaymentAllocator {

  static final int SCALE = 2;

  private static final Comparator<OutstandingDocument> DUE_ORDER =
      Comparator.comparing(
              OutstandingDocument::dueDate, Comparator.nullsLast(Comparator.naturalOrder()))
          .thenComparing(
              OutstandingDocument::documentNumber, Comparator.nullsLast(Comparator.naturalOrder()))
          .thenComparing(
              OutstandingDocument::documentId, Comparator.nullsLast(Comparator.naturalOrder()));

  /**
   * Proposes per-document amounts for a payment.
   *
   * <p>MANUAL proposes nothing and reports the whole payment as unallocated; the caller supplies
   * every line.
   *
   * @throws IllegalArgumentException if the strategy is missing or the payment is not positive
   */
  public AllocationProposal allocate(
      AllocationStrategy strategy, List<OutstandingDocument> documents, BigDecimal totalPayment) {
    if (strategy == null) {
      throw new IllegalArgumentException("Allocation strategy is required");
    }
    if (totalPayment == null || totalPayment.signum() <= 0) {
      throw new IllegalArgumentException("Payment amount must be positive");
    }
    BigDecimal total = totalPayment.setScale(SCALE, RoundingMode.HALF_UP);

    return switch (strategy) {
      case FIFO -> fifo(eligibleInDueOrder(documents), total);
      case PRO_RATA -> proRata(eligibleInDueOrder(documents), total);
      case MANUAL -> new AllocationProposal(strategy, total, List.of(), total);
    };
  }

  private AllocationProposal fifo(List<OutstandingDocument> eligible, BigDecimal total) {
    List<ProposedLine> lines = new ArrayList<>();
    BigDecimal remaining = total;

    for (OutstandingDocument document : eligible) {
      if (remaining.signum() <= 0) {
        break;
      }
      BigDecimal amount = document.amountDue().min(remaining);
      lines.add(new ProposedLine(document.documentId(), document.documentNumber(), amount));
      remaining = remaining.subtract(amount);
    }

    return new AllocationProposal(AllocationStrategy.FIFO, total, lines, remaining);
  }

  /**
   * Every document but the last gets its rounded (half-up, 2 places) share of the effective
   * amount; the last gets the exact remainder so the lines add up to the effective amount. Shares
   * are capped by what is still due and by what is left to place. If the remainder would push the
   * last document past its amount due, the excess goes to earlier documents that still have room.
   */
  private AllocationProposal proRata(List<OutstandingDocument> eligible, BigDecimal total) {
    BigDecimal totalDue =
        eligible.stream()
            .map(OutstandingDocument::amountDue)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    if (totalDue.signum() == 0) {
      return new AllocationProposal(AllocationStrategy.PRO_RATA, total, List.of(), total);
    }

    BigDecimal effective = total.min(totalDue);
    int count = eligible.size();
    BigDecimal[] amounts = new BigDecimal[count];
    BigDecimal allocated = BigDecimal.ZERO;

    for (int i = 0; i < count - 1; i++) {
      BigDecimal due = eligible.get(i).amountDue();
      BigDecimal share =
          effective
              .multiply(due)
              .divide(totalDue, SCALE, RoundingMode.HALF_UP)
              .min(due)
              .min(effective.subtract(allocated));
      amounts[i] = share;
      allocated = allocated.add(share);
    }

    BigDecimal last = effective.subtract(allocated);
    BigDecimal lastDue = eligible.get(count - 1).amountDue();
    if (last.compareTo(lastDue) > 0) {
      BigDecimal overflow = last.subtract(lastDue);
      last = lastDue;
      for (int i = 0; i < count - 1 && overflow.signum() > 0; i++) {
        BigDecimal room = eligible.get(i).amountDue().subtract(amounts[i]);
        BigDecimal extra = room.min(overflow);
        amounts[i] = amounts[i].add(extra);
        overflow = overflow.subtract(extra);
      }
    }
    amounts[count - 1] = last;

    List<ProposedLine> lines = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      if (amounts[i].signum() > 0) {
        OutstandingDocument document = eligible.get(i);
        lines.add(new ProposedLine(document.documentId(), document.documentNumber(), amounts[i]));
      }
    }
    return new AllocationProposal(
        AllocationStrategy.PRO_RATA, total, lines, total.subtract(effective));
  }

  private List<OutstandingDocument> eligibleInDueOrder(List<OutstandingDocument> documents) {
    List<OutstandingDocument> eligible = new ArrayList<>();
    for (OutstandingDocument document : documents) {
      if (document.amountDue() != null && document.amountDue().signum() > 0) {
        eligible.add(document);
      }
    }
    eligible.sort(DUE_ORDER);
    return eligible;
  }
}
