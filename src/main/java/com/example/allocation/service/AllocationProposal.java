package com.example.allocation.service;

import java.math.BigDecimal;
import java.util.List;

import com.example.allocation.domain.AllocationStrategy;

/**
 * The allocator's answer: per-document amounts plus whatever could not be placed. The unallocated
 * remainder is never spread silently; the caller decides what to do with it.
 */
public record AllocationProposal(
    AllocationStrategy strategy,
    BigDecimal totalPayment,
    List<ProposedLine> lines,
    BigDecimal unallocated) {

  public AllocationProposal {
    lines = List.copyOf(lines);
  }

  public BigDecimal allocatedTotal() {
    return lines.stream().map(ProposedLine::amount).reduce(BigDecimal.ZERO, BigDecimal::add);
  }

  public boolean isFullyAllocated() {
    return unallocated.signum() == 0;
  }

  public record ProposedLine(Long documentId, String documentNumber, BigDecimal amount) {}
}
