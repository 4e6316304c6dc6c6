package com.example.allocation.service;

import java.math.BigDecimal;
import java.time.Instant;

import com.example.allocation.domain.AllocationDirection;
import com.example.allocation.domain.AllocationGroup;

/** Published when an allocation is posted or reversed. */
public record AllocationStatusChangedEvent(
    Long groupId,
    Long companyId,
    Long counterpartyId,
    AllocationDirection direction,
    AllocationGroup.Status status,
    BigDecimal totalAmount,
    Instant occurredAt) {

  public static AllocationStatusChangedEvent of(AllocationGroup group) {
    return new AllocationStatusChangedEvent(
        group.getId(),
        group.getCompany().getId(),
        group.getContact().getId(),
        group.getDirection(),
        group.getStatus(),
        group.getTotalAmount(),
        Instant.now());
  }
}
