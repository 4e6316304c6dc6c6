package com.example.allocation.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.mock.mockito.SpyBean;

import com.example.allocation.domain.AllocationStrategy;

/**
 * Injects failures part-way through posting and checks that nothing from the failed allocation
 * survives.
 */
class AllocationAtomicityTest extends LedgerIntegrationTestSupport {

  @SpyBean private VoucherPostingService spiedVoucherPostingService;

  @SpyBean private DocumentBalanceService spiedDocumentBalanceService;

  @Test
  void createAllocation_VoucherPostingFails_RollsBackEverything() {
    // Given
    Fixture fixture = createFixture();
    doThrow(new IllegalStateException("ledger unavailable"))
        .when(spiedVoucherPostingService)
        .postAllocation(any());

    // When
    IllegalStateException ex =
        assertThrows(
            IllegalStateException.class,
            () ->
                allocationService.createAllocation(
                    receipt(fixture, AllocationStrategy.FIFO, "450.00")));

    // Then
    assertEquals("ledger unavailable", ex.getMessage());
    assertTrue(groupsFor(fixture).isEmpty());
    assertTrue(vouchersFor(fixture).isEmpty());
    assertAmount("300.00", amountDue(fixture.inv1Id()));
    assertAmount("200.00", amountDue(fixture.inv2Id()));
  }

  @Test
  void createAllocation_SecondSettlementFails_FirstSettlementAndVoucherRolledBack() {
    // Given
    Fixture fixture = createFixture();
    doCallRealMethod()
        .doThrow(new IllegalStateException("disk full"))
        .when(spiedDocumentBalanceService)
        .recordSettlement(any(), any(), any(), any());

    // When
    assertThrows(
        IllegalStateException.class,
        () ->
            allocationService.createAllocation(
                receipt(fixture, AllocationStrategy.FIFO, "450.00")));

    // Then
    assertTrue(groupsFor(fixture).isEmpty());
    assertTrue(vouchersFor(fixture).isEmpty());
    assertAmount("300.00", amountDue(fixture.inv1Id()));
    assertAmount("0.00", balance(fixture.bankId()));
    assertTrue(
        inTransaction(
            () -> settlementRepository.findByDocumentOrderByIdAsc(document(fixture.inv1Id())))
            .isEmpty());
  }
}
