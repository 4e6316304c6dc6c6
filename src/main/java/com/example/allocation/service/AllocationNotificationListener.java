package com.example.allocation.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Hands posted and reversed allocations to downstream notification. Runs only after the
 * allocation's transaction has committed, so rolled-back work is never announced, and nothing it
 * does can change the outcome of the allocation.
 */
@Component
public class AllocationNotificationListener {

  private static final Logger log = LoggerFactory.getLogger(AllocationNotificationListener.class);

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onStatusChanged(AllocationStatusChangedEvent event) {
    log.info(
        "Allocation {} {} for counterparty {}: {} {}",
        event.groupId(),
        event.status(),
        event.counterpartyId(),
        event.direction(),
        event.totalAmount());
  }
}
