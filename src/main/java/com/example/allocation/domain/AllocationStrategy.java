package com.example.allocation.domain;

/** How a lump-sum amount is spread across outstanding documents. */
public enum AllocationStrategy {
  FIFO, // Earliest due date first
  PRO_RATA, // Proportional to each document's amount due
  MANUAL // Caller supplies every line
}
