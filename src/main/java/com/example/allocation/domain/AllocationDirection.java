package com.example.allocation.domain;

/** Which way the cash moves in an allocation event. */
public enum AllocationDirection {
  RECEIPT, // Money in from a customer, settles sales invoices
  PAYMENT; // Money out to a supplier, settles supplier bills

  public VoucherType voucherType() {
    return this == RECEIPT ? VoucherType.RECEIPT : VoucherType.PAYMENT;
  }
}
