package com.example.allocation.service;

/** The checks applied before anything is persisted, in the order they are evaluated. */
public enum ValidationRule {
  NO_LINES("At least one allocation line is required"),
  NON_POSITIVE_AMOUNT("Allocation amount must be positive"),
  DOCUMENT_REFERENCE("Allocation line must reference exactly one document"),
  DUPLICATE_DOCUMENT("A document may appear on only one line"),
  COUNTERPARTY_MISMATCH("Document belongs to a different counterparty"),
  DOCUMENT_DIRECTION("Document cannot be settled in this direction"),
  CURRENCY_MISMATCH("Document currency differs from the allocation currency"),
  TOTAL_NOT_POSITIVE("Total amount must be positive"),
  AMOUNT_PRECISION("Amount has more decimal places than the currency's minor unit"),
  UNBALANCED("Allocated amounts do not add up to the total"),
  EXCEEDS_AMOUNT_DUE("Allocation exceeds the document's amount due"),
  MISSING_COUNTERPARTY("Counterparty is required"),
  COUNTERPARTY_ROLE("Counterparty cannot take part in this direction"),
  MISSING_CASH_ACCOUNT("Cash or bank account is required"),
  CASH_ACCOUNT_CLASS("Cash or bank account must be an asset"),
  MISSING_PAYMENT_DATE("Payment date is required"),
  EXCHANGE_RATE("Exchange rate must be positive"),
  VOUCHER_AMOUNT("Voucher amount must be positive"),
  MISSING_ACCOUNT("Voucher needs both a debit and a credit account"),
  SAME_ACCOUNT("Debit and credit accounts must differ"),
  DEBIT_ACCOUNT_CLASS("Debit account classification not allowed for this voucher type"),
  CREDIT_ACCOUNT_CLASS("Credit account classification not allowed for this voucher type"),
  INACTIVE_ACCOUNT("Account is inactive");

  private final String description;

  ValidationRule(String description) {
    this.description = description;
  }

  public String getDescription() {
    return description;
  }

  /** Rules whose violation is a state conflict rather than a correctable input error. */
  public boolean isStateConflict() {
    return this == COUNTERPARTY_MISMATCH;
  }
}
