package com.example.allocation.service.exception;

import com.example.allocation.service.ValidationResult;

/**
 * A request the caller can correct: unbalanced totals, non-positive amounts, over-allocation,
 * missing party or account, wrong account classification. Carries every violation found.
 */
public class LedgerValidationException extends IllegalArgumentException {

  private final transient ValidationResult result;

  public LedgerValidationException(ValidationResult result) {
    super(result.summary());
    this.result = result;
  }

  public ValidationResult getResult() {
    return result;
  }
}
