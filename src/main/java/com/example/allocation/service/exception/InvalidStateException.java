package com.example.allocation.service.exception;

import com.example.allocation.service.ValidationResult;

/**
 * The operation conflicts with the current state: reversing an already reversed allocation,
 * allocating a document of another counterparty, reversing a voucher owned by an allocation.
 */
public class InvalidStateException extends IllegalStateException {

  private final transient ValidationResult result;

  public InvalidStateException(String message) {
    super(message);
    this.result = null;
  }

  public InvalidStateException(ValidationResult result) {
    super(result.summary());
    this.result = result;
  }

  /** Violations behind this conflict, or null when it was not raised by validation. */
  public ValidationResult getResult() {
    return result;
  }
}
