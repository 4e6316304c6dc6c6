package com.example.allocation.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import com.example.allocation.service.exception.InvalidStateException;
import com.example.allocation.service.exception.LedgerValidationException;

/**
 * Outcome of validating an allocation or voucher. Lists every violation found; empty means valid.
 */
public final class ValidationResult {

  private static final ValidationResult VALID = new ValidationResult(List.of());

  private final List<Violation> violations;

  private ValidationResult(List<Violation> violations) {
    this.violations = Collections.unmodifiableList(new ArrayList<>(violations));
  }

  public static ValidationResult valid() {
    return VALID;
  }

  public static ValidationResult of(List<Violation> violations) {
    return violations.isEmpty() ? VALID : new ValidationResult(violations);
  }

  public static ValidationResult of(Violation violation) {
    return new ValidationResult(List.of(violation));
  }

  public boolean isValid() {
    return violations.isEmpty();
  }

  public List<Violation> getViolations() {
    return violations;
  }

  public boolean hasViolation(ValidationRule rule) {
    return violations.stream().anyMatch(v -> v.rule() == rule);
  }

  public String summary() {
    if (violations.isEmpty()) {
      return "Valid";
    }
    return violations.stream().map(Violation::message).collect(Collectors.joining("; "));
  }

  /**
   * Throws if anything was violated. A state conflict among the violations raises
   * {@link InvalidStateException}; otherwise {@link LedgerValidationException}.
   */
  public void throwIfInvalid() {
    if (isValid()) {
      return;
    }
    if (violations.stream().anyMatch(v -> v.rule().isStateConflict())) {
      throw new InvalidStateException(this);
    }
    throw new LedgerValidationException(this);
  }

  /**
   * One failed check.
   *
   * @param lineIndex zero-based allocation line, or null for group-level rules
   * @param documentId the document involved, or null
   */
  public record Violation(ValidationRule rule, Integer lineIndex, Long documentId, String message) {

    public static Violation of(ValidationRule rule, String message) {
      return new Violation(rule, null, null, message);
    }

    public static Violation forLine(
        ValidationRule rule, int lineIndex, Long documentId, String message) {
      return new Violation(rule, lineIndex, documentId, message);
    }
  }
}
