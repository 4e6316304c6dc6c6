package com.example.allocation.api;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import com.example.allocation.api.dto.ErrorResponse;
import com.example.allocation.api.dto.ErrorResponse.ViolationDetail;
import com.example.allocation.service.ValidationResult;
import com.example.allocation.service.exception.ConcurrentAllocationException;
import com.example.allocation.service.exception.FatalConfigurationException;
import com.example.allocation.service.exception.InvalidStateException;
import com.example.allocation.service.exception.LedgerValidationException;
import com.example.allocation.service.exception.ResourceNotFoundException;

/**
 * Maps the error taxonomy to HTTP statuses. A configuration problem is reported as a server error
 * with its own code so clients do not present it as something the user can fix by editing amounts.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(LedgerValidationException.class)
  public ResponseEntity<ErrorResponse> handleLedgerValidation(LedgerValidationException e) {
    log.warn("Allocation rejected: {}", e.getMessage());
    ErrorResponse error =
        new ErrorResponse(
            "VALIDATION_FAILED",
            e.getMessage(),
            toDetails(e.getResult()),
            null,
            null,
            Instant.now());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidationException(
      MethodArgumentNotValidException e) {
    log.warn("Validation failed: {}", e.getMessage());

    Map<String, String> errors =
        e.getBindingResult().getFieldErrors().stream()
            .collect(
                Collectors.toMap(
                    error -> error.getField(),
                    error ->
                        error.getDefaultMessage() != null
                            ? error.getDefaultMessage()
                            : "Invalid value",
                    (existing, replacement) -> existing));

    ErrorResponse error =
        new ErrorResponse(
            "VALIDATION_FAILED", "Request validation failed", null, errors, null, Instant.now());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
  }

  @ExceptionHandler({
    MissingServletRequestParameterException.class,
    MethodArgumentTypeMismatchException.class,
    HttpMessageNotReadableException.class
  })
  public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception e) {
    log.warn("Malformed request: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(ErrorResponse.of("INVALID_REQUEST", e.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
    log.warn("Invalid argument: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(ErrorResponse.of("INVALID_REQUEST", e.getMessage()));
  }

  @ExceptionHandler(ResourceNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException e) {
    log.warn(e.getMessage());
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(ErrorResponse.of("NOT_FOUND", e.getMessage()));
  }

  @ExceptionHandler(ConcurrentAllocationException.class)
  public ResponseEntity<ErrorResponse> handleConcurrentAllocation(ConcurrentAllocationException e) {
    log.warn("Concurrent allocation on document {}: {}", e.getDocumentId(), e.getMessage());
    ErrorResponse error =
        new ErrorResponse(
            "CONCURRENT_ALLOCATION", e.getMessage(), null, null, e.isRetryable(), Instant.now());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
  }

  @ExceptionHandler(ConcurrencyFailureException.class)
  public ResponseEntity<ErrorResponse> handleLockFailure(ConcurrencyFailureException e) {
    log.warn("Lock conflict: {}", e.getMessage());
    ErrorResponse error =
        new ErrorResponse(
            "CONCURRENT_ALLOCATION",
            "The documents were changed by another request; refresh and retry",
            null,
            null,
            true,
            Instant.now());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
  }

  @ExceptionHandler(FatalConfigurationException.class)
  public ResponseEntity<ErrorResponse> handleConfiguration(FatalConfigurationException e) {
    log.error("Ledger configuration error: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ErrorResponse.of("CONFIGURATION_ERROR", e.getMessage()));
  }

  @ExceptionHandler(InvalidStateException.class)
  public ResponseEntity<ErrorResponse> handleInvalidState(InvalidStateException e) {
    log.warn("Invalid state: {}", e.getMessage());
    ErrorResponse error =
        new ErrorResponse(
            "INVALID_STATE", e.getMessage(), toDetails(e.getResult()), null, null, Instant.now());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
  }

  @ExceptionHandler(IllegalStateException.class)
  public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
    log.warn("Invalid state: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(ErrorResponse.of("INVALID_STATE", e.getMessage()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
    log.error("Unexpected error", e);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ErrorResponse.of("INTERNAL_ERROR", "An unexpected error occurred"));
  }

  private static List<ViolationDetail> toDetails(ValidationResult result) {
    if (result == null) {
      return null;
    }
    return result.getViolations().stream()
        .map(
            v ->
                new ViolationDetail(
                    v.rule().name(),
                    v.lineIndex() != null ? v.lineIndex() + 1 : null,
                    v.documentId(),
                    v.message()))
        .toList();
  }
}
