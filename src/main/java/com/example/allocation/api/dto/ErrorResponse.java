package com.example.allocation.api.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error body returned for every rejected request. {@code code} is stable and machine-readable;
 * {@code retryable} is set only when repeating the whole operation may succeed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String code,
    String message,
    List<ViolationDetail> violations,
    Map<String, String> fieldErrors,
    Boolean retryable,
    Instant timestamp) {

  public static ErrorResponse of(String code, String message) {
    return new ErrorResponse(code, message, null, null, null, Instant.now());
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ViolationDetail(String rule, Integer line, Long documentId, String message) {}
}
