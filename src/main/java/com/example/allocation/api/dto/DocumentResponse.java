package com.example.allocation.api.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.example.allocation.domain.AllocationDirection;
import com.example.allocation.domain.Document;

/** An invoice or bill with what is still owed on it. */
public record DocumentResponse(
    Long id,
    String documentNumber,
    AllocationDirection settledBy,
    Long counterpartyId,
    LocalDate issueDate,
    LocalDate dueDate,
    String currency,
    BigDecimal total,
    BigDecimal amountSettled,
    BigDecimal amountDue,
    Document.SettlementStatus status) {

  public static DocumentResponse from(Document document) {
    return new DocumentResponse(
        document.getId(),
        document.getDocumentNumber(),
        document.getSettlingDirection(),
        document.getContact().getId(),
        document.getIssueDate(),
        document.getDueDate(),
        document.getCurrency(),
        document.getTotal(),
        document.getAmountSettled(),
        document.getAmountDue(),
        document.getStatus());
  }
}
