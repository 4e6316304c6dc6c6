package com.example.allocation.service;

import java.math.BigDecimal;
import java.time.LocalDate;

/** A document as the allocator sees it: identity, ordering keys and what is still due. */
public record OutstandingDocument(
    Long documentId, String documentNumber, LocalDate dueDate, BigDecimal amountDue) {}
