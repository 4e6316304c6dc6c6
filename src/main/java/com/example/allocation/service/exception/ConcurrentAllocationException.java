package com.example.allocation.service.exception;

/**
 * The amount due of a document shrank between validation and lock acquisition because another
 * allocation settled it first. Callers should re-fetch outstanding documents and retry the whole
 * allocation.
 */
public class ConcurrentAllocationException extends IllegalStateException {

  private final Long documentId;

  public ConcurrentAllocationException(Long documentId, String message) {
    super(message);
    this.documentId = documentId;
  }

  public Long getDocumentId() {
    return documentId;
  }

  public boolean isRetryable() {
    return true;
  }
}
