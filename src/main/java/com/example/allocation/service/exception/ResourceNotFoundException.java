package com.example.allocation.service.exception;

/** A referenced group, document, account, counterparty or voucher does not exist. */
public class ResourceNotFoundException extends RuntimeException {

  private final String resourceType;
  private final Object resourceId;

  public ResourceNotFoundException(String resourceType, Object resourceId) {
    super(resourceType + " not found: " + resourceId);
    this.resourceType = resourceType;
    this.resourceId = resourceId;
  }

  public String getResourceType() {
    return resourceType;
  }

  public Object getResourceId() {
    return resourceId;
  }
}
