package com.example.allocation.service.exception;

/**
 * Tenant setup is incomplete, e.g. no receivable or payable counter-account is configured. Not
 * something the caller can fix by editing the request.
 */
public class FatalConfigurationException extends IllegalStateException {

  public FatalConfigurationException(String message) {
    super(message);
  }
}
