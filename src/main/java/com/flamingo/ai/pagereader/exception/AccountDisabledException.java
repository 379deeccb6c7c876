package com.flamingo.ai.pagereader.exception;

/** Exception thrown when a disabled account calls the API. */
public class AccountDisabledException extends RuntimeException {

  private final String ownerId;

  public AccountDisabledException(String ownerId) {
    super("Account is disabled: " + ownerId);
    this.ownerId = ownerId;
  }

  public String getOwnerId() {
    return ownerId;
  }
}
