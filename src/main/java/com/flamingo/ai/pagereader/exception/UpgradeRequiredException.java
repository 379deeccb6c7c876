package com.flamingo.ai.pagereader.exception;

/** Exception thrown when the owner's plan does not include the reading assistant. */
public class UpgradeRequiredException extends RuntimeException {

  private final String ownerId;
  private final String plan;

  public UpgradeRequiredException(String ownerId, String plan) {
    super(String.format("Plan '%s' of owner %s does not include the assistant", plan, ownerId));
    this.ownerId = ownerId;
    this.plan = plan;
  }

  public String getOwnerId() {
    return ownerId;
  }

  public String getPlan() {
    return plan;
  }
}
