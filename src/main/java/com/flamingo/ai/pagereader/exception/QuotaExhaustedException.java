package com.flamingo.ai.pagereader.exception;

/** Exception thrown when the owner has used up the monthly token budget. */
public class QuotaExhaustedException extends RuntimeException {

  private final String ownerId;
  private final long budget;
  private final long used;

  public QuotaExhaustedException(String ownerId, long budget, long used) {
    super(String.format("Owner %s used %d of %d monthly tokens", ownerId, used, budget));
    this.ownerId = ownerId;
    this.budget = budget;
    this.used = used;
  }

  public String getOwnerId() {
    return ownerId;
  }

  public long getBudget() {
    return budget;
  }

  public long getUsed() {
    return used;
  }
}
