package com.flamingo.ai.pagereader.service.quota;

/**
 * Usage of an owner in the current month, taken before a model call.
 *
 * @param plan resolved plan
 * @param budget monthly token budget of the plan
 * @param used tokens in plus tokens out so far
 */
public record QuotaSnapshot(String plan, long budget, long used) {

  public long remaining() {
    return Math.max(0, budget - used);
  }
}
