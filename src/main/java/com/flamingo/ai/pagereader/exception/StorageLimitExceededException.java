package com.flamingo.ai.pagereader.exception;

/** Exception thrown when an upload would push the owner past the storage allowance. */
public class StorageLimitExceededException extends RuntimeException {

  private final long limitBytes;
  private final long usedBytes;
  private final long requestedBytes;

  public StorageLimitExceededException(long limitBytes, long usedBytes, long requestedBytes) {
    super(
        String.format(
            "Storage limit exceeded: used %d + requested %d > limit %d",
            usedBytes, requestedBytes, limitBytes));
    this.limitBytes = limitBytes;
    this.usedBytes = usedBytes;
    this.requestedBytes = requestedBytes;
  }

  public long getLimitBytes() {
    return limitBytes;
  }

  public long getUsedBytes() {
    return usedBytes;
  }

  public long getRequestedBytes() {
    return requestedBytes;
  }
}
