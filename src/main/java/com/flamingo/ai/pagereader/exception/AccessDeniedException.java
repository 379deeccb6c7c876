package com.flamingo.ai.pagereader.exception;

import java.util.UUID;

/**
 * Exception thrown when a caller addresses a resource owned by someone else. Kept distinct from the
 * not-found exceptions so that handlers can decide what to reveal.
 */
public class AccessDeniedException extends RuntimeException {

  private final String resourceType;
  private final UUID resourceId;
  private final String ownerId;

  public AccessDeniedException(String resourceType, UUID resourceId, String ownerId) {
    super(String.format("%s %s is not accessible to owner %s", resourceType, resourceId, ownerId));
    this.resourceType = resourceType;
    this.resourceId = resourceId;
    this.ownerId = ownerId;
  }

  public String getResourceType() {
    return resourceType;
  }

  public UUID getResourceId() {
    return resourceId;
  }

  public String getOwnerId() {
    return ownerId;
  }
}
