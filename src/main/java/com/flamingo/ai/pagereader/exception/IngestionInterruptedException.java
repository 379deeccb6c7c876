package com.flamingo.ai.pagereader.exception;

import java.util.UUID;

/** Exception thrown when an ingestion batch is cancelled before it completes. */
public class IngestionInterruptedException extends RuntimeException {

  private final UUID documentId;

  public IngestionInterruptedException(UUID documentId, Throwable cause) {
    super("Ingestion of document " + documentId + " was interrupted", cause);
    this.documentId = documentId;
  }

  public UUID getDocumentId() {
    return documentId;
  }
}
