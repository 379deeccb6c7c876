package com.flamingo.ai.pagereader.exception;

import java.util.UUID;

/** Exception thrown when a document cannot be extracted, paginated or ingested. */
public class DocumentProcessingException extends RuntimeException {

  private final UUID documentId;
  private final String userMessage;

  public DocumentProcessingException(UUID documentId, String message) {
    super(message);
    this.documentId = documentId;
    this.userMessage = message;
  }

  public DocumentProcessingException(UUID documentId, String message, Throwable cause) {
    super(message, cause);
    this.documentId = documentId;
    this.userMessage = "Failed to process document";
  }

  public UUID getDocumentId() {
    return documentId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
