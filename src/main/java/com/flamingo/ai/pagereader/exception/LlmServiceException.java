package com.flamingo.ai.pagereader.exception;

/** Exception thrown when the generative or embedding model call fails. */
public class LlmServiceException extends RuntimeException {

  private static final String USER_MESSAGE =
      "The reading assistant is temporarily unavailable. Please try again later.";

  public LlmServiceException(String message) {
    super(message);
  }

  public LlmServiceException(String message, Throwable cause) {
    super(message, cause);
  }

  public String getUserMessage() {
    return USER_MESSAGE;
  }
}
