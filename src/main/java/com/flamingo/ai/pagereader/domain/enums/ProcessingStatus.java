package com.flamingo.ai.pagereader.domain.enums;

/**
 * Processing status of an uploaded document. The only legal transitions are {@code PROCESSING ->
 * READY} and {@code PROCESSING -> FAILED}.
 */
public enum ProcessingStatus {
  /** Text is being derived; partial pages may already be readable. */
  PROCESSING,

  /** Both content representations are final. */
  READY,

  /** Extraction failed; the cause is kept on the document. */
  FAILED;

  public boolean isTerminal() {
    return this != PROCESSING;
  }
}
