package com.flamingo.ai.pagereader.domain.enums;

/** Structural kind of an extracted text block. */
public enum BlockKind {
  PARAGRAPH,
  HEADING
}
