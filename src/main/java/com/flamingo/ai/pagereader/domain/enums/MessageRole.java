package com.flamingo.ai.pagereader.domain.enums;

/** Author of a chat message. */
public enum MessageRole {
  USER,
  MODEL
}
