package com.flamingo.ai.pagereader.service.chat;

/**
 * Text and token usage of one model reply.
 *
 * @param text answer text, never blank
 * @param inputTokens prompt tokens reported by the model, 0 when unknown
 * @param outputTokens completion tokens reported by the model, 0 when unknown
 */
public record GeneratedAnswer(String text, long inputTokens, long outputTokens) {

  public long totalTokens() {
    return inputTokens + outputTokens;
  }
}
