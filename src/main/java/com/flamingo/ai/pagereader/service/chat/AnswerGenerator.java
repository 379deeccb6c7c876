package com.flamingo.ai.pagereader.service.chat;

import com.flamingo.ai.pagereader.exception.LlmServiceException;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Sends a prepared conversation to the generative model and returns its plain text reply. */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnswerGenerator {

  private final ChatModel chatModel;

  /**
   * Generates one reply.
   *
   * @param messages history followed by the final user message
   * @return reply text with token usage
   * @throws LlmServiceException if the model fails or returns no text
   */
  @Timed(value = "assistant.generate", description = "Time to generate an answer")
  @CircuitBreaker(name = "openai", fallbackMethod = "generateFallback")
  public GeneratedAnswer generate(List<ChatMessage> messages) {
    log.debug("Calling chat model with {} messages", messages.size());
    ChatResponse response = chatModel.chat(messages);

    String text = response.aiMessage() != null ? response.aiMessage().text() : null;
    if (text == null || text.isBlank()) {
      throw new LlmServiceException("Empty response from model");
    }

    TokenUsage usage = response.tokenUsage();
    long in = usage != null && usage.inputTokenCount() != null ? usage.inputTokenCount() : 0;
    long out = usage != null && usage.outputTokenCount() != null ? usage.outputTokenCount() : 0;
    return new GeneratedAnswer(text, in, out);
  }

  @SuppressWarnings("unused")
  private GeneratedAnswer generateFallback(List<ChatMessage> messages, Throwable t) {
    if (t instanceof LlmServiceException llmException) {
      throw llmException;
    }
    log.error("Chat model call failed: {}", t.getMessage());
    throw new LlmServiceException("Chat model call failed: " + t.getMessage(), t);
  }
}
