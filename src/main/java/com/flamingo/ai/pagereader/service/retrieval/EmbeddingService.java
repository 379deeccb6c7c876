package com.flamingo.ai.pagereader.service.retrieval;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Embeds prompts and page texts with the configured embedding model. Queries and pages use the
 * same model so their vectors are comparable. An open circuit yields an empty vector, which
 * callers treat as "no embedding".
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small accepts 8192 tokens; dense scripts can approach one char per token
  static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a user prompt.
   *
   * @param query prompt text
   * @return embedding vector, empty if the model is unavailable
   */
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  @CircuitBreaker(name = "openai", fallbackMethod = "embedFallback")
  public float[] embedQuery(String query) {
    return embed(query, "query");
  }

  /**
   * Embeds the text of one page.
   *
   * @param passage page text
   * @return embedding vector, empty if the model is unavailable
   */
  @Timed(value = "embedding.embedPassage", description = "Time to embed passage")
  @CircuitBreaker(name = "openai", fallbackMethod = "embedFallback")
  public float[] embedPassage(String passage) {
    return embed(passage, "passage");
  }

  private float[] embed(String text, String type) {
    String input = text;
    if (input.length() > MAX_CHARS_PER_EMBEDDING) {
      log.warn(
          "{} too long for embedding, truncating from {} chars to {} chars",
          type,
          input.length(),
          MAX_CHARS_PER_EMBEDDING);
      input = input.substring(0, MAX_CHARS_PER_EMBEDDING);
    }
    Response<Embedding> response = embeddingModel.embed(input);
    meterRegistry.counter("embedding.requests.success", "type", type).increment();
    return response.content().vector();
  }

  @SuppressWarnings("unused")
  private float[] embedFallback(String text, Throwable t) {
    log.error("Embedding failed, circuit breaker fallback: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    return new float[0];
  }
}
