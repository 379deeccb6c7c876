package com.flamingo.ai.pagereader.service.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingService Tests")
class EmbeddingServiceTest {

  @Mock private EmbeddingModel embeddingModel;

  private SimpleMeterRegistry meterRegistry;
  private EmbeddingService embeddingService;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    embeddingService = new EmbeddingService(embeddingModel, meterRegistry);
  }

  @Test
  void shouldEmbedQueryWithSameModelAsPassages() {
    // Given
    when(embeddingModel.embed(anyString()))
        .thenReturn(Response.from(Embedding.from(new float[] {0.1f, 0.2f, 0.3f})));

    // When
    float[] query = embeddingService.embedQuery("What is this page about?");
    float[] passage = embeddingService.embedPassage("It is about whales.");

    // Then
    assertThat(query).containsExactly(0.1f, 0.2f, 0.3f);
    assertThat(passage).hasSize(3);
    assertThat(meterRegistry.counter("embedding.requests.success", "type", "query").count())
        .isEqualTo(1.0);
    assertThat(meterRegistry.counter("embedding.requests.success", "type", "passage").count())
        .isEqualTo(1.0);
  }

  @Test
  void shouldTruncateLongInput() {
    // Given
    when(embeddingModel.embed(anyString()))
        .thenReturn(Response.from(Embedding.from(new float[] {1f})));

    // When
    embeddingService.embedPassage("a".repeat(6000));

    // Then
    ArgumentCaptor<String> input = ArgumentCaptor.forClass(String.class);
    verify(embeddingModel).embed(input.capture());
    assertThat(input.getValue()).hasSize(EmbeddingService.MAX_CHARS_PER_EMBEDDING);
  }
}
