package com.flamingo.ai.pagereader.service.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.pagereader.domain.entity.DocumentPage;
import com.flamingo.ai.pagereader.domain.entity.PageEmbedding;
import com.flamingo.ai.pagereader.domain.repository.DocumentPageRepository;
import com.flamingo.ai.pagereader.domain.repository.PageEmbeddingRepository;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("VectorSearchService Tests")
class VectorSearchServiceTest {

  @Mock private PageEmbeddingRepository embeddingRepository;
  @Mock private DocumentPageRepository pageRepository;

  private VectorSearchService searchService;
  private UUID documentId;

  @BeforeEach
  void setUp() {
    searchService = new VectorSearchService(embeddingRepository, pageRepository);
    documentId = UUID.randomUUID();
    for (int page = 1; page <= 4; page++) {
      int pageNumber = page;
      when(pageRepository.findByDocumentIdAndPageNumber(documentId, pageNumber))
          .thenReturn(
              Optional.of(
                  DocumentPage.builder()
                      .documentId(documentId)
                      .pageNumber(pageNumber)
                      .content("page " + pageNumber)
                      .build()));
    }
  }

  @Test
  void shouldRankPagesByDescendingSimilarity() {
    // Given
    when(embeddingRepository.findByDocumentId(documentId))
        .thenReturn(
            List.of(
                embedding(documentId, 1, 0.5f, 0.5f),
                embedding(documentId, 2, 1f, 0f),
                embedding(documentId, 3, 0.9f, 0.1f)));

    // When
    List<PageHit> hits = searchService.search(documentId, new float[] {1f, 0f}, 5, 0.3);

    // Then
    assertThat(hits).extracting(PageHit::pageNumber).containsExactly(2, 3, 1);
    assertThat(hits.get(0).similarity()).isCloseTo(1.0, within(1e-6));
    assertThat(hits.get(0).content()).isEqualTo("page 2");
  }

  @Test
  void shouldDropHitsBelowThresholdAndLimitToTopK() {
    // Given
    when(embeddingRepository.findByDocumentId(documentId))
        .thenReturn(
            List.of(
                embedding(documentId, 1, 1f, 0f),
                embedding(documentId, 2, 0.8f, 0.2f),
                embedding(documentId, 3, 0.7f, 0.3f),
                embedding(documentId, 4, 0f, 1f)));

    // When
    List<PageHit> hits = searchService.search(documentId, new float[] {1f, 0f}, 2, 0.3);

    // Then
    assertThat(hits).extracting(PageHit::pageNumber).containsExactly(1, 2);
  }

  @Test
  void shouldIgnoreEmbeddingsOfOtherDocuments() {
    // Given
    UUID otherDocument = UUID.randomUUID();
    when(embeddingRepository.findByDocumentId(documentId))
        .thenReturn(
            List.of(embedding(otherDocument, 1, 1f, 0f), embedding(documentId, 2, 1f, 1f)));

    // When
    List<PageHit> hits = searchService.search(documentId, new float[] {1f, 0f}, 5, 0.0);

    // Then
    assertThat(hits).extracting(PageHit::pageNumber).containsExactly(2);
  }

  @Test
  void shouldKeepBestChunkPerPage() {
    // Given
    when(embeddingRepository.findByDocumentId(documentId))
        .thenReturn(
            List.of(embedding(documentId, 1, 0.6f, 0.4f), embedding(documentId, 1, 1f, 0f)));

    // When
    List<PageHit> hits = searchService.search(documentId, new float[] {1f, 0f}, 5, 0.3);

    // Then
    assertThat(hits).hasSize(1);
    assertThat(hits.get(0).similarity()).isCloseTo(1.0, within(1e-6));
  }

  @Test
  void shouldReturnNothingForEmptyQueryVector() {
    List<PageHit> hits = searchService.search(documentId, new float[0], 5, 0.3);

    assertThat(hits).isEmpty();
    verify(embeddingRepository, never()).findByDocumentId(any());
  }

  @Test
  void shouldComputeCosineSimilarity() {
    assertThat(VectorSearchService.cosineSimilarity(new float[] {1, 0}, new float[] {0, 1}))
        .isCloseTo(0.0, within(1e-9));
    assertThat(VectorSearchService.cosineSimilarity(new float[] {2, 2}, new float[] {1, 1}))
        .isCloseTo(1.0, within(1e-6));
    assertThat(VectorSearchService.cosineSimilarity(new float[] {1}, new float[] {1, 2}))
        .isZero();
  }

  private static PageEmbedding embedding(UUID documentId, int pageNumber, float x, float y) {
    return PageEmbedding.builder()
        .documentId(documentId)
        .pageId(UUID.randomUUID())
        .pageNumber(pageNumber)
        .vector(new float[] {x, y})
        .build();
  }
}
