package com.flamingo.ai.pagereader.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.pagereader.config.ReaderConfig;
import com.flamingo.ai.pagereader.domain.entity.Document;
import com.flamingo.ai.pagereader.domain.entity.DocumentPage;
import com.flamingo.ai.pagereader.domain.entity.PageEmbedding;
import com.flamingo.ai.pagereader.exception.DocumentProcessingException;
import com.flamingo.ai.pagereader.exception.UpgradeRequiredException;
import com.flamingo.ai.pagereader.service.document.DocumentService;
import com.flamingo.ai.pagereader.service.quota.EntitlementService;
import com.flamingo.ai.pagereader.service.retrieval.EmbeddingService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("IngestionService Tests")
class IngestionServiceTest {

  private static final String OWNER = "owner-1";

  @Mock private EntitlementService entitlementService;
  @Mock private DocumentService documentService;
  @Mock private DocumentPageWriter pageWriter;
  @Mock private EmbeddingService embeddingService;

  private SimpleMeterRegistry meterRegistry;
  private IngestionService ingestionService;
  private UUID documentId;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    ingestionService =
        new IngestionService(
            entitlementService,
            documentService,
            pageWriter,
            embeddingService,
            new ReaderConfig(),
            meterRegistry);
    documentId = UUID.randomUUID();

    when(pageWriter.upsertPage(eq(documentId), anyInt(), anyString()))
        .thenAnswer(
            invocation ->
                DocumentPage.builder()
                    .id(UUID.randomUUID())
                    .documentId(invocation.getArgument(0))
                    .pageNumber(invocation.getArgument(1))
                    .content(invocation.getArgument(2))
                    .build());
    when(pageWriter.saveEmbedding(any(DocumentPage.class), any(float[].class)))
        .thenAnswer(invocation -> PageEmbedding.builder().id(UUID.randomUUID()).build());
    when(embeddingService.embedPassage(anyString())).thenReturn(new float[] {0.1f, 0.2f});
  }

  @Test
  void shouldDeleteOldRowsThenStoreOneRowAndEmbeddingPerNonBlankPage() {
    // Given
    givenDocumentWithPages("first", "  ", "third");

    // When
    IngestionReport report = ingestionService.ingestDocument(OWNER, documentId);

    // Then
    assertThat(report).isEqualTo(new IngestionReport(2, 2, 2));
    InOrder order = inOrder(pageWriter);
    order.verify(pageWriter).deleteRetrievalRows(documentId);
    order.verify(pageWriter, times(2)).upsertPage(eq(documentId), anyInt(), anyString());
    verify(pageWriter).upsertPage(documentId, 1, "first");
    verify(pageWriter).upsertPage(documentId, 3, "third");
    verify(pageWriter, never()).upsertPage(documentId, 2, "  ");
    assertThat(meterRegistry.counter("ingestion.embeddings.stored").count()).isEqualTo(2.0);
  }

  @Test
  void shouldSkipPagesWithoutEmbedding() {
    // Given
    givenDocumentWithPages("first", "second");
    when(embeddingService.embedPassage("second")).thenReturn(new float[0]);

    // When
    IngestionReport report = ingestionService.ingestDocument(OWNER, documentId);

    // Then
    assertThat(report.pagesPersisted()).isEqualTo(2);
    assertThat(report.embeddingsStored()).isEqualTo(1);
    assertThat(meterRegistry.counter("ingestion.embeddings.failed").count()).isEqualTo(1.0);
  }

  @Test
  void shouldContinueWhenOnePageFailsToPersist() {
    // Given
    givenDocumentWithPages("first", "second", "third");
    when(pageWriter.upsertPage(documentId, 2, "second"))
        .thenThrow(new IllegalStateException("database is locked"));

    // When
    IngestionReport report = ingestionService.ingestDocument(OWNER, documentId);

    // Then
    assertThat(report).isEqualTo(new IngestionReport(3, 2, 2));
    assertThat(meterRegistry.counter("ingestion.pages.failed").count()).isEqualTo(1.0);
  }

  @Test
  void shouldContinueWhenCleanupFails() {
    // Given
    givenDocumentWithPages("only");
    doThrow(new IllegalStateException("cleanup failed"))
        .when(pageWriter)
        .deleteRetrievalRows(documentId);

    // When
    IngestionReport report = ingestionService.ingestDocument(OWNER, documentId);

    // Then
    assertThat(report.pagesPersisted()).isEqualTo(1);
  }

  @Test
  void shouldRejectDocumentWithoutPagesBeforeTouchingRows() {
    // Given
    givenDocumentWithPages();

    // When / Then
    assertThatThrownBy(() -> ingestionService.ingestDocument(OWNER, documentId))
        .isInstanceOf(DocumentProcessingException.class)
        .hasMessageContaining("no content to ingest");
    verifyNoInteractions(pageWriter, embeddingService);
  }

  @Test
  void shouldRequireAssistantPlan() {
    // Given
    when(entitlementService.ensureEntitled(OWNER))
        .thenThrow(new UpgradeRequiredException(OWNER, "free"));

    // When / Then
    assertThatThrownBy(() -> ingestionService.ingestDocument(OWNER, documentId))
        .isInstanceOf(UpgradeRequiredException.class);
    verifyNoInteractions(documentService, pageWriter);
  }

  private void givenDocumentWithPages(String... pages) {
    Document document =
        Document.builder().id(documentId).ownerId(OWNER).optimizedPages(List.of(pages)).build();
    when(documentService.getDocument(OWNER, documentId)).thenReturn(document);
  }
}
