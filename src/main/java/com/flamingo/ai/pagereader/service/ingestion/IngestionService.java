package com.flamingo.ai.pagereader.service.ingestion;

import com.flamingo.ai.pagereader.config.ReaderConfig;
import com.flamingo.ai.pagereader.domain.entity.Document;
import com.flamingo.ai.pagereader.domain.entity.DocumentPage;
import com.flamingo.ai.pagereader.domain.entity.PageEmbedding;
import com.flamingo.ai.pagereader.exception.DocumentProcessingException;
import com.flamingo.ai.pagereader.exception.IngestionInterruptedException;
import com.flamingo.ai.pagereader.service.document.DocumentService;
import com.flamingo.ai.pagereader.service.quota.EntitlementService;
import com.flamingo.ai.pagereader.service.retrieval.EmbeddingService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds the retrieval rows of a document: one row per non-blank optimized page, then one
 * embedding per stored page. Existing rows are removed first, so running it twice leaves exactly
 * one row per page.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionService {

  private final EntitlementService entitlementService;
  private final DocumentService documentService;
  private final DocumentPageWriter pageWriter;
  private final EmbeddingService embeddingService;
  private final ReaderConfig readerConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Ingests a document of the caller for retrieval.
   *
   * @throws com.flamingo.ai.pagereader.exception.UpgradeRequiredException if the plan has no
   *     assistant
   * @throws DocumentProcessingException if the document has no optimized pages
   * @throws IngestionInterruptedException if the calling thread is interrupted
   */
  @Timed(value = "ingestion.document", description = "Time to ingest a document")
  public IngestionReport ingestDocument(String ownerId, UUID documentId) {
    entitlementService.ensureEntitled(ownerId);
    Document document = documentService.getDocument(ownerId, documentId);

    List<String> pages = document.getOptimizedPages();
    if (pages == null || pages.isEmpty()) {
      throw new DocumentProcessingException(documentId, "document has no content to ingest");
    }

    try {
      pageWriter.deleteRetrievalRows(documentId);
    } catch (RuntimeException e) {
      log.warn("Cleanup of retrieval rows for document {} failed: {}", documentId, e.getMessage());
    }

    List<PageInput> inputs = new ArrayList<>();
    for (int i = 0; i < pages.size(); i++) {
      String content = pages.get(i);
      if (content != null && !content.isBlank()) {
        inputs.add(new PageInput(i + 1, content));
      }
    }
    log.info(
        "Ingesting document {}: {} of {} pages have content",
        documentId,
        inputs.size(),
        pages.size());

    try {
      BoundedWorkerPool.BatchOutcome<DocumentPage> pageOutcome =
          new BoundedWorkerPool("ingest-page", readerConfig.getIngestion().getPageWorkers())
              .process(
                  inputs,
                  input -> pageWriter.upsertPage(documentId, input.pageNumber(), input.content()));
      meterRegistry.counter("ingestion.pages.persisted").increment(pageOutcome.results().size());
      meterRegistry.counter("ingestion.pages.failed").increment(pageOutcome.failed());

      BoundedWorkerPool.BatchOutcome<PageEmbedding> embedOutcome =
          new BoundedWorkerPool("ingest-embed", readerConfig.getIngestion().getEmbedWorkers())
              .process(pageOutcome.results(), this::embedPage);
      meterRegistry.counter("ingestion.embeddings.stored").increment(embedOutcome.results().size());
      meterRegistry.counter("ingestion.embeddings.failed").increment(embedOutcome.failed());

      IngestionReport report =
          new IngestionReport(
              inputs.size(), pageOutcome.results().size(), embedOutcome.results().size());
      log.info(
          "Ingested document {}: {} pages, {} embeddings",
          documentId,
          report.pagesPersisted(),
          report.embeddingsStored());
      return report;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Ingestion of document {} interrupted", documentId);
      throw new IngestionInterruptedException(documentId, e);
    }
  }

  /** Returns null when the model produced no vector, which the pool counts as a failure. */
  private PageEmbedding embedPage(DocumentPage page) {
    float[] vector = embeddingService.embedPassage(page.getContent());
    if (vector == null || vector.length == 0) {
      log.warn(
          "No embedding for page {} of document {}", page.getPageNumber(), page.getDocumentId());
      return null;
    }
    return pageWriter.saveEmbedding(page, vector);
  }

  private record PageInput(int pageNumber, String content) {}
}
