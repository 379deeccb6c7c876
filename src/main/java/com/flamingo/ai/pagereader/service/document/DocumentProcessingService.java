package com.flamingo.ai.pagereader.service.document;

import com.flamingo.ai.pagereader.config.ReaderConfig;
import com.flamingo.ai.pagereader.domain.model.TextBlock;
import com.flamingo.ai.pagereader.exception.DocumentProcessingException;
import com.flamingo.ai.pagereader.service.extraction.DocumentExtractorRouter;
import com.flamingo.ai.pagereader.service.extraction.ExtractedMetadata;
import com.flamingo.ai.pagereader.service.extraction.ExtractionListener;
import com.flamingo.ai.pagereader.service.extraction.ExtractionResult;
import com.flamingo.ai.pagereader.service.extraction.Paginator;
import com.flamingo.ai.pagereader.service.extraction.RawUpload;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Drives a document from PROCESSING to READY or FAILED: extract, paginate, store both
 * representations.
 *
 * <p>While a paginated source is being read, a snapshot of the pages seen so far is written on page
 * 1 and then every {@code reader.processing.partial-write-interval} pages, so readers can open the
 * document before it is finished. A failed snapshot is logged and skipped. Only the terminal write
 * can fail the job.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentProcessingService {

  private final DocumentExtractorRouter extractorRouter;
  private final DocumentStateWriter stateWriter;
  private final ReaderConfig readerConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Processes a document on the calling thread.
   *
   * @param documentId document row in PROCESSING
   * @param upload the original upload
   * @throws DocumentProcessingException if the terminal state could not be written
   */
  @Timed(value = "document.process", description = "Time to process document")
  public void processDocument(UUID documentId, RawUpload upload) {
    log.info(
        "Processing document {} ({}, {} bytes)", documentId, upload.fileName(), upload.size());

    ProcessedContent content;
    try {
      ProgressWriter progress = new ProgressWriter(documentId);
      ExtractionResult result = extractorRouter.route(upload.format()).extract(upload, progress);
      content = ProcessedContent.from(result);
    } catch (RuntimeException e) {
      log.error("Failed to process document {}: {}", documentId, e.getMessage(), e);
      meterRegistry.counter("document.processing.failure").increment();
      writeFailure(documentId, e);
      return;
    }

    try {
      stateWriter.markReady(documentId, content);
    } catch (RuntimeException e) {
      log.error("Failed to store processed document {}: {}", documentId, e.getMessage(), e);
      meterRegistry.counter("document.processing.failure").increment();
      writeFailure(documentId, e);
      return;
    }
    meterRegistry.counter("document.processing.success").increment();
    log.info(
        "Document {} ready: {} pages, {} blocks",
        documentId,
        content.pages().size(),
        content.blocks().size());
  }

  /**
   * Processes a document on the background executor. The task reloads the row by id and reports
   * only through the document's own state.
   */
  @Async("documentProcessingExecutor")
  public void processDocumentAsync(UUID documentId, RawUpload upload) {
    try {
      processDocument(documentId, upload);
    } catch (RuntimeException e) {
      log.error(
          "Background processing of document {} ended without a terminal state: {}",
          documentId,
          e.getMessage(),
          e);
    }
  }

  private void writeFailure(UUID documentId, RuntimeException cause) {
    String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
    try {
      stateWriter.markFailed(documentId, message);
    } catch (RuntimeException e) {
      log.error("Failed to mark document {} as failed: {}", documentId, e.getMessage(), e);
      throw new DocumentProcessingException(
          documentId, "Could not record processing failure for document " + documentId, e);
    }
  }

  /** Keeps the pages extracted so far and writes throttled snapshots. */
  private final class ProgressWriter implements ExtractionListener {

    private final UUID documentId;
    private final int interval;
    private final List<String> pages = new ArrayList<>();
    private int lastWrittenPage = 0;

    private ProgressWriter(UUID documentId) {
      this.documentId = documentId;
      this.interval = Math.max(1, readerConfig.getProcessing().getPartialWriteInterval());
    }

    @Override
    public void onMetadata(ExtractedMetadata metadata) {
      while (pages.size() < metadata.pageCount()) {
        pages.add("");
      }
    }

    @Override
    public void onPage(int pageNumber, List<TextBlock> pageBlocks) {
      while (pages.size() < pageNumber) {
        pages.add("");
      }
      pages.set(pageNumber - 1, Paginator.joinBlocks(pageBlocks));

      if (pageNumber == 1 || pageNumber - lastWrittenPage >= interval) {
        lastWrittenPage = pageNumber;
        writeSnapshot(pageNumber);
      }
    }

    private void writeSnapshot(int pageNumber) {
      List<String> snapshot = List.copyOf(pages);
      try {
        stateWriter.writePartialPages(documentId, snapshot, ContentFingerprints.of(snapshot));
        meterRegistry.counter("document.processing.partial_writes").increment();
        log.debug("Wrote partial pages of document {} up to page {}", documentId, pageNumber);
      } catch (RuntimeException e) {
        log.warn(
            "Partial page write for document {} at page {} failed: {}",
            documentId,
            pageNumber,
            e.getMessage());
      }
    }
  }
}
