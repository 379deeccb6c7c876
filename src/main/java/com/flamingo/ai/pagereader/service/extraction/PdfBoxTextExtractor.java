package com.flamingo.ai.pagereader.service.extraction;

import com.flamingo.ai.pagereader.config.ReaderConfig;
import com.flamingo.ai.pagereader.domain.enums.DocumentFormat;
import com.flamingo.ai.pagereader.domain.model.TextBlock;
import com.flamingo.ai.pagereader.exception.DocumentProcessingException;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

/**
 * PDF extraction with Apache PDFBox 3.x, one page at a time.
 *
 * <p>Each page runs on a worker thread and is bounded by {@code reader.processing.page-timeout}. A
 * page that times out or throws becomes a single empty block and extraction moves on. After a
 * timeout the stuck worker still holds the {@link PDDocument}, so the document is reopened from the
 * original bytes for the remaining pages and the old handle is closed on the old worker once it
 * finishes.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PdfBoxTextExtractor implements DocumentExtractor {

  private final ReaderConfig readerConfig;

  @Override
  public ExtractionResult extract(RawUpload upload, ExtractionListener listener) {
    byte[] bytes = upload.bytes();
    Duration timeout = readerConfig.getProcessing().getPageTimeout();

    PDDocument pdf = open(bytes);
    ExecutorService worker = newWorker();
    try {
      ExtractedMetadata metadata = readMetadata(pdf);
      listener.onMetadata(metadata);

      List<TextBlock> blocks = new ArrayList<>();
      int wordCount = 0;
      for (int pageNumber = 1; pageNumber <= metadata.pageCount(); pageNumber++) {
        log.debug("PDF processing page {}/{}", pageNumber, metadata.pageCount());
        final PDDocument current = pdf;
        final int page = pageNumber;
        Future<String> future = worker.submit(() -> extractPageText(current, page));

        String text = "";
        try {
          text = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
          future.cancel(true);
          log.warn(
              "PDF page {}/{} extraction timed out after {}s, using empty page",
              pageNumber,
              metadata.pageCount(),
              timeout.toSeconds());
          retire(worker, current);
          worker = newWorker();
          pdf = open(bytes);
        } catch (ExecutionException e) {
          log.warn(
              "Failed to extract text from PDF page {}/{}: {}",
              pageNumber,
              metadata.pageCount(),
              e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new DocumentProcessingException(null, "PDF extraction interrupted", e);
        }

        List<TextBlock> pageBlocks = toBlocks(text, pageNumber);
        blocks.addAll(pageBlocks);
        wordCount += Paginator.countWords(text);
        listener.onPage(pageNumber, pageBlocks);
      }
      return new ExtractionResult(blocks, metadata, wordCount);
    } finally {
      retire(worker, pdf);
    }
  }

  @Override
  public boolean supports(DocumentFormat format) {
    return format == DocumentFormat.PDF;
  }

  /**
   * Extracts the raw text of one page. Runs on the page worker thread.
   *
   * @param pdf open document, used by one worker at a time
   * @param pageNumber 1-based page
   * @return page text with blank lines between paragraphs
   */
  protected String extractPageText(PDDocument pdf, int pageNumber) throws IOException {
    PDFTextStripper stripper = new PDFTextStripper();
    stripper.setSortByPosition(true);
    stripper.setLineSeparator("\n");
    stripper.setParagraphEnd("\n");
    stripper.setStartPage(pageNumber);
    stripper.setEndPage(pageNumber);
    return stripper.getText(pdf);
  }

  static List<TextBlock> toBlocks(String text, int pageNumber) {
    List<String> paragraphs = Paginator.splitParagraphs(text);
    if (paragraphs.isEmpty()) {
      return List.of(TextBlock.empty(pageNumber));
    }
    List<TextBlock> blocks = new ArrayList<>(paragraphs.size());
    for (int i = 0; i < paragraphs.size(); i++) {
      blocks.add(BlockClassifier.toBlock(paragraphs.get(i), pageNumber, i));
    }
    return blocks;
  }

  private PDDocument open(byte[] bytes) {
    try {
      return Loader.loadPDF(bytes);
    } catch (InvalidPasswordException e) {
      throw new DocumentProcessingException(null, "document is password protected", e);
    } catch (IOException e) {
      log.error("PDFBox failed to open document: {}", e.getMessage());
      throw new DocumentProcessingException(null, "Failed to parse PDF: " + e.getMessage(), e);
    }
  }

  private ExtractedMetadata readMetadata(PDDocument pdf) {
    PDDocumentInformation info = pdf.getDocumentInformation();
    String title = info != null ? clean(info.getTitle()) : null;
    String author = info != null ? clean(info.getAuthor()) : null;
    return new ExtractedMetadata(title, author, pdf.getNumberOfPages(), pdf.isEncrypted());
  }

  private static String clean(String value) {
    if (value == null) {
      return null;
    }
    String sanitized = TextSanitizer.sanitize(value).strip();
    return sanitized.isEmpty() ? null : sanitized;
  }

  private static ExecutorService newWorker() {
    CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("pdf-page-");
    threadFactory.setDaemon(true);
    return Executors.newSingleThreadExecutor(threadFactory);
  }

  /** Closes the document after any task still running on the worker, then stops the worker. */
  private static void retire(ExecutorService worker, PDDocument pdf) {
    worker.execute(() -> close(pdf));
    worker.shutdown();
  }

  private static void close(PDDocument pdf) {
    try {
      pdf.close();
    } catch (IOException e) {
      log.warn("Failed to close PDF document: {}", e.getMessage());
    }
  }
}
