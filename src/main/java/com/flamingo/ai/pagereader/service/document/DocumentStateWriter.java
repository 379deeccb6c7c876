package com.flamingo.ai.pagereader.service.document;

import com.flamingo.ai.pagereader.domain.entity.Document;
import com.flamingo.ai.pagereader.domain.model.ContentFingerprint;
import com.flamingo.ai.pagereader.domain.repository.DocumentRepository;
import com.flamingo.ai.pagereader.exception.DocumentNotFoundException;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Writes document state, each call in its own transaction. Calls that hit SQLite lock contention
 * are retried with a short back-off; every attempt reloads the row.
 */
@Service
@Slf4j
public class DocumentStateWriter {

  private static final int MAX_RETRIES = 3;
  private static final long RETRY_DELAY_MS = 100;

  private final DocumentRepository documentRepository;
  private final TransactionTemplate transactionTemplate;

  public DocumentStateWriter(
      DocumentRepository documentRepository, PlatformTransactionManager transactionManager) {
    this.documentRepository = documentRepository;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.transactionTemplate.setPropagationBehavior(
        TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  /** Inserts a new document row. */
  public Document create(Document document) {
    return withRetry("create", null, () -> documentRepository.saveAndFlush(document));
  }

  /** Replaces the optimized pages with a partial snapshot. */
  public Document writePartialPages(
      UUID documentId, List<String> pages, ContentFingerprint fingerprint) {
    return update(
        "write partial pages",
        documentId,
        document -> document.applyPartialPages(pages, fingerprint));
  }

  /** Stores the final content and moves the document to READY. */
  public Document markReady(UUID documentId, ProcessedContent content) {
    return update(
        "mark ready",
        documentId,
        document -> {
          if (content.metadata().title() != null) {
            document.setTitle(content.metadata().title());
          }
          if (content.metadata().author() != null) {
            document.setAuthor(content.metadata().author());
          }
          document.setHasPassword(content.metadata().passwordProtected());
          document.setPageCount(content.pages().size());
          document.setWordCount(content.wordCount());
          document.markReady(
              content.blocks(),
              content.richFingerprint(),
              content.pages(),
              content.optimizedFingerprint());
        });
  }

  /** Moves the document to FAILED, keeping the error message. */
  public Document markFailed(UUID documentId, String errorMessage) {
    return update("mark failed", documentId, document -> document.markFailed(errorMessage));
  }

  private Document update(String action, UUID documentId, Consumer<Document> mutation) {
    return withRetry(
        action,
        documentId,
        () -> {
          Document document =
              documentRepository
                  .findById(documentId)
                  .orElseThrow(() -> new DocumentNotFoundException(documentId));
          mutation.accept(document);
          return documentRepository.saveAndFlush(document);
        });
  }

  private Document withRetry(String action, UUID documentId, Supplier<Document> work) {
    for (int attempt = 1; ; attempt++) {
      try {
        return transactionTemplate.execute(status -> work.get());
      } catch (CannotAcquireLockException e) {
        if (attempt == MAX_RETRIES) {
          log.error("Failed to {} document {} after {} retries", action, documentId, MAX_RETRIES);
          throw e;
        }
        log.warn(
            "SQLite lock contention on document {} ({}), retry {}/{}",
            documentId,
            action,
            attempt,
            MAX_RETRIES);
        try {
          Thread.sleep(RETRY_DELAY_MS * attempt);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw e;
        }
      }
    }
  }
}
