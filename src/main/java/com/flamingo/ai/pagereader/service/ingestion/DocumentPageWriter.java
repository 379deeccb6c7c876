package com.flamingo.ai.pagereader.service.ingestion;

import com.flamingo.ai.pagereader.domain.entity.DocumentPage;
import com.flamingo.ai.pagereader.domain.entity.PageEmbedding;
import com.flamingo.ai.pagereader.domain.repository.DocumentPageRepository;
import com.flamingo.ai.pagereader.domain.repository.PageEmbeddingRepository;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** Writes retrieval rows. Each call is its own transaction so worker threads never share one. */
@Component
@RequiredArgsConstructor
@Slf4j
public class DocumentPageWriter {

  private final DocumentPageRepository pageRepository;
  private final PageEmbeddingRepository embeddingRepository;

  /** Deletes embeddings first, then page rows. */
  @Transactional
  public void deleteRetrievalRows(UUID documentId) {
    int embeddings = embeddingRepository.deleteAllByDocumentId(documentId);
    int pages = pageRepository.deleteAllByDocumentId(documentId);
    log.debug(
        "Removed {} embeddings and {} pages of document {}", embeddings, pages, documentId);
  }

  /** Inserts or replaces the row for (document, page number). */
  @Transactional
  public DocumentPage upsertPage(UUID documentId, int pageNumber, String content) {
    DocumentPage page =
        pageRepository
            .findByDocumentIdAndPageNumber(documentId, pageNumber)
            .orElseGet(
                () -> DocumentPage.builder().documentId(documentId).pageNumber(pageNumber).build());
    page.setContent(content);
    return pageRepository.save(page);
  }

  @Transactional
  public PageEmbedding saveEmbedding(DocumentPage page, float[] vector) {
    return embeddingRepository.save(
        PageEmbedding.builder()
            .documentId(page.getDocumentId())
            .pageId(page.getId())
            .pageNumber(page.getPageNumber())
            .chunkIndex(0)
            .vector(vector)
            .build());
  }
}
