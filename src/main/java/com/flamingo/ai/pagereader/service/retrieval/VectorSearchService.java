package com.flamingo.ai.pagereader.service.retrieval;

import com.flamingo.ai.pagereader.domain.entity.DocumentPage;
import com.flamingo.ai.pagereader.domain.entity.PageEmbedding;
import com.flamingo.ai.pagereader.domain.repository.DocumentPageRepository;
import com.flamingo.ai.pagereader.domain.repository.PageEmbeddingRepository;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Cosine similarity search over the page embeddings of a single document. */
@Service
@RequiredArgsConstructor
@Slf4j
public class VectorSearchService {

  private final PageEmbeddingRepository embeddingRepository;
  private final DocumentPageRepository pageRepository;

  /**
   * Finds the pages of {@code documentId} closest to {@code queryVector}.
   *
   * @param documentId document to search; embeddings of other documents are never considered
   * @param queryVector prompt embedding
   * @param topK maximum number of pages
   * @param minSimilarity hits below this cosine similarity are dropped
   * @return hits ordered by descending similarity, one per page
   */
  @Transactional(readOnly = true)
  @Timed(value = "retrieval.search", description = "Time to search page embeddings")
  public List<PageHit> search(
      UUID documentId, float[] queryVector, int topK, double minSimilarity) {
    if (queryVector == null || queryVector.length == 0 || topK <= 0) {
      return List.of();
    }

    Map<Integer, Double> bestByPage = new HashMap<>();
    for (PageEmbedding embedding : embeddingRepository.findByDocumentId(documentId)) {
      if (!documentId.equals(embedding.getDocumentId())) {
        continue;
      }
      double similarity = cosineSimilarity(queryVector, embedding.getVector());
      if (similarity >= minSimilarity) {
        bestByPage.merge(embedding.getPageNumber(), similarity, Math::max);
      }
    }
    if (bestByPage.isEmpty()) {
      return List.of();
    }

    List<Map.Entry<Integer, Double>> ranked = new ArrayList<>(bestByPage.entrySet());
    ranked.sort(
        Map.Entry.<Integer, Double>comparingByValue(Comparator.reverseOrder())
            .thenComparing(Map.Entry.comparingByKey()));

    List<PageHit> hits = new ArrayList<>();
    for (Map.Entry<Integer, Double> entry : ranked) {
      if (hits.size() >= topK) {
        break;
      }
      pageRepository
          .findByDocumentIdAndPageNumber(documentId, entry.getKey())
          .map(DocumentPage::getContent)
          .ifPresent(content -> hits.add(new PageHit(entry.getKey(), content, entry.getValue())));
    }
    log.debug("Search in document {} returned {} pages", documentId, hits.size());
    return hits;
  }

  /** Cosine similarity; 0 for mismatched or zero-length vectors. */
  static double cosineSimilarity(float[] a, float[] b) {
    if (a == null || b == null || a.length == 0 || a.length != b.length) {
      return 0.0;
    }
    double dot = 0;
    double normA = 0;
    double normB = 0;
    for (int i = 0; i < a.length; i++) {
      dot += (double) a[i] * b[i];
      normA += (double) a[i] * a[i];
      normB += (double) b[i] * b[i];
    }
    if (normA == 0 || normB == 0) {
      return 0.0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }
}
