package com.flamingo.ai.pagereader.service.document;

import com.flamingo.ai.pagereader.domain.entity.Document;

/**
 * Lightweight read of a document's optimized pages together with the read state that decides the
 * response status.
 *
 * @param document the document
 * @param state readiness as seen by the reader
 * @param includePages whether pages belong in the response
 */
public record OptimizedDocumentView(Document document, ReadState state, boolean includePages) {

  /** Readiness of the optimized representation. */
  public enum ReadState {
    /** Still processing and nothing to show yet. */
    NOT_READY,
    /** Still processing (or failed) but some pages can be shown. */
    PARTIAL,
    READY
  }

  static OptimizedDocumentView of(Document document, boolean includePages) {
    ReadState state;
    if (document.isReady()) {
      state = ReadState.READY;
    } else if (includePages && document.hasPages()) {
      state = ReadState.PARTIAL;
    } else {
      state = ReadState.NOT_READY;
    }
    return new OptimizedDocumentView(document, state, includePages);
  }

  /** Quoted checksum of the optimized pages, or null before the first snapshot. */
  public String etag() {
    String checksum = document.getOptimizedChecksumSha256();
    return checksum == null || checksum.isEmpty() ? null : "\"" + checksum + "\"";
  }

  /** Whether an {@code If-None-Match} value (quoted or bare) names the current checksum. */
  public boolean matches(String ifNoneMatch) {
    String etag = etag();
    if (etag == null || ifNoneMatch == null || ifNoneMatch.isBlank()) {
      return false;
    }
    String candidate = ifNoneMatch.strip();
    return candidate.equals(etag)
        || stripQuotes(candidate).equals(document.getOptimizedChecksumSha256());
  }

  private static String stripQuotes(String value) {
    int start = 0;
    int end = value.length();
    while (start < end && value.charAt(start) == '"') {
      start++;
    }
    while (end > start && value.charAt(end - 1) == '"') {
      end--;
    }
    return value.substring(start, end);
  }
}
