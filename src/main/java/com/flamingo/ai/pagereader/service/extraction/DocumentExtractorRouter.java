package com.flamingo.ai.pagereader.service.extraction;

import com.flamingo.ai.pagereader.domain.enums.DocumentFormat;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** Routes a document format to the first {@link DocumentExtractor} that supports it. */
@Service
@RequiredArgsConstructor
public class DocumentExtractorRouter {

  private final List<DocumentExtractor> extractors;

  /**
   * Returns the extractor for the format.
   *
   * @throws IllegalStateException if no extractor is registered for the format
   */
  public DocumentExtractor route(DocumentFormat format) {
    return extractors.stream()
        .filter(e -> e.supports(format))
        .findFirst()
        .orElseThrow(
            () -> new IllegalStateException("No DocumentExtractor found for format: " + format));
  }
}
