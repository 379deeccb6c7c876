package com.flamingo.ai.pagereader.service.extraction;

import com.flamingo.ai.pagereader.domain.model.TextBlock;
import java.util.List;

/**
 * Output of an extractor.
 *
 * @param blocks blocks in page order
 * @param metadata format metadata; {@code pageCount} is final here
 * @param wordCount whitespace separated tokens of the extracted text
 */
public record ExtractionResult(List<TextBlock> blocks, ExtractedMetadata metadata, int wordCount) {

  public ExtractionResult {
    blocks = List.copyOf(blocks);
  }
}
