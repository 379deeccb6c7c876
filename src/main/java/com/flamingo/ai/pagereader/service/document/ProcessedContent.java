package com.flamingo.ai.pagereader.service.document;

import com.flamingo.ai.pagereader.domain.model.ContentFingerprint;
import com.flamingo.ai.pagereader.domain.model.TextBlock;
import com.flamingo.ai.pagereader.service.extraction.ExtractedMetadata;
import com.flamingo.ai.pagereader.service.extraction.ExtractionResult;
import com.flamingo.ai.pagereader.service.extraction.Paginator;
import java.util.List;

/** Final representations of a document, ready for the terminal write. */
public record ProcessedContent(
    List<TextBlock> blocks,
    ContentFingerprint richFingerprint,
    List<String> pages,
    ContentFingerprint optimizedFingerprint,
    ExtractedMetadata metadata,
    int wordCount) {

  public static ProcessedContent from(ExtractionResult result) {
    List<String> pages = Paginator.toPages(result.blocks(), result.metadata().pageCount());
    return new ProcessedContent(
        result.blocks(),
        ContentFingerprints.of(result.blocks()),
        pages,
        ContentFingerprints.of(pages),
        result.metadata(),
        result.wordCount());
  }
}
