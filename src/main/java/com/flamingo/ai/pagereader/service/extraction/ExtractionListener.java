package com.flamingo.ai.pagereader.service.extraction;

import com.flamingo.ai.pagereader.domain.model.TextBlock;
import java.util.List;

/** Progress callbacks for long-running extraction. Both callbacks run on the extracting thread. */
public interface ExtractionListener {

  /** Listener that ignores all progress. */
  ExtractionListener NONE = new ExtractionListener() {};

  /** Called once, before the first page. */
  default void onMetadata(ExtractedMetadata metadata) {}

  /** Called after each page with that page's blocks (at least one, possibly empty). */
  default void onPage(int pageNumber, List<TextBlock> pageBlocks) {}
}
