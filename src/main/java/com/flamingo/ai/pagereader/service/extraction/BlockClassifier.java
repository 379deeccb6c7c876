package com.flamingo.ai.pagereader.service.extraction;

import com.flamingo.ai.pagereader.domain.model.TextBlock;
import java.util.Locale;

/**
 * Heading heuristic for extracted paragraphs. A paragraph is a heading when it is a single line
 * under 100 characters and either all uppercase (longer than 3 characters) or under 50 characters.
 * There is no ground truth to tune this against, so it is a best guess and nothing relies on it
 * being exact.
 */
public final class BlockClassifier {

  static final int MAX_HEADING_LENGTH = 100;
  static final int SHORT_HEADING_LENGTH = 50;
  static final int MIN_UPPERCASE_HEADING_LENGTH = 3;

  private BlockClassifier() {}

  public static boolean isHeading(String text) {
    if (text == null) {
      return false;
    }
    String trimmed = text.strip();
    if (trimmed.isEmpty() || trimmed.indexOf('\n') >= 0) {
      return false;
    }
    if (trimmed.length() >= MAX_HEADING_LENGTH) {
      return false;
    }
    if (trimmed.length() > MIN_UPPERCASE_HEADING_LENGTH
        && trimmed.equals(trimmed.toUpperCase(Locale.ROOT))) {
      return true;
    }
    return trimmed.length() < SHORT_HEADING_LENGTH;
  }

  /** Builds a heading or paragraph block for already sanitized content. */
  public static TextBlock toBlock(String content, int pageNumber, int positionInPage) {
    return isHeading(content)
        ? TextBlock.heading(content, pageNumber, positionInPage)
        : TextBlock.paragraph(content, pageNumber, positionInPage);
  }
}
