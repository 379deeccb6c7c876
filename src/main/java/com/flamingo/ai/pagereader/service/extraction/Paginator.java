package com.flamingo.ai.pagereader.service.extraction;

import com.flamingo.ai.pagereader.config.ReaderConfig;
import com.flamingo.ai.pagereader.domain.model.TextBlock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Converts blocks to the dense per-page string array and packs unpaginated text into synthetic
 * pages.
 */
@Component
@RequiredArgsConstructor
public class Paginator {

  static final String PARAGRAPH_SEPARATOR = "\n\n";

  private static final Comparator<TextBlock> PAGE_ORDER =
      Comparator.comparingInt(TextBlock::pageNumber).thenComparingInt(TextBlock::positionInPage);

  private final ReaderConfig readerConfig;

  /**
   * Builds the optimized page array. Index {@code i} holds page {@code i + 1}; the length is the
   * larger of the declared page count and the highest page seen. Pages without content are empty
   * strings. Blocks are sorted first, so emission order does not matter.
   *
   * @param blocks extracted blocks, not modified
   * @param declaredPageCount page count reported by the source, 0 when unknown
   * @return dense page strings
   */
  public static List<String> toPages(List<TextBlock> blocks, int declaredPageCount) {
    List<TextBlock> sorted = new ArrayList<>(blocks);
    sorted.sort(PAGE_ORDER);

    int pageCount = Math.max(declaredPageCount, 0);
    for (TextBlock block : sorted) {
      pageCount = Math.max(pageCount, block.pageNumber());
    }

    List<StringBuilder> builders = new ArrayList<>(pageCount);
    for (int i = 0; i < pageCount; i++) {
      builders.add(new StringBuilder());
    }
    for (TextBlock block : sorted) {
      if (block.pageNumber() <= 0) {
        continue;
      }
      String text = block.content() == null ? "" : block.content().strip();
      if (text.isEmpty()) {
        continue;
      }
      StringBuilder page = builders.get(block.pageNumber() - 1);
      if (page.length() > 0) {
        page.append(PARAGRAPH_SEPARATOR);
      }
      page.append(text);
    }

    List<String> pages = new ArrayList<>(pageCount);
    for (StringBuilder builder : builders) {
      pages.add(builder.toString());
    }
    return pages;
  }

  /**
   * Splits text into synthetic pages of at most {@code reader.processing.synthetic-page-chars}
   * characters, counting the blank-line separator. A paragraph longer than the budget gets a page
   * of its own and is never split. Every page has at least one block; empty text yields a single
   * empty page.
   *
   * @param text unpaginated text
   * @return sanitized, classified blocks with synthetic page numbers
   */
  public List<TextBlock> paginate(String text) {
    List<List<String>> pages =
        packPages(splitParagraphs(text), readerConfig.getProcessing().getSyntheticPageChars());
    if (pages.isEmpty()) {
      return List.of(TextBlock.empty(1));
    }

    List<TextBlock> blocks = new ArrayList<>();
    for (int i = 0; i < pages.size(); i++) {
      int pageNumber = i + 1;
      int position = 0;
      for (String paragraph : pages.get(i)) {
        blocks.add(BlockClassifier.toBlock(paragraph, pageNumber, position++));
      }
      if (position == 0) {
        blocks.add(TextBlock.empty(pageNumber));
      }
    }
    return blocks;
  }

  /**
   * Splits on blank lines. Line breaks inside a paragraph become spaces; paragraphs are trimmed,
   * sanitized and dropped when empty.
   */
  static List<String> splitParagraphs(String text) {
    List<String> paragraphs = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return paragraphs;
    }
    String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
    for (String raw : normalized.split(PARAGRAPH_SEPARATOR)) {
      String paragraph = TextSanitizer.sanitize(raw.replace('\n', ' ')).strip();
      if (!paragraph.isEmpty()) {
        paragraphs.add(paragraph);
      }
    }
    return paragraphs;
  }

  static List<List<String>> packPages(List<String> paragraphs, int budget) {
    List<List<String>> pages = new ArrayList<>();
    List<String> current = new ArrayList<>();
    int currentLength = 0;

    for (String paragraph : paragraphs) {
      if (current.isEmpty() && paragraph.length() > budget) {
        pages.add(List.of(paragraph));
        continue;
      }
      if (!current.isEmpty()
          && currentLength + PARAGRAPH_SEPARATOR.length() + paragraph.length() > budget) {
        pages.add(current);
        current = new ArrayList<>();
        currentLength = 0;
      }
      if (!current.isEmpty()) {
        currentLength += PARAGRAPH_SEPARATOR.length();
      }
      current.add(paragraph);
      currentLength += paragraph.length();
    }
    if (!current.isEmpty()) {
      pages.add(current);
    }
    return pages;
  }

  /** Text of a single page: trimmed, non-empty block contents joined by blank lines. */
  public static String joinBlocks(List<TextBlock> pageBlocks) {
    StringBuilder page = new StringBuilder();
    for (TextBlock block : pageBlocks) {
      String text = block.content() == null ? "" : block.content().strip();
      if (text.isEmpty()) {
        continue;
      }
      if (page.length() > 0) {
        page.append(PARAGRAPH_SEPARATOR);
      }
      page.append(text);
    }
    return page.toString();
  }

  /** Counts whitespace separated tokens. */
  public static int countWords(String text) {
    if (text == null || text.isBlank()) {
      return 0;
    }
    return text.strip().split("\\s+").length;
  }
}
