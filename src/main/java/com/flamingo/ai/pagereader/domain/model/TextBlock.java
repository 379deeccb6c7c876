package com.flamingo.ai.pagereader.domain.model;

import com.flamingo.ai.pagereader.domain.enums.BlockKind;

/**
 * One extracted unit of text. Blocks of the same page are contiguous and ordered by {@code
 * positionInPage}.
 *
 * @param content sanitized text
 * @param kind paragraph or heading
 * @param headingLevel 1 for headings, 0 for paragraphs
 * @param pageNumber 1-based page
 * @param positionInPage 0-based order within the page
 */
public record TextBlock(
    String content, BlockKind kind, int headingLevel, int pageNumber, int positionInPage) {

  public static TextBlock paragraph(String content, int pageNumber, int positionInPage) {
    return new TextBlock(content, BlockKind.PARAGRAPH, 0, pageNumber, positionInPage);
  }

  public static TextBlock heading(String content, int pageNumber, int positionInPage) {
    return new TextBlock(content, BlockKind.HEADING, 1, pageNumber, positionInPage);
  }

  /** Placeholder emitted for pages whose text could not be extracted. */
  public static TextBlock empty(int pageNumber) {
    return paragraph("", pageNumber, 0);
  }
}
