package com.flamingo.ai.pagereader.service.extraction;

import com.flamingo.ai.pagereader.domain.enums.DocumentFormat;

/**
 * Turns the bytes of an upload into ordered text blocks.
 *
 * <p>Implementations must sanitize every block before returning it. A failure on a single unit of
 * the source (one PDF page, one EPUB chapter) degrades that unit to empty text; only failures that
 * make the whole source unreadable are thrown.
 */
public interface DocumentExtractor {

  /**
   * Extracts blocks from the upload.
   *
   * @param upload the upload
   * @param listener progress callbacks
   * @return blocks, metadata and word count
   * @throws com.flamingo.ai.pagereader.exception.DocumentProcessingException if the source cannot
   *     be read at all
   */
  ExtractionResult extract(RawUpload upload, ExtractionListener listener);

  boolean supports(DocumentFormat format);
}
