package com.flamingo.ai.pagereader.service.extraction;

/**
 * Format metadata reported before page work starts.
 *
 * @param title title from the source, or null
 * @param author author from the source, or null
 * @param pageCount declared page count, 0 when unknown
 * @param passwordProtected whether the source was encrypted
 */
public record ExtractedMetadata(
    String title, String author, int pageCount, boolean passwordProtected) {}
