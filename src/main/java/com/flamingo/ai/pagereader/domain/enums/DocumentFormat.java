package com.flamingo.ai.pagereader.domain.enums;

import java.util.Locale;
import java.util.Optional;

/** Upload formats the extractor understands. */
public enum DocumentFormat {
  PDF("pdf", "application/pdf", true),
  EPUB("epub", "application/epub+zip", false),
  TXT("txt", "text/plain", false),
  MD("md", "text/markdown", false);

  private final String extension;
  private final String mimeType;
  private final boolean paginated;

  DocumentFormat(String extension, String mimeType, boolean paginated) {
    this.extension = extension;
    this.mimeType = mimeType;
    this.paginated = paginated;
  }

  public String getExtension() {
    return extension;
  }

  public String getMimeType() {
    return mimeType;
  }

  /** Whether the source format carries its own page boundaries. */
  public boolean isPaginated() {
    return paginated;
  }

  /**
   * Resolves the format from the file name extension, falling back to the detected MIME type.
   *
   * @param fileName original file name, may be null
   * @param detectedMimeType MIME type from content sniffing, may be null
   * @return the format, or empty when neither hint is supported
   */
  public static Optional<DocumentFormat> resolve(String fileName, String detectedMimeType) {
    if (fileName != null) {
      int dot = fileName.lastIndexOf('.');
      if (dot >= 0 && dot < fileName.length() - 1) {
        String ext = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        if ("markdown".equals(ext)) {
          return Optional.of(MD);
        }
        for (DocumentFormat format : values()) {
          if (format.extension.equals(ext)) {
            return Optional.of(format);
          }
        }
      }
    }
    if (detectedMimeType != null) {
      for (DocumentFormat format : values()) {
        if (format.mimeType.equalsIgnoreCase(detectedMimeType)) {
          return Optional.of(format);
        }
      }
    }
    return Optional.empty();
  }
}
