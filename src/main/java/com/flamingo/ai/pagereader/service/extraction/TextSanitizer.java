package com.flamingo.ai.pagereader.service.extraction;

/**
 * Removes characters the row store cannot encode: NUL and other C0 controls (tab, line feed and
 * carriage return are kept), DEL, C1 controls and unpaired UTF-16 surrogates. Valid surrogate pairs
 * are copied as a unit, so supplementary characters survive.
 */
public final class TextSanitizer {

  private TextSanitizer() {}

  /**
   * Sanitizes text. Applying it twice gives the same result as applying it once.
   *
   * @param text input, may be null
   * @return sanitized text, empty for null input
   */
  public static String sanitize(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    StringBuilder sb = null;
    int length = text.length();
    for (int i = 0; i < length; i++) {
      char c = text.charAt(i);
      if (Character.isHighSurrogate(c)
          && i + 1 < length
          && Character.isLowSurrogate(text.charAt(i + 1))) {
        if (sb != null) {
          sb.append(c).append(text.charAt(i + 1));
        }
        i++;
        continue;
      }
      if (isAllowed(c)) {
        if (sb != null) {
          sb.append(c);
        }
        continue;
      }
      if (sb == null) {
        sb = new StringBuilder(length);
        sb.append(text, 0, i);
      }
    }
    return sb == null ? text : sb.toString();
  }

  private static boolean isAllowed(char c) {
    if (c == '\t' || c == '\n' || c == '\r') {
      return true;
    }
    if (c < 0x20 || (c >= 0x7F && c <= 0x9F)) {
      return false;
    }
    return !Character.isSurrogate(c);
  }
}
