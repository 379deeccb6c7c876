package com.flamingo.ai.pagereader.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TextSanitizer Tests")
class TextSanitizerTest {

  @Test
  void shouldRemoveNulAndControlCharacters() {
    // Given
    String text = "a\u0000b\u0001c\u001Fd";

    // When
    String result = TextSanitizer.sanitize(text);

    // Then
    assertThat(result).isEqualTo("abcd");
  }

  @Test
  void shouldKeepTabsAndLineBreaks() {
    assertThat(TextSanitizer.sanitize("a\tb\nc\r\nd")).isEqualTo("a\tb\nc\r\nd");
  }

  @Test
  void shouldRemoveDeleteAndC1Controls() {
    assertThat(TextSanitizer.sanitize("x\u007Fy\u0085z\u009F")).isEqualTo("xyz");
  }

  @Test
  void shouldDropLoneSurrogatesButKeepPairs() {
    // Given
    String emoji = new String(Character.toChars(0x1F600));
    String text = "a\uD800b" + emoji + "c\uDC00";

    // When
    String result = TextSanitizer.sanitize(text);

    // Then
    assertThat(result).isEqualTo("ab" + emoji + "c");
  }

  @Test
  void shouldBeIdempotent() {
    String text = "\u0000Hello\u0085 \uD800world\u0007";

    String once = TextSanitizer.sanitize(text);

    assertThat(TextSanitizer.sanitize(once)).isEqualTo(once);
  }

  @Test
  void shouldReturnEmptyStringForNull() {
    assertThat(TextSanitizer.sanitize(null)).isEmpty();
  }

  @Test
  void shouldReturnSameInstanceWhenNothingToRemove() {
    String text = "clean text";

    assertThat(TextSanitizer.sanitize(text)).isSameAs(text);
  }
}
