package com.flamingo.ai.pagereader.domain.entity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.pagereader.domain.enums.ProcessingStatus;
import com.flamingo.ai.pagereader.domain.model.ContentFingerprint;
import com.flamingo.ai.pagereader.domain.model.TextBlock;
import java.util.List;
import org.junit.jupiter.api.Test;

class DocumentTest {

  private static final ContentFingerprint FINGERPRINT = new ContentFingerprint("abc", 10);

  @Test
  void shouldStartInProcessingWithoutPages() {
    Document document = Document.builder().ownerId("owner").build();

    assertThat(document.getProcessingStatus()).isEqualTo(ProcessingStatus.PROCESSING);
    assertThat(document.hasPages()).isFalse();
    assertThat(document.isReady()).isFalse();
  }

  @Test
  void shouldAcceptPartialPagesWhileProcessing() {
    // Given
    Document document = Document.builder().ownerId("owner").build();

    // When
    document.applyPartialPages(List.of("one", ""), FINGERPRINT);

    // Then
    assertThat(document.getOptimizedPages()).containsExactly("one", "");
    assertThat(document.getOptimizedChecksumSha256()).isEqualTo("abc");
    assertThat(document.getProcessingStatus()).isEqualTo(ProcessingStatus.PROCESSING);
  }

  @Test
  void shouldBecomeReadyWithBothRepresentations() {
    // Given
    Document document = Document.builder().ownerId("owner").build();

    // When
    document.markReady(
        List.of(TextBlock.paragraph("one", 1, 0)),
        new ContentFingerprint("rich", 5),
        List.of("one"),
        FINGERPRINT);

    // Then
    assertThat(document.isReady()).isTrue();
    assertThat(document.getRichBlocks()).hasSize(1);
    assertThat(document.getRichChecksumSha256()).isEqualTo("rich");
    assertThat(document.getProcessedAt()).isNotNull();
  }

  @Test
  void shouldKeepErrorWhenFailed() {
    Document document = Document.builder().ownerId("owner").build();

    document.markFailed("document is password protected");

    assertThat(document.getProcessingStatus()).isEqualTo(ProcessingStatus.FAILED);
    assertThat(document.getProcessingError()).isEqualTo("document is password protected");
  }

  @Test
  void shouldRejectTransitionsOutOfTerminalState() {
    // Given
    Document document = Document.builder().ownerId("owner").build();
    document.markFailed("boom");

    // When / Then
    assertThatThrownBy(() -> document.applyPartialPages(List.of("late"), FINGERPRINT))
        .isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> document.markReady(List.of(), FINGERPRINT, List.of(), FINGERPRINT))
        .isInstanceOf(IllegalStateException.class);
    assertThat(document.getOptimizedPages()).isEmpty();
  }
}
