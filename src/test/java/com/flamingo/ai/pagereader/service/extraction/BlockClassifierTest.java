package com.flamingo.ai.pagereader.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.pagereader.domain.enums.BlockKind;
import com.flamingo.ai.pagereader.domain.model.TextBlock;
import org.junit.jupiter.api.Test;

class BlockClassifierTest {

  @Test
  void shouldTreatShortLineAsHeading() {
    assertThat(BlockClassifier.isHeading("Chapter One")).isTrue();
  }

  @Test
  void shouldTreatLongUppercaseLineAsHeading() {
    String title = "THE REMARKABLE ADVENTURES OF A VERY LONG TITLE THAT KEEPS GOING";
    assertThat(title.length()).isBetween(50, 99);

    assertThat(BlockClassifier.isHeading(title)).isTrue();
  }

  @Test
  void shouldNotTreatLongMixedCaseLineAsHeading() {
    String sentence = "This is an ordinary sentence that is clearly longer than fifty characters.";

    assertThat(BlockClassifier.isHeading(sentence)).isFalse();
  }

  @Test
  void shouldNotTreatMultiLineTextAsHeading() {
    assertThat(BlockClassifier.isHeading("Short\nlines")).isFalse();
  }

  @Test
  void shouldNotTreatHundredCharactersAsHeading() {
    assertThat(BlockClassifier.isHeading("A".repeat(100))).isFalse();
  }

  @Test
  void shouldRejectBlankText() {
    assertThat(BlockClassifier.isHeading("   ")).isFalse();
    assertThat(BlockClassifier.isHeading(null)).isFalse();
  }

  @Test
  void shouldBuildBlockOfMatchingKind() {
    TextBlock heading = BlockClassifier.toBlock("Intro", 2, 0);
    TextBlock paragraph = BlockClassifier.toBlock("x".repeat(60), 2, 1);

    assertThat(heading.kind()).isEqualTo(BlockKind.HEADING);
    assertThat(heading.headingLevel()).isEqualTo(1);
    assertThat(paragraph.kind()).isEqualTo(BlockKind.PARAGRAPH);
    assertThat(paragraph.positionInPage()).isEqualTo(1);
  }
}
