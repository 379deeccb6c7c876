package com.flamingo.ai.pagereader.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.pagereader.config.ReaderConfig;
import com.flamingo.ai.pagereader.domain.model.TextBlock;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Paginator Tests")
class PaginatorTest {

  private Paginator paginator;

  @BeforeEach
  void setUp() {
    paginator = new Paginator(new ReaderConfig());
  }

  @Nested
  @DisplayName("Synthetic pagination")
  class Paginate {

    @Test
    void shouldKeepEveryPageWithinBudget() {
      // Given
      String paragraph = "word ".repeat(100).strip();
      String text =
          IntStream.range(0, 40).mapToObj(i -> paragraph).collect(Collectors.joining("\n\n"));

      // When
      List<TextBlock> blocks = paginator.paginate(text);
      List<String> pages = Paginator.toPages(blocks, 0);

      // Then
      assertThat(pages).hasSizeGreaterThan(1);
      assertThat(pages).allSatisfy(page -> assertThat(page.length()).isLessThanOrEqualTo(2600));
    }

    @Test
    void shouldGiveOversizedParagraphItsOwnPage() {
      // Given
      String huge = "x".repeat(3000);
      String text = "Intro\n\n" + huge + "\n\nOutro";

      // When
      List<String> pages = Paginator.toPages(paginator.paginate(text), 0);

      // Then
      assertThat(pages).containsExactly("Intro", huge, "Outro");
    }

    @Test
    void shouldReturnSingleEmptyPageForBlankText() {
      List<TextBlock> blocks = paginator.paginate("  \n\n  ");

      assertThat(blocks).containsExactly(TextBlock.empty(1));
      assertThat(Paginator.toPages(blocks, 0)).containsExactly("");
    }

    @Test
    void shouldJoinLinesInsideParagraph() {
      List<TextBlock> blocks = paginator.paginate("first line\nsecond line\r\n\r\nnext");

      assertThat(blocks)
          .extracting(TextBlock::content)
          .containsExactly("first line second line", "next");
    }

    @Test
    void shouldSanitizeParagraphs() {
      List<TextBlock> blocks = paginator.paginate("a\u0000b");

      assertThat(blocks).extracting(TextBlock::content).containsExactly("ab");
    }
  }

  @Nested
  @DisplayName("Page array")
  class ToPages {

    @Test
    void shouldOrderBlocksRegardlessOfEmissionOrder() {
      // Given
      List<TextBlock> blocks = new ArrayList<>();
      blocks.add(TextBlock.paragraph("second", 1, 1));
      blocks.add(TextBlock.paragraph("page two", 2, 0));
      blocks.add(TextBlock.heading("first", 1, 0));

      // When
      List<String> pages = Paginator.toPages(blocks, 0);

      // Then
      assertThat(pages).containsExactly("first\n\nsecond", "page two");
    }

    @Test
    void shouldPadToDeclaredPageCount() {
      List<String> pages = Paginator.toPages(List.of(TextBlock.paragraph("only", 2, 0)), 4);

      assertThat(pages).containsExactly("", "only", "", "");
    }

    @Test
    void shouldExtendBeyondDeclaredCountWhenBlocksDo() {
      List<String> pages = Paginator.toPages(List.of(TextBlock.paragraph("late", 3, 0)), 1);

      assertThat(pages).hasSize(3);
      assertThat(pages.get(2)).isEqualTo("late");
    }
  }

  @Test
  void shouldPackParagraphsCountingSeparators() {
    // 10 + 2 + 10 = 22 fits a budget of 22; a third paragraph does not
    List<List<String>> pages =
        Paginator.packPages(List.of("a".repeat(10), "b".repeat(10), "c".repeat(10)), 22);

    assertThat(pages).hasSize(2);
    assertThat(pages.get(0)).hasSize(2);
    assertThat(pages.get(1)).containsExactly("c".repeat(10));
  }

  @Test
  void shouldCountWords() {
    assertThat(Paginator.countWords("  one two\n three\t four ")).isEqualTo(4);
    assertThat(Paginator.countWords("")).isZero();
  }
}
