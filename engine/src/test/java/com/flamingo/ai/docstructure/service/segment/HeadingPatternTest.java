package com.flamingo.ai.docstructure.service.segment;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("HeadingPattern Tests")
class HeadingPatternTest {

  @ParameterizedTest(name = "{0} -> {1} level {3}")
  @CsvSource(
      delimiter = '|',
      value = {
        "1. Introduction     | DECIMAL             | Introduction | 1",
        "1.2 Detail          | DECIMAL_TWO_LEVEL   | Detail       | 2",
        "1.2.3 Deep Dive     | DECIMAL_THREE_LEVEL | Deep Dive    | 3",
        "# Top               | MARKUP              | Top          | 1",
        "### Third           | MARKUP              | Third        | 3",
        "가. 개요            | KOREAN_ORDINAL      | 개요         | 1",
        "[2] Bracketed Title | BRACKETED           | Bracketed Title | 1"
      })
  @DisplayName("should detect enumeration style, title and level")
  void shouldDetectStyleTitleAndLevel(String text, HeadingPattern style, String title, int level) {
    HeadingPattern.Match match = HeadingPattern.detect(text).orElseThrow();

    assertThat(match.style()).isEqualTo(style);
    assertThat(match.title()).isEqualTo(title);
    assertThat(match.level()).isEqualTo(level);
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "Plain paragraph text", "#hashtag", "1.1. Trailing dot", "2024 was a year", "1.Intro"
      })
  @DisplayName("should not detect headings in ordinary text")
  void shouldNotDetect_inOrdinaryText(String text) {
    assertThat(HeadingPattern.detect(text)).isEmpty();
  }

  @Test
  @DisplayName("should strip trailing whitespace from the title")
  void shouldStripTitle() {
    assertThat(HeadingPattern.detect("2. Scope   ").orElseThrow().title()).isEqualTo("Scope");
  }

  @Test
  @DisplayName("should keep the captured numbering")
  void shouldKeepNumbering() {
    assertThat(HeadingPattern.detect("3.4 Limits").orElseThrow().numbering()).isEqualTo("3.4");
    assertThat(HeadingPattern.detect("## Notes").orElseThrow().numbering()).isEqualTo("##");
  }

  @Test
  @DisplayName("levelOf should count dots, hashes or default to one")
  void levelOfShouldDeriveDepth() {
    assertThat(HeadingPattern.levelOf("1")).isEqualTo(1);
    assertThat(HeadingPattern.levelOf("1.2.3")).isEqualTo(3);
    assertThat(HeadingPattern.levelOf("####")).isEqualTo(4);
    assertThat(HeadingPattern.levelOf("가")).isEqualTo(1);
  }
}
