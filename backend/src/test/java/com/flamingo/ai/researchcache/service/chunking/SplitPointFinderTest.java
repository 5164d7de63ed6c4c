package com.flamingo.ai.researchcache.service.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SplitPointFinder Tests")
class SplitPointFinderTest {

  @Test
  @DisplayName("Should return the text length when the rest fits")
  void shouldReturnLengthWhenRestFits() {
    assertThat(SplitPointFinder.find("short text", 0, 50)).isEqualTo(10);
  }

  @Test
  @DisplayName("Should prefer a paragraph break over a later sentence end")
  void shouldPreferParagraphBreak() {
    String text = "a".repeat(50) + "\n\n" + "b".repeat(30) + ". " + "c".repeat(100);

    assertThat(SplitPointFinder.find(text, 0, 120)).isEqualTo(52);
  }

  @Test
  @DisplayName("Should prefer a sentence end over a later comma")
  void shouldPreferSentenceEnd() {
    String text = "a".repeat(50) + ". " + "b".repeat(20) + ", " + "c".repeat(100);

    assertThat(SplitPointFinder.find(text, 0, 120)).isEqualTo(52);
  }

  @Test
  @DisplayName("Should take the latest break within one class")
  void shouldTakeLatestBreakInClass() {
    String text = "a".repeat(30) + ". " + "b".repeat(30) + "? " + "c".repeat(100);

    assertThat(SplitPointFinder.find(text, 0, 120)).isEqualTo(64);
  }

  @Test
  @DisplayName("Should fall back to whitespace")
  void shouldFallBackToWhitespace() {
    String text = "a".repeat(60) + " " + "b".repeat(100);

    assertThat(SplitPointFinder.find(text, 0, 120)).isEqualTo(61);
  }

  @Test
  @DisplayName("Should cut at the target without any break")
  void shouldHardCut() {
    assertThat(SplitPointFinder.find("x".repeat(300), 0, 100)).isEqualTo(100);
  }

  @Test
  @DisplayName("Should ignore breaks outside the lookback window")
  void shouldIgnoreBreaksOutsideWindow() {
    String text = "a".repeat(10) + ". " + "b".repeat(300);

    assertThat(SplitPointFinder.find(text, 0, 200)).isEqualTo(200);
  }

  @Test
  @DisplayName("Should never return a point at or before the chunk start")
  void shouldAdvancePastStart() {
    String text = "a".repeat(100) + ". " + "b".repeat(300);

    assertThat(SplitPointFinder.find(text, 102, 150)).isEqualTo(150);
  }
}
