package com.flamingo.ai.researchcache.source;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("NoteTitles Tests")
class NoteTitlesTest {

  @Test
  @DisplayName("Should prefer the first h1 heading")
  void shouldPreferHeading() {
    String html = "<p>intro</p><h1 class=\"t\">Reading <b>list</b></h1><h1>Second</h1>";

    assertThat(NoteTitles.fromHtml(html)).isEqualTo("Reading list");
  }

  @Test
  @DisplayName("Should fall back to the first non-blank line")
  void shouldUseFirstLine() {
    String html = "<div> </div><p>Compare &amp; contrast</p><p>later</p>";

    assertThat(NoteTitles.fromHtml(html)).isEqualTo("Compare & contrast");
  }

  @Test
  @DisplayName("Should skip an empty heading")
  void shouldSkipEmptyHeading() {
    assertThat(NoteTitles.fromHtml("<h1> </h1><p>Body line</p>")).isEqualTo("Body line");
  }

  @Test
  @DisplayName("Should return Untitled for a note without text")
  void shouldReturnUntitled() {
    assertThat(NoteTitles.fromHtml("<p></p><br/>")).isEqualTo(NoteTitles.UNTITLED);
  }
}
