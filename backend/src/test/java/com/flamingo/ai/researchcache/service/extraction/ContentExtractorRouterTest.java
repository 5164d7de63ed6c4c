package com.flamingo.ai.researchcache.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("ContentExtractorRouter Tests")
class ContentExtractorRouterTest {

  @TempDir Path tempDir;

  private final ContentExtractorRouter router =
      new ContentExtractorRouter(
          List.of(
              new PdfBoxContentExtractor(),
              new HtmlContentExtractor(),
              new PlainTextContentExtractor()));

  @Test
  @DisplayName("Should route to the first extractor that supports the file")
  void shouldRouteByPriority() {
    assertThat(router.route("application/pdf", "x.bin"))
        .get()
        .isInstanceOf(PdfBoxContentExtractor.class);
    assertThat(router.route(null, "page.html")).get().isInstanceOf(HtmlContentExtractor.class);
    assertThat(router.route("text/plain", null))
        .get()
        .isInstanceOf(PlainTextContentExtractor.class);
  }

  @Test
  @DisplayName("Should report unsupported files")
  void shouldReportUnsupportedFiles() throws Exception {
    Path file = tempDir.resolve("image.png");
    Files.write(file, new byte[] {1, 2, 3});

    assertThat(router.canExtract("image/png", "image.png")).isFalse();
    assertThat(router.extract(file, "image/png", "image.png")).isEmpty();
  }

  @Test
  @DisplayName("Should extract with the routed extractor")
  void shouldExtract() throws Exception {
    Path file = tempDir.resolve("ATT1.txt");
    Files.writeString(file, "Routed text.");

    assertThat(router.extract(file, "text/plain", "notes.txt"))
        .get()
        .extracting(ExtractedText::text)
        .isEqualTo("Routed text.");
  }
}
