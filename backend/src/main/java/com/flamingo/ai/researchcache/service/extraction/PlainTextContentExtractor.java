package com.flamingo.ai.researchcache.service.extraction;

import com.flamingo.ai.researchcache.domain.enums.ExtractionMethod;
import com.flamingo.ai.researchcache.exception.ContentExtractionException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** {@link ContentExtractor} for plain text and markdown files, read as UTF-8. */
@Component
@Order(3)
public class PlainTextContentExtractor implements ContentExtractor {

  @Override
  public boolean supports(String contentType, String filename) {
    String type = lower(contentType);
    String name = lower(filename);
    return type.startsWith("text/plain")
        || type.startsWith("text/markdown")
        || type.startsWith("text/x-markdown")
        || name.endsWith(".txt")
        || isMarkdown(type, name);
  }

  @Override
  public Optional<ExtractedText> extract(Path file, String contentType) {
    try {
      String text = Files.readString(file, StandardCharsets.UTF_8);
      if (text.isBlank()) {
        return Optional.empty();
      }
      ExtractionMethod method =
          isMarkdown(lower(contentType), lower(file.getFileName().toString()))
              ? ExtractionMethod.MARKDOWN
              : ExtractionMethod.PLAIN_TEXT;
      return Optional.of(new ExtractedText(method, text));
    } catch (IOException e) {
      throw new ContentExtractionException(
          file.getFileName().toString(), "Failed to read text file: " + e.getMessage(), e);
    }
  }

  private static boolean isMarkdown(String type, String name) {
    return type.contains("markdown") || name.endsWith(".md") || name.endsWith(".markdown");
  }

  private static String lower(String value) {
    return value == null ? "" : value.toLowerCase(Locale.ROOT);
  }
}
