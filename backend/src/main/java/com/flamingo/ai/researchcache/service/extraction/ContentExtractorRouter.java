package com.flamingo.ai.researchcache.service.extraction;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Routes an attachment to the highest-priority {@link ContentExtractor} that supports it.
 *
 * <p>Extractors are injected by Spring in {@code @Order} order (ascending).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContentExtractorRouter {

  private final List<ContentExtractor> extractors;

  public Optional<ContentExtractor> route(String contentType, String filename) {
    return extractors.stream().filter(e -> e.supports(contentType, filename)).findFirst();
  }

  public boolean canExtract(String contentType, String filename) {
    return route(contentType, filename).isPresent();
  }

  /** Extracts text with the matching extractor, or returns empty when none supports the file. */
  public Optional<ExtractedText> extract(Path file, String contentType, String filename) {
    Optional<ContentExtractor> extractor = route(contentType, filename);
    if (extractor.isEmpty()) {
      log.debug("No extractor for contentType={} filename={}", contentType, filename);
      return Optional.empty();
    }
    return extractor.get().extract(file, contentType);
  }
}
