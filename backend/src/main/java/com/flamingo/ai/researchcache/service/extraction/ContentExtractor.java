package com.flamingo.ai.researchcache.service.extraction;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Turns an attachment file into plain text for chunking. Implementations register as Spring beans
 * with an {@code @Order}; {@link ContentExtractorRouter} picks the first that supports a file.
 */
public interface ContentExtractor {

  /**
   * @param contentType MIME type reported by the remote library, may be {@code null}
   * @param filename original filename, may be {@code null}
   */
  boolean supports(String contentType, String filename);

  /**
   * Extracts text from {@code file}.
   *
   * @return the text, or empty when the file holds no extractable text
   * @throws com.flamingo.ai.researchcache.exception.ContentExtractionException if the file cannot
   *     be parsed
   */
  Optional<ExtractedText> extract(Path file, String contentType);
}
