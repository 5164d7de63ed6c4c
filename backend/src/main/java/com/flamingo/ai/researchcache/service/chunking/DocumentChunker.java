package com.flamingo.ai.researchcache.service.chunking;

import com.flamingo.ai.researchcache.domain.enums.ChunkingMode;
import com.flamingo.ai.researchcache.domain.model.ChunkData;
import java.util.List;

/**
 * Splits extracted text into overlapping chunks that carry citation provenance. Implementations
 * are stateless and safe for concurrent use.
 */
public interface DocumentChunker {

  /**
   * @param text extracted text; for {@link ChunkingMode#PAGED}, pages separated by form feeds
   * @return chunks with {@code chunkIndex} increasing from 0; empty when there is no text
   */
  List<ChunkData> chunk(String text, ChunkingMode mode, ChunkingOptions options);

  /** Chunks with the configured default sizes. */
  List<ChunkData> chunk(String text, ChunkingMode mode);
}
