package com.flamingo.ai.researchcache.service.chunking;

/**
 * Size parameters for one chunking call, in characters.
 *
 * @param chunkSize target upper bound of a chunk
 * @param chunkOverlap characters shared between consecutive chunks
 * @param minChunkSize chunks shorter than this are dropped, except a document's final fragment
 */
public record ChunkingOptions(int chunkSize, int chunkOverlap, int minChunkSize) {

  public ChunkingOptions {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
    }
    if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
      throw new IllegalArgumentException(
          "chunkOverlap must be in [0, chunkSize): " + chunkOverlap);
    }
    if (minChunkSize < 0 || minChunkSize > chunkSize) {
      throw new IllegalArgumentException(
          "minChunkSize must be in [0, chunkSize]: " + minChunkSize);
    }
  }

  public ChunkingOptions withChunkSize(int size) {
    return new ChunkingOptions(size, chunkOverlap, minChunkSize);
  }
}
