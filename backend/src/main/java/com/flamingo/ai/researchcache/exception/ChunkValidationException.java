package com.flamingo.ai.researchcache.exception;

/** Exception thrown when an item's chunk list and embedding list do not line up. */
public class ChunkValidationException extends RuntimeException {

  private final String itemKey;
  private final int chunkCount;
  private final int embeddingCount;

  public ChunkValidationException(String itemKey, int chunkCount, int embeddingCount) {
    super(
        "Cannot index item "
            + itemKey
            + ": "
            + chunkCount
            + " chunks but "
            + embeddingCount
            + " embeddings");
    this.itemKey = itemKey;
    this.chunkCount = chunkCount;
    this.embeddingCount = embeddingCount;
  }

  public String getItemKey() {
    return itemKey;
  }

  public int getChunkCount() {
    return chunkCount;
  }

  public int getEmbeddingCount() {
    return embeddingCount;
  }
}
