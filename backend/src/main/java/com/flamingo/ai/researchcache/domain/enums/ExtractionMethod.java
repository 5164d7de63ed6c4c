package com.flamingo.ai.researchcache.domain.enums;

/** The extractor that produced an item's cached text, which also fixes its chunking mode. */
public enum ExtractionMethod {
  PDF_TEXT(ChunkingMode.PAGED),
  HTML(ChunkingMode.SECTIONED),
  MARKDOWN(ChunkingMode.SECTIONED),
  PLAIN_TEXT(ChunkingMode.PLAIN);

  private final ChunkingMode chunkingMode;

  ExtractionMethod(ChunkingMode chunkingMode) {
    this.chunkingMode = chunkingMode;
  }

  public ChunkingMode chunkingMode() {
    return chunkingMode;
  }
}
