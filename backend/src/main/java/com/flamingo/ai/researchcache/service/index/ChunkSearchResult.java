package com.flamingo.ai.researchcache.service.index;

import com.flamingo.ai.researchcache.domain.model.StoredChunk;

/** One scored chunk. */
public record ChunkSearchResult(
    String itemKey,
    int chunkIndex,
    String text,
    Integer pageNumber,
    String sectionId,
    int charStart,
    int charEnd,
    String itemType,
    String docType,
    double similarity) {

  static ChunkSearchResult of(StoredChunk chunk, double similarity) {
    return new ChunkSearchResult(
        chunk.itemKey(),
        chunk.chunkIndex(),
        chunk.text(),
        chunk.pageNumber(),
        chunk.sectionId(),
        chunk.charStart(),
        chunk.charEnd(),
        chunk.itemType(),
        chunk.docType(),
        similarity);
  }
}
