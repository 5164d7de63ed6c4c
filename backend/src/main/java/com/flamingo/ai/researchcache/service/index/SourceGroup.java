package com.flamingo.ai.researchcache.service.index;

import java.util.List;

/** Chunk hits of one item, in rank order. */
public record SourceGroup(String itemKey, double maxSimilarity, List<ChunkSearchResult> hits) {

  public SourceGroup {
    hits = List.copyOf(hits);
  }
}
