package com.flamingo.ai.researchcache.service.index;

import lombok.Getter;
import lombok.ToString;

/** Counters of one indexing pass. */
@Getter
@ToString
public class IndexStats {

  private int processed;
  private int skipped;
  private int errors;
  private int totalChunks;

  void indexed(int chunkCount) {
    processed++;
    totalChunks += chunkCount;
  }

  void skipped() {
    skipped++;
  }

  void error() {
    errors++;
  }
}
