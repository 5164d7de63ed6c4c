package com.flamingo.ai.researchcache.service.pipeline;

import com.flamingo.ai.researchcache.service.index.IndexStats;
import com.flamingo.ai.researchcache.service.sync.SyncStats;
import java.util.Optional;

/**
 * Outcome of a sync followed by indexing.
 *
 * @param index {@code null} when the sync was aborted and indexing did not run
 */
public record PipelineResult(SyncStats sync, IndexStats index) {

  public Optional<IndexStats> indexStats() {
    return Optional.ofNullable(index);
  }
}
