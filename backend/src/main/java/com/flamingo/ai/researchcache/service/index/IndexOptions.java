package com.flamingo.ai.researchcache.service.index;

import com.flamingo.ai.researchcache.service.chunking.ChunkingOptions;
import java.util.Set;

/**
 * Options of one indexing pass.
 *
 * @param force re-index items whose index state is current
 * @param subcollectionNames restrict the pass to the direct subcollections with these names; empty
 *     means every cached item of the collection
 * @param includeMain with subcollection names given, also index items of the root collection
 * @param chunking chunking override, or {@code null} for the configured defaults
 */
public record IndexOptions(
    boolean force, Set<String> subcollectionNames, boolean includeMain, ChunkingOptions chunking) {

  public static final IndexOptions DEFAULT = new IndexOptions(false, Set.of(), false, null);

  public IndexOptions {
    subcollectionNames = subcollectionNames == null ? Set.of() : Set.copyOf(subcollectionNames);
  }

  public IndexOptions withForce(boolean force) {
    return new IndexOptions(force, subcollectionNames, includeMain, chunking);
  }

  public boolean restrictedToSubcollections() {
    return !subcollectionNames.isEmpty();
  }
}
