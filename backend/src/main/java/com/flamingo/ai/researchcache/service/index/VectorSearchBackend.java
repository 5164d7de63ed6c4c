package com.flamingo.ai.researchcache.service.index;

import com.flamingo.ai.researchcache.domain.model.SearchFilters;
import com.flamingo.ai.researchcache.store.LocalStore;
import java.util.List;

/** Nearest-neighbour search over the chunk vectors of one store. */
public interface VectorSearchBackend {

  /**
   * Scores candidate chunks against {@code query}.
   *
   * @param store the collection's store
   * @param query query vector
   * @param topK maximum number of results
   * @param filters candidate pruning applied before scoring
   * @return results ordered by descending similarity
   * @throws com.flamingo.ai.researchcache.exception.DimensionMismatchException if a stored vector
   *     differs in width from the query
   */
  List<ChunkSearchResult> search(
      LocalStore store, float[] query, int topK, SearchFilters filters);
}
