package com.flamingo.ai.researchcache.service.index;

import com.flamingo.ai.researchcache.domain.model.SearchFilters;
import com.flamingo.ai.researchcache.exception.DimensionMismatchException;
import com.flamingo.ai.researchcache.service.embedding.EmbeddingCodec;
import com.flamingo.ai.researchcache.store.LocalStore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Exhaustive {@link VectorSearchBackend}: every candidate row is decoded and scored. Memory stays
 * bounded by a min-heap of {@code topK} results.
 */
@Component
@Slf4j
public class BruteForceVectorSearch implements VectorSearchBackend {

  private static final Comparator<ChunkSearchResult> BY_SIMILARITY =
      Comparator.comparingDouble(ChunkSearchResult::similarity);

  @Override
  public List<ChunkSearchResult> search(
      LocalStore store, float[] query, int topK, SearchFilters filters) {
    if (topK <= 0) {
      return List.of();
    }
    PriorityQueue<ChunkSearchResult> heap = new PriorityQueue<>(topK + 1, BY_SIMILARITY);
    int[] scanned = {0};
    store.forEachCandidate(
        filters,
        chunk -> {
          int width = EmbeddingCodec.dimensionOf(chunk.embedding());
          if (width != query.length) {
            throw new DimensionMismatchException(
                query.length, width, "chunk " + chunk.chunkIndex() + " of item " + chunk.itemKey());
          }
          float[] vector = EmbeddingCodec.deserialize(chunk.embedding(), width);
          heap.add(ChunkSearchResult.of(chunk, CosineSimilarity.between(query, vector)));
          if (heap.size() > topK) {
            heap.poll();
          }
          scanned[0]++;
        });

    List<ChunkSearchResult> results = new ArrayList<>(heap);
    results.sort(BY_SIMILARITY.reversed());
    log.debug("Scored {} chunks, returning {}", scanned[0], results.size());
    return results;
  }
}
