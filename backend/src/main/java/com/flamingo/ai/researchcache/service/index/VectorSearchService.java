package com.flamingo.ai.researchcache.service.index;

import com.flamingo.ai.researchcache.config.ResearchCacheProperties;
import com.flamingo.ai.researchcache.domain.model.LibraryItem;
import com.flamingo.ai.researchcache.domain.model.SearchFilters;
import com.flamingo.ai.researchcache.exception.CacheNotInitializedException;
import com.flamingo.ai.researchcache.service.embedding.EmbeddingCodec;
import com.flamingo.ai.researchcache.service.embedding.VectorEmbeddingService;
import com.flamingo.ai.researchcache.store.LocalStore;
import com.flamingo.ai.researchcache.store.LocalStoreRegistry;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Query side of the vector index: chunk search, source discovery and grouping of hits by source.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VectorSearchService {

  private final LocalStoreRegistry storeRegistry;
  private final VectorSearchBackend searchBackend;
  private final VectorEmbeddingService embeddingService;
  private final ResearchCacheProperties properties;

  /**
   * Searches with an already encoded query vector.
   *
   * @throws com.flamingo.ai.researchcache.exception.DimensionMismatchException if the query is not
   *     as wide as the configured model's vectors, or a stored vector differs in width from it
   */
  @Timed(value = "search.vector", description = "Time to score chunks against a query vector")
  public List<ChunkSearchResult> search(
      String collectionKey, byte[] queryEmbedding, int topK, SearchFilters filters) {
    LocalStore store = storeRegistry.requireSynced(collectionKey);
    float[] query =
        EmbeddingCodec.deserialize(queryEmbedding, embeddingService.dimension(), "query vector");
    return searchBackend.search(store, query, topK, orNone(filters));
  }

  /** Embeds {@code query} with the configured model and searches. */
  public List<ChunkSearchResult> searchText(
      String collectionKey, String query, int topK, SearchFilters filters) {
    LocalStore store = requireIndexed(collectionKey);
    return searchBackend.search(store, embeddingService.embedQuery(query), topK, orNone(filters));
  }

  public List<ChunkSearchResult> searchText(String collectionKey, String query) {
    int topK = properties.getRetrieval().getTopK();
    return searchText(collectionKey, query, topK, SearchFilters.NONE);
  }

  /**
   * Ranks the sources most relevant to {@code query}. Searches {@code topN} times the configured
   * multiplier of chunks, groups them by item and scores each item as a weighted blend of its best
   * and its mean chunk similarity.
   */
  @Timed(value = "search.discover", description = "Time to discover relevant sources")
  public List<SourceMatch> discoverSources(
      String collectionKey, String query, int topN, SearchFilters filters) {
    LocalStore store = requireIndexed(collectionKey);
    ResearchCacheProperties.Retrieval retrieval = properties.getRetrieval();
    int candidates = topN * retrieval.getDiscoveryMultiplier();
    List<ChunkSearchResult> results =
        searchBackend.search(
            store, embeddingService.embedQuery(query), candidates, orNone(filters));
    if (results.isEmpty()) {
      log.info("No relevant sources found in collection {}", collectionKey);
      return List.of();
    }

    double maxWeight = retrieval.getMaxSimilarityWeight();
    List<SourceMatch> matches = new ArrayList<>();
    for (SourceGroup group : groupBySource(results)) {
      double mean =
          group.hits().stream().mapToDouble(ChunkSearchResult::similarity).average().orElse(0.0);
      double relevance = maxWeight * group.maxSimilarity() + (1.0 - maxWeight) * mean;
      matches.add(toMatch(store, group, relevance, retrieval));
    }
    matches.sort(Comparator.comparingDouble(SourceMatch::relevanceScore).reversed());
    List<SourceMatch> top = matches.size() > topN ? matches.subList(0, topN) : matches;
    log.info(
        "Discovered {} sources from {} chunks in collection {}",
        top.size(),
        results.size(),
        collectionKey);
    return List.copyOf(top);
  }

  /**
   * Groups chunk hits by item. Groups are ordered by their best similarity; hits keep the order
   * they had in {@code results}.
   */
  public List<SourceGroup> groupBySource(List<ChunkSearchResult> results) {
    Map<String, List<ChunkSearchResult>> byItem = new LinkedHashMap<>();
    for (ChunkSearchResult result : results) {
      byItem.computeIfAbsent(result.itemKey(), key -> new ArrayList<>()).add(result);
    }
    List<SourceGroup> groups = new ArrayList<>();
    byItem.forEach(
        (itemKey, hits) ->
            groups.add(
                new SourceGroup(
                    itemKey,
                    hits.stream().mapToDouble(ChunkSearchResult::similarity).max().orElse(0.0),
                    hits)));
    groups.sort(Comparator.comparingDouble(SourceGroup::maxSimilarity).reversed());
    return groups;
  }

  // ---- private helpers ----

  private LocalStore requireIndexed(String collectionKey) {
    LocalStore store = storeRegistry.requireSynced(collectionKey);
    if (store.indexedItemKeys().isEmpty()) {
      throw new CacheNotInitializedException(
          collectionKey, "no items are indexed yet. Run indexing first.");
    }
    return store;
  }

  private SourceMatch toMatch(
      LocalStore store,
      SourceGroup group,
      double relevance,
      ResearchCacheProperties.Retrieval retrieval) {
    List<SourceMatch.Excerpt> excerpts = new ArrayList<>();
    for (ChunkSearchResult hit : group.hits()) {
      if (excerpts.size() >= retrieval.getMaxExcerpts()) {
        break;
      }
      String text = hit.text();
      if (text.length() > retrieval.getExcerptLength()) {
        text = text.substring(0, retrieval.getExcerptLength());
      }
      excerpts.add(
          new SourceMatch.Excerpt(text, hit.pageNumber(), hit.sectionId(), hit.similarity()));
    }

    ChunkSearchResult first = group.hits().get(0);
    Optional<LibraryItem> item = store.items().findByKey(group.itemKey());
    return new SourceMatch(
        group.itemKey(),
        item.map(LibraryItem::title).orElse("Unknown"),
        item.map(CreatorNames::format).orElse(CreatorNames.UNKNOWN),
        item.map(LibraryItem::date).orElse(null),
        first.itemType(),
        first.docType(),
        relevance,
        group.hits().size(),
        excerpts);
  }

  private static SearchFilters orNone(SearchFilters filters) {
    return filters == null ? SearchFilters.NONE : filters;
  }
}
