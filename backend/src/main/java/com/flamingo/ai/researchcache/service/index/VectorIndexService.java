package com.flamingo.ai.researchcache.service.index;

import com.flamingo.ai.researchcache.domain.model.ChunkBatch;
import com.flamingo.ai.researchcache.domain.model.ChunkData;
import com.flamingo.ai.researchcache.domain.model.ExtractedContent;
import com.flamingo.ai.researchcache.domain.model.IndexState;
import com.flamingo.ai.researchcache.domain.model.LibraryCollection;
import com.flamingo.ai.researchcache.domain.model.LibraryItem;
import com.flamingo.ai.researchcache.service.chunking.DocumentChunker;
import com.flamingo.ai.researchcache.service.embedding.EmbeddingCodec;
import com.flamingo.ai.researchcache.service.embedding.VectorEmbeddingService;
import com.flamingo.ai.researchcache.store.ContentHashes;
import com.flamingo.ai.researchcache.store.LocalStore;
import com.flamingo.ai.researchcache.store.LocalStoreRegistry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns the extracted text of cached items into chunk rows: chunk, embed, then replace the item's
 * chunks and index state in one transaction.
 *
 * <p>An item is skipped when its index state already records the hash of the current text and the
 * configured embedding model, unless the pass is forced.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VectorIndexService {

  /** Metadata field holding a research document type, copied onto every chunk. */
  static final String DOC_TYPE_FIELD = "docType";

  private final LocalStoreRegistry storeRegistry;
  private final DocumentChunker chunker;
  private final VectorEmbeddingService embeddingService;
  private final MeterRegistry meterRegistry;

  /**
   * Indexes the items of a collection.
   *
   * @throws com.flamingo.ai.researchcache.exception.CacheNotInitializedException if the collection
   *     was never synced
   */
  @Timed(value = "index.collection", description = "Time to index a collection")
  public IndexStats indexCollection(String collectionKey, IndexOptions options) {
    LocalStore store = storeRegistry.requireSynced(collectionKey);
    List<LibraryItem> items = itemsToIndex(store, options);
    log.info(
        "Indexing {} items of collection {} with {} (force={})",
        items.size(),
        collectionKey,
        embeddingService.modelName(),
        options.force());

    IndexStats stats = new IndexStats();
    for (LibraryItem item : items) {
      try {
        Optional<IndexState> state = indexItem(store, item, options);
        if (state.isPresent()) {
          stats.indexed(state.get().chunkCount());
        } else {
          stats.skipped();
        }
      } catch (RuntimeException e) {
        stats.error();
        meterRegistry.counter("index.item.failure").increment();
        log.warn("Failed to index item {}: {}", item.key(), e.getMessage());
        log.debug("Index failure", e);
      }
    }
    meterRegistry.counter("index.chunks").increment(stats.getTotalChunks());
    log.info("Finished indexing collection {}: {}", collectionKey, stats);
    return stats;
  }

  /**
   * Indexes one item.
   *
   * @return the new index state, or empty when the item was skipped
   */
  Optional<IndexState> indexItem(LocalStore store, LibraryItem item, IndexOptions options) {
    Optional<ExtractedContent> content = store.extractedContent().find(item.key());
    if (content.isEmpty() || content.get().text().isBlank()) {
      log.debug("Item {} has no extracted text", item.key());
      return Optional.empty();
    }
    String text = content.get().text();
    String textHash = ContentHashes.sha256Hex(text);
    String model = embeddingService.modelName();

    if (!options.force()) {
      Optional<IndexState> current = store.chunks().findIndexState(item.key());
      if (current.isPresent()
          && textHash.equals(current.get().contentHash())
          && model.equals(current.get().embeddingModel())) {
        log.debug("Item {} already indexed ({} chunks)", item.key(), current.get().chunkCount());
        return Optional.empty();
      }
    }

    List<ChunkData> chunks =
        options.chunking() == null
            ? chunker.chunk(text, content.get().method().chunkingMode())
            : chunker.chunk(text, content.get().method().chunkingMode(), options.chunking());
    if (chunks.isEmpty()) {
      log.debug("Item {} produced no chunks", item.key());
      return Optional.empty();
    }

    List<float[]> vectors =
        embeddingService.embedDocuments(chunks.stream().map(ChunkData::text).toList());
    List<byte[]> embeddings = new ArrayList<>(vectors.size());
    vectors.forEach(vector -> embeddings.add(EmbeddingCodec.serialize(vector)));

    IndexState state =
        store.replaceChunks(
            new ChunkBatch(
                item.key(), item.itemType(), docTypeOf(item), textHash, model, chunks, embeddings));
    log.debug("Indexed item {} into {} chunks", item.key(), state.chunkCount());
    return Optional.of(state);
  }

  private List<LibraryItem> itemsToIndex(LocalStore store, IndexOptions options) {
    if (!options.restrictedToSubcollections()) {
      return store.items().findAll();
    }
    List<LibraryCollection> matched =
        store
            .collections()
            .findChildrenByNames(store.collectionKey(), options.subcollectionNames());
    Set<String> found = matched.stream().map(LibraryCollection::name).collect(Collectors.toSet());
    options.subcollectionNames().stream()
        .filter(name -> !found.contains(name))
        .forEach(name -> log.warn("No subcollection named '{}' in the cache", name));

    List<String> scope = new ArrayList<>();
    matched.forEach(collection -> scope.add(collection.key()));
    if (options.includeMain()) {
      scope.add(store.collectionKey());
    }
    return scope.isEmpty() ? List.of() : store.items().findByCollections(scope);
  }

  private static String docTypeOf(LibraryItem item) {
    Object value = item.metadata().get(DOC_TYPE_FIELD);
    return value instanceof String docType && !docType.isBlank() ? docType : null;
  }
}
