package com.flamingo.ai.researchcache.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.researchcache.config.ResearchCacheProperties;
import com.flamingo.ai.researchcache.exception.CacheNotInitializedException;
import jakarta.annotation.PreDestroy;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Hands out the {@link LocalStore} of each collection. Stores live under {@code
 * <cache-dir>/<collection-key>/} and are opened lazily, once per process.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStoreRegistry {

  private static final Pattern COLLECTION_KEY = Pattern.compile("[A-Za-z0-9_-]{1,64}");

  private final ResearchCacheProperties properties;
  private final ObjectMapper objectMapper;
  private final Map<String, LocalStore> stores = new ConcurrentHashMap<>();

  /** Opens the store of {@code collectionKey}, creating its directory and schema when absent. */
  public LocalStore openOrCreate(String collectionKey) {
    Path dir = storeDir(collectionKey);
    return stores.computeIfAbsent(collectionKey, key -> LocalStore.open(key, dir, objectMapper));
  }

  public boolean exists(String collectionKey) {
    return stores.containsKey(collectionKey)
        || Files.isRegularFile(storeDir(collectionKey).resolve(LocalStore.DATABASE_FILE));
  }

  /**
   * Returns the store of a collection whose cache was created by an earlier initialize or sync.
   *
   * @throws CacheNotInitializedException if no store exists for the collection
   */
  public LocalStore requireInitialized(String collectionKey) {
    if (!exists(collectionKey)) {
      throw new CacheNotInitializedException(
          collectionKey, "no local cache exists. Initialize or sync the collection first.");
    }
    return openOrCreate(collectionKey);
  }

  /**
   * Returns the store of a collection that has completed at least one sync.
   *
   * @throws CacheNotInitializedException if the collection was never synced
   */
  public LocalStore requireSynced(String collectionKey) {
    LocalStore store = requireInitialized(collectionKey);
    if (!store.syncState().hasSynced()) {
      throw new CacheNotInitializedException(
          collectionKey, "the collection has never been synced. Run a sync first.");
    }
    return store;
  }

  public Path storeDir(String collectionKey) {
    if (collectionKey == null || !COLLECTION_KEY.matcher(collectionKey).matches()) {
      throw new IllegalArgumentException("Invalid collection key: " + collectionKey);
    }
    return properties.cacheRoot().resolve(collectionKey);
  }

  @PreDestroy
  public void closeAll() {
    stores.values().forEach(LocalStore::close);
    stores.clear();
    log.debug("Closed all local stores");
  }
}
