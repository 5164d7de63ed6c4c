package com.flamingo.ai.researchcache.service.pipeline;

import com.flamingo.ai.researchcache.service.index.IndexOptions;
import com.flamingo.ai.researchcache.service.index.IndexStats;
import com.flamingo.ai.researchcache.service.index.VectorIndexService;
import com.flamingo.ai.researchcache.service.sync.CollectionSyncService;
import com.flamingo.ai.researchcache.service.sync.SyncMode;
import com.flamingo.ai.researchcache.service.sync.SyncStats;
import io.micrometer.core.annotation.Timed;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs the write phases of a collection (sync, then indexing). Phases of one collection never
 * overlap; different collections proceed in parallel.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResearchPipelineService {

  private final CollectionSyncService syncService;
  private final VectorIndexService indexService;
  private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

  public SyncStats sync(String collectionKey, SyncMode mode) {
    return locked(collectionKey, () -> syncService.sync(collectionKey, mode));
  }

  public IndexStats index(String collectionKey, IndexOptions options) {
    return locked(collectionKey, () -> indexService.indexCollection(collectionKey, options));
  }

  /** Syncs and then indexes. Indexing is skipped when the sync was aborted. */
  @Timed(value = "pipeline.run", description = "Time to sync and index a collection")
  public PipelineResult syncAndIndex(String collectionKey, SyncMode mode, IndexOptions options) {
    return locked(
        collectionKey,
        () -> {
          SyncStats sync = syncService.sync(collectionKey, mode);
          if (sync.isAborted()) {
            log.warn("Sync of collection {} was aborted; skipping indexing", collectionKey);
            return new PipelineResult(sync, null);
          }
          return new PipelineResult(sync, indexService.indexCollection(collectionKey, options));
        });
  }

  /** {@link #syncAndIndex} on the collection pipeline executor. */
  @Async("collectionPipelineExecutor")
  public CompletableFuture<PipelineResult> syncAndIndexAsync(
      String collectionKey, SyncMode mode, IndexOptions options) {
    return CompletableFuture.completedFuture(syncAndIndex(collectionKey, mode, options));
  }

  private <T> T locked(String collectionKey, Supplier<T> work) {
    ReentrantLock lock = locks.computeIfAbsent(collectionKey, key -> new ReentrantLock());
    if (lock.isLocked() && !lock.isHeldByCurrentThread()) {
      log.info("Waiting for running pipeline of collection {}", collectionKey);
    }
    lock.lock();
    try {
      return work.get();
    } finally {
      lock.unlock();
    }
  }
}
