package com.flamingo.ai.researchcache.domain.model;

import java.time.Instant;
import java.util.Optional;

/** Sync bookkeeping for the root collection of a store. */
public record SyncState(
    String collectionKey, long lastSyncVersion, Instant lastSyncTime, boolean fullSyncCompleted) {

  public static SyncState initial(String collectionKey) {
    return new SyncState(collectionKey, 0L, null, false);
  }

  public Optional<Instant> lastSync() {
    return Optional.ofNullable(lastSyncTime);
  }

  public boolean hasSynced() {
    return lastSyncTime != null;
  }
}
