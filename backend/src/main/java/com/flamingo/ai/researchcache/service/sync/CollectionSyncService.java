package com.flamingo.ai.researchcache.service.sync;

import com.flamingo.ai.researchcache.domain.model.CacheInfo;

/** Mirrors a remote collection into its local store. */
public interface CollectionSyncService {

  /**
   * Runs one sync pass. Never throws for per-item failures; a lost connection to the remote ends
   * the pass early and returns partial stats with {@code aborted} set.
   *
   * @param collectionKey the remote collection to mirror
   * @param mode requested mode; a collection that was never synced always runs {@link
   *     SyncMode#FULL}
   * @return counters of the pass
   */
  SyncStats sync(String collectionKey, SyncMode mode);

  /**
   * Creates the local store of a collection with its root collection row and an empty sync state.
   * Idempotent.
   *
   * @param collectionKey the remote collection
   * @return summary of the (possibly pre-existing) cache
   */
  CacheInfo initialize(String collectionKey);

  /**
   * Summarizes what is cached for a collection.
   *
   * @throws com.flamingo.ai.researchcache.exception.CacheNotInitializedException if the collection
   *     has no local cache
   */
  CacheInfo status(String collectionKey);

  /** Deletes every cached record and blob of a collection. */
  void clear(String collectionKey);
}
