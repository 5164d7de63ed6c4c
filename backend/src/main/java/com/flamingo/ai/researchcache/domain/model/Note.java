package com.flamingo.ai.researchcache.domain.model;

import java.time.Instant;

/**
 * A cached note. Child notes belong to an item; standalone notes belong to a collection.
 *
 * @param content rich note body (HTML), stored as received
 */
public record Note(
    String key,
    String parentItemKey,
    String collectionKey,
    String title,
    String content,
    long version,
    Instant lastSynced) {

  public boolean isStandalone() {
    return parentItemKey == null;
  }
}
