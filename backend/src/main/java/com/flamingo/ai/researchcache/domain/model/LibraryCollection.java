package com.flamingo.ai.researchcache.domain.model;

import java.time.Instant;
import java.util.Optional;

/**
 * A cached collection node.
 *
 * @param key natural key from the remote library
 * @param name display name
 * @param parentKey parent collection key, {@code null} for a root or when the parent is outside the
 *     synced tree
 * @param version remote version at last sync
 * @param lastSynced when this row was last written by a sync
 */
public record LibraryCollection(
    String key, String name, String parentKey, long version, Instant lastSynced) {

  public Optional<String> parent() {
    return Optional.ofNullable(parentKey);
  }
}
