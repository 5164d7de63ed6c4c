package com.flamingo.ai.researchcache.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;

/**
 * A cached top-level library item (paper, web page, book, ...).
 *
 * @param metadata opaque remote metadata, persisted as JSON
 */
@Builder(toBuilder = true)
public record LibraryItem(
    String key,
    String itemType,
    String title,
    String date,
    String url,
    Map<String, Object> metadata,
    long version,
    Instant lastSynced) {

  public LibraryItem {
    metadata =
        metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }
}
