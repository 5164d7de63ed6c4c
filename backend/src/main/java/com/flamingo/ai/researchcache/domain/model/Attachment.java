package com.flamingo.ai.researchcache.domain.model;

import java.time.Instant;
import java.util.Optional;
import lombok.Builder;

/**
 * A cached attachment of an item. The file fields stay {@code null} until the bytes are downloaded,
 * and survive later metadata refreshes.
 *
 * @param localPath absolute path of the blob file, {@code null} until downloaded
 * @param contentHash lowercase hex SHA-256 of the raw bytes
 */
@Builder(toBuilder = true)
public record Attachment(
    String key,
    String parentItemKey,
    String filename,
    String contentType,
    String localPath,
    String contentHash,
    Long fileSize,
    Instant downloadedAt,
    long version,
    Instant lastSynced) {

  public Optional<String> downloadedPath() {
    return Optional.ofNullable(localPath);
  }

  public Optional<String> hash() {
    return Optional.ofNullable(contentHash);
  }
}
