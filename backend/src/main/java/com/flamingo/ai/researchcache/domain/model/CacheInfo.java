package com.flamingo.ai.researchcache.domain.model;

import java.time.Instant;

/** Snapshot of what a collection's local cache holds. */
public record CacheInfo(
    String collectionKey,
    long collections,
    long items,
    long attachments,
    long downloadedAttachments,
    long notes,
    long extractedDocuments,
    long chunks,
    long indexedItems,
    long blobBytes,
    long lastSyncVersion,
    Instant lastSyncTime) {}
