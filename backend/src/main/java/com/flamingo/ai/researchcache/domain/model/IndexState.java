package com.flamingo.ai.researchcache.domain.model;

import java.time.Instant;

/** Marks an item as indexed. The only source of truth for "is this item indexed". */
public record IndexState(
    String itemKey, int chunkCount, String contentHash, String embeddingModel, Instant indexedAt) {}
