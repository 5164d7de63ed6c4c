package com.flamingo.ai.researchcache.domain.model;

import java.util.List;

/** Vector index totals for one store. */
public record VectorStats(long chunkCount, long indexedItems, List<String> embeddingModels) {}
