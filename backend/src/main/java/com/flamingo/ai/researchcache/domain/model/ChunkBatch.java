package com.flamingo.ai.researchcache.domain.model;

import java.util.List;

/**
 * Everything needed to replace one item's chunks: the ordered chunk list, a parallel list of
 * encoded embeddings, and the provenance stamped on every row.
 *
 * @param contentHash hash of the text the chunks were cut from
 * @param embeddingModel catalog name of the model that produced the embeddings
 */
public record ChunkBatch(
    String itemKey,
    String itemType,
    String docType,
    String contentHash,
    String embeddingModel,
    List<ChunkData> chunks,
    List<byte[]> embeddings) {}
