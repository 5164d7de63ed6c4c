package com.flamingo.ai.researchcache.domain.model;

/**
 * A persisted chunk row, including its encoded embedding.
 *
 * @param id row id, {@code null} before insert
 * @param pageNumber 1-based page for paged sources, otherwise {@code null}
 * @param sectionId heading marker and text (e.g. {@code "## Methods"}) for sectioned sources
 */
public record StoredChunk(
    Long id,
    String itemKey,
    int chunkIndex,
    String text,
    byte[] embedding,
    Integer pageNumber,
    String sectionId,
    int charStart,
    int charEnd,
    String itemType,
    String docType,
    String contentHash) {}
