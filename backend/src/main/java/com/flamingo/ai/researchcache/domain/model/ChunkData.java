package com.flamingo.ai.researchcache.domain.model;

/**
 * A chunk of extracted text with citation provenance, as produced by the chunker.
 *
 * @param text trimmed chunk text
 * @param chunkIndex 0-based, strictly increasing within one document
 * @param pageNumber 1-based page containing the first character, paged sources only
 * @param sectionId enclosing heading (e.g. {@code "## Methods"}), sectioned sources only
 * @param charStart start offset of the raw slice in the chunked text
 * @param charEnd end offset (exclusive) of the raw slice
 */
public record ChunkData(
    String text,
    int chunkIndex,
    Integer pageNumber,
    String sectionId,
    int charStart,
    int charEnd) {}
