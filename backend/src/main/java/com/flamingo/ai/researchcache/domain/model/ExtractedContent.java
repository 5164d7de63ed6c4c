package com.flamingo.ai.researchcache.domain.model;

import com.flamingo.ai.researchcache.domain.enums.ExtractionMethod;
import java.time.Instant;

/**
 * Cached text extraction for an item.
 *
 * @param sourceHash content hash of the attachment the text came from; extraction is not repeated
 *     while it matches
 */
public record ExtractedContent(
    String itemKey,
    ExtractionMethod method,
    String text,
    String sourceHash,
    Instant extractionDate) {}
