package com.flamingo.ai.researchcache.service.extraction;

import com.flamingo.ai.researchcache.domain.enums.ExtractionMethod;

/**
 * Text pulled out of one attachment.
 *
 * @param text for PDFs, pages separated by form feeds; for HTML, markdown-style headings
 */
public record ExtractedText(ExtractionMethod method, String text) {}
