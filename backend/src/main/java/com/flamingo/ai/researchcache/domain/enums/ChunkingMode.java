package com.flamingo.ai.researchcache.domain.enums;

/** How extracted text is split into chunks. */
public enum ChunkingMode {
  /** Form-feed separated pages; chunks carry a page number. */
  PAGED,
  /** Markdown headings delimit sections; chunks carry a section id. */
  SECTIONED,
  /** Character offsets only. */
  PLAIN
}
