package com.flamingo.ai.researchcache.service.index;

import java.util.List;

/**
 * A source ranked by discovery.
 *
 * @param relevanceScore weighted blend of the best and the mean chunk similarity
 * @param chunkCount chunks of this source among the discovery candidates
 * @param excerpts leading text of the best-ranked chunks, at most three
 */
public record SourceMatch(
    String itemKey,
    String title,
    String authors,
    String date,
    String itemType,
    String docType,
    double relevanceScore,
    int chunkCount,
    List<Excerpt> excerpts) {

  public SourceMatch {
    excerpts = List.copyOf(excerpts);
  }

  /** A chunk excerpt with where it was found. */
  public record Excerpt(String text, Integer pageNumber, String sectionId, double similarity) {

    /** {@code "Page 3"}, the section heading, or an empty string. */
    public String location() {
      if (pageNumber != null) {
        return "Page " + pageNumber;
      }
      return sectionId == null ? "" : sectionId;
    }
  }
}
