package com.flamingo.ai.researchcache.domain.model;

import java.util.Set;

/**
 * Candidate pruning applied before any vector is scored. An empty set means "no restriction".
 *
 * @param itemTypes keep chunks whose item type is in this set
 * @param docTypes keep chunks whose document type is in this set
 * @param itemKeys keep chunks belonging to these items
 */
public record SearchFilters(Set<String> itemTypes, Set<String> docTypes, Set<String> itemKeys) {

  public static final SearchFilters NONE = new SearchFilters(Set.of(), Set.of(), Set.of());

  public SearchFilters {
    itemTypes = itemTypes == null ? Set.of() : Set.copyOf(itemTypes);
    docTypes = docTypes == null ? Set.of() : Set.copyOf(docTypes);
    itemKeys = itemKeys == null ? Set.of() : Set.copyOf(itemKeys);
  }

  public static SearchFilters forItems(Set<String> itemKeys) {
    return new SearchFilters(Set.of(), Set.of(), itemKeys);
  }

  public boolean isEmpty() {
    return itemTypes.isEmpty() && docTypes.isEmpty() && itemKeys.isEmpty();
  }
}
