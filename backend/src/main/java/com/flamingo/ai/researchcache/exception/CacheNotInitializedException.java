package com.flamingo.ai.researchcache.exception;

/** Exception thrown when an operation targets a collection whose local cache was never built. */
public class CacheNotInitializedException extends RuntimeException {

  private final String collectionKey;
  private final String guidance;

  public CacheNotInitializedException(String collectionKey, String guidance) {
    super("Local cache for collection " + collectionKey + " is not ready: " + guidance);
    this.collectionKey = collectionKey;
    this.guidance = guidance;
  }

  public String getCollectionKey() {
    return collectionKey;
  }

  public String getGuidance() {
    return guidance;
  }
}
