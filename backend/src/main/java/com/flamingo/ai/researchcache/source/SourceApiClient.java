package com.flamingo.ai.researchcache.source;

import java.util.List;

/**
 * The remote reference library the cache mirrors. Implementations own authentication and
 * pagination; every method is a blocking call.
 *
 * <p>Any failure to reach the remote must surface as {@link
 * com.flamingo.ai.researchcache.exception.SourceConnectionException}. Other runtime exceptions are
 * treated as failures of the single record being processed.
 */
public interface SourceApiClient {

  RemoteCollection getCollection(String collectionKey);

  /** Direct children of {@code collectionKey}, not the whole subtree. */
  List<RemoteCollection> getSubcollections(String collectionKey);

  /** Top-level items of one collection (attachments and notes may appear among them). */
  List<RemoteItem> getItems(String collectionKey);

  /** Attachments and notes of one item. */
  List<RemoteChild> getChildren(String itemKey);

  byte[] downloadAttachment(String attachmentKey);
}
