package com.flamingo.ai.researchcache.store;

import com.flamingo.ai.researchcache.domain.model.Attachment;
import com.flamingo.ai.researchcache.domain.model.LibraryItem;
import com.flamingo.ai.researchcache.domain.model.Note;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * In-memory lookups for the hot membership queries of one store, keyed by collection or item key.
 *
 * <p>Entries are only populated outside a transaction, so uncommitted rows never leak into the
 * cache. Writers invalidate the affected key explicitly.
 */
class StoreSessionCache {

  private final Map<String, List<LibraryItem>> itemsByCollection = new ConcurrentHashMap<>();
  private final Map<String, List<Attachment>> attachmentsByItem = new ConcurrentHashMap<>();
  private final Map<String, List<Note>> notesByItem = new ConcurrentHashMap<>();

  List<LibraryItem> itemsInCollection(String collectionKey, Supplier<List<LibraryItem>> loader) {
    return lookup(itemsByCollection, collectionKey, loader);
  }

  List<Attachment> attachmentsOf(String itemKey, Supplier<List<Attachment>> loader) {
    return lookup(attachmentsByItem, itemKey, loader);
  }

  List<Note> notesOf(String itemKey, Supplier<List<Note>> loader) {
    return lookup(notesByItem, itemKey, loader);
  }

  /** An item row changed; the cached item lists that may contain it are dropped. */
  void invalidateItemLists() {
    itemsByCollection.clear();
  }

  void invalidateCollection(String collectionKey) {
    itemsByCollection.remove(collectionKey);
  }

  void invalidateChildren(String itemKey) {
    attachmentsByItem.remove(itemKey);
    notesByItem.remove(itemKey);
  }

  void clear() {
    itemsByCollection.clear();
    attachmentsByItem.clear();
    notesByItem.clear();
  }

  int size() {
    return itemsByCollection.size() + attachmentsByItem.size() + notesByItem.size();
  }

  private static <T> List<T> lookup(
      Map<String, List<T>> map, String key, Supplier<List<T>> loader) {
    if (TransactionSynchronizationManager.isActualTransactionActive()) {
      return loader.get();
    }
    List<T> cached = map.get(key);
    if (cached != null) {
      return cached;
    }
    List<T> loaded = List.copyOf(loader.get());
    map.put(key, loaded);
    return loaded;
  }
}
