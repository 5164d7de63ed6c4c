package com.flamingo.ai.researchcache.service.sync;

import com.flamingo.ai.researchcache.config.ResearchCacheProperties;
import com.flamingo.ai.researchcache.domain.enums.FileStatus;
import com.flamingo.ai.researchcache.domain.model.Attachment;
import com.flamingo.ai.researchcache.domain.model.CacheInfo;
import com.flamingo.ai.researchcache.domain.model.ExtractedContent;
import com.flamingo.ai.researchcache.domain.model.LibraryCollection;
import com.flamingo.ai.researchcache.domain.model.LibraryItem;
import com.flamingo.ai.researchcache.domain.model.Note;
import com.flamingo.ai.researchcache.domain.model.SyncState;
import com.flamingo.ai.researchcache.exception.ContentExtractionException;
import com.flamingo.ai.researchcache.exception.SourceConnectionException;
import com.flamingo.ai.researchcache.service.extraction.ContentExtractorRouter;
import com.flamingo.ai.researchcache.service.extraction.ExtractedText;
import com.flamingo.ai.researchcache.source.RemoteChild;
import com.flamingo.ai.researchcache.source.RemoteCollection;
import com.flamingo.ai.researchcache.source.RemoteItem;
import com.flamingo.ai.researchcache.source.SourceApiClient;
import com.flamingo.ai.researchcache.store.LocalStore;
import com.flamingo.ai.researchcache.store.LocalStoreRegistry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Default {@link CollectionSyncService}.
 *
 * <p>A pass runs in this order:
 *
 * <ol>
 *   <li>fetch the collection tree and upsert it in two phases (nodes first, parent pointers after)
 *   <li>per collection, one transaction holding a savepoint per item: item row, membership,
 *       attachments (downloaded and hashed), child notes, extracted text
 *   <li>orphan reconciliation, skipped when the pass was aborted
 *   <li>sync state, written last
 * </ol>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CollectionSyncServiceImpl implements CollectionSyncService {

  private final LocalStoreRegistry storeRegistry;
  private final SourceApiClient sourceApiClient;
  private final ContentExtractorRouter extractorRouter;
  private final ResearchCacheProperties properties;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "sync.collection", description = "Time to sync one collection")
  public SyncStats sync(String collectionKey, SyncMode requested) {
    LocalStore store = storeRegistry.openOrCreate(collectionKey);
    SyncState previous = store.syncState();
    SyncMode mode =
        requested == SyncMode.INCREMENTAL && !previous.hasSynced() ? SyncMode.FULL : requested;
    if (mode != requested) {
      log.info("Collection {} was never synced; running a full sync", collectionKey);
    }
    SyncStats stats = new SyncStats(collectionKey, mode);
    log.info("Starting {} sync of collection {}", mode, collectionKey);

    try {
      List<RemoteCollection> tree = fetchTree(collectionKey);
      upsertTree(store, tree, stats);

      PassState pass = new PassState(previous.lastSyncVersion());
      tree.forEach(node -> pass.seeVersion(node.version()));
      for (RemoteCollection node : tree) {
        List<RemoteItem> items = sourceApiClient.getItems(node.key());
        store.inTransaction(
            () -> {
              syncCollectionItems(store, node, items, mode, stats, pass);
            });
        log.debug("Committed {} items of collection {}", items.size(), node.key());
      }

      reconcileOrphans(store, tree, pass, stats);
      store.syncStates().save(new SyncState(collectionKey, pass.maxVersion, Instant.now(), true));
    } catch (SourceConnectionException e) {
      stats.abort();
      meterRegistry.counter("sync.aborted").increment();
      log.error(
          "Sync of collection {} aborted, remote unreachable: {}", collectionKey, e.getMessage());
    }

    meterRegistry.counter("sync.items", "mode", mode.name()).increment(stats.getItemsSynced());
    log.info("Finished sync of collection {}: {}", collectionKey, stats);
    return stats;
  }

  @Override
  public CacheInfo initialize(String collectionKey) {
    LocalStore store = storeRegistry.openOrCreate(collectionKey);
    if (store.collections().findByKey(collectionKey).isEmpty()) {
      RemoteCollection root = sourceApiClient.getCollection(collectionKey);
      store.inTransaction(
          () -> {
            store.upsertCollection(toCollection(root, null));
            store.syncStates().ensure(collectionKey);
          });
      log.info("Initialized local cache of collection {} ({})", collectionKey, root.name());
    }
    return store.cacheInfo();
  }

  @Override
  public CacheInfo status(String collectionKey) {
    return storeRegistry.requireInitialized(collectionKey).cacheInfo();
  }

  @Override
  public void clear(String collectionKey) {
    storeRegistry.requireInitialized(collectionKey).clearAll();
  }

  // ---- collection tree ----

  /** Root first, then descendants breadth-first. Each node is visited once. */
  private List<RemoteCollection> fetchTree(String rootKey) {
    List<RemoteCollection> tree = new ArrayList<>();
    tree.add(sourceApiClient.getCollection(rootKey));
    if (!properties.getSync().isIncludeSubcollections()) {
      return tree;
    }
    Set<String> seen = new HashSet<>(Set.of(rootKey));
    Deque<String> pending = new ArrayDeque<>(List.of(rootKey));
    while (!pending.isEmpty()) {
      for (RemoteCollection child : sourceApiClient.getSubcollections(pending.poll())) {
        if (seen.add(child.key())) {
          tree.add(child);
          pending.add(child.key());
        }
      }
    }
    return tree;
  }

  private void upsertTree(LocalStore store, List<RemoteCollection> tree, SyncStats stats) {
    Set<String> synced = new HashSet<>();
    tree.forEach(node -> synced.add(node.key()));
    String rootKey = store.collectionKey();
    store.inTransaction(
        () -> {
          for (RemoteCollection node : tree) {
            store.upsertCollection(toCollection(node, null));
            stats.collectionSynced();
          }
          for (RemoteCollection node : tree) {
            // a parent outside the synced set has no row to point at
            if (!node.key().equals(rootKey)
                && node.parentKey() != null
                && synced.contains(node.parentKey())) {
              store.collections().updateParent(node.key(), node.parentKey());
            }
          }
          store.syncStates().ensure(rootKey);
        });
  }

  // ---- items ----

  private void syncCollectionItems(
      LocalStore store,
      RemoteCollection node,
      List<RemoteItem> items,
      SyncMode mode,
      SyncStats stats,
      PassState pass) {
    Set<String> memberKeys = pass.membersOf(node.key());
    Set<String> standaloneNotes = pass.standaloneNotesOf(node.key());
    for (RemoteItem item : items) {
      pass.seeVersion(item.version());
      if (item.isAttachment()) {
        log.debug("Skipping top-level attachment {} in collection {}", item.key(), node.key());
        stats.skipped();
        continue;
      }
      if (item.isNote()) {
        standaloneNotes.add(item.key());
      } else {
        memberKeys.add(item.key());
        pass.remoteItemKeys.add(item.key());
        if (pass.syncedItemKeys.contains(item.key())) {
          store.addMembership(item.key(), node.key());
          continue;
        }
      }
      try {
        store.inSavepoint(
            () -> {
              if (item.isNote()) {
                syncStandaloneNote(store, node.key(), item);
                stats.noteSynced();
              } else {
                syncItem(store, node.key(), item, mode, stats, pass);
                stats.itemSynced();
                pass.syncedItemKeys.add(item.key());
              }
            });
      } catch (SourceConnectionException e) {
        throw e;
      } catch (RuntimeException e) {
        stats.error();
        meterRegistry.counter("sync.item.failure").increment();
        log.warn(
            "Failed to sync item {} in collection {}: {}", item.key(), node.key(), e.getMessage());
        log.debug("Item sync failure", e);
      }
    }
  }

  private void syncStandaloneNote(LocalStore store, String collectionKey, RemoteItem item) {
    store.upsertNote(
        new Note(
            item.key(),
            null,
            collectionKey,
            item.title(),
            item.note(),
            item.version(),
            Instant.now()));
  }

  private void syncItem(
      LocalStore store,
      String collectionKey,
      RemoteItem remote,
      SyncMode mode,
      SyncStats stats,
      PassState pass) {
    Instant now = Instant.now();
    store.upsertItem(
        LibraryItem.builder()
            .key(remote.key())
            .itemType(remote.itemType())
            .title(remote.title())
            .date(remote.date())
            .url(remote.url())
            .metadata(remote.metadata())
            .version(remote.version())
            .lastSynced(now)
            .build(),
        collectionKey);

    Set<String> childKeys = new HashSet<>();
    for (RemoteChild child : sourceApiClient.getChildren(remote.key())) {
      pass.seeVersion(child.version());
      if (child.isAttachment()) {
        childKeys.add(child.key());
        syncAttachment(store, remote.key(), child, mode, stats);
      } else if (child.isNote()) {
        childKeys.add(child.key());
        store.upsertNote(
            new Note(
                child.key(),
                remote.key(),
                null,
                child.title(),
                child.note(),
                child.version(),
                now));
        stats.noteSynced();
      }
    }
    stats.orphansRemoved(store.removeOrphanedChildren(remote.key(), childKeys));
    extractContent(store, remote.key(), stats);
  }

  private void syncAttachment(
      LocalStore store, String itemKey, RemoteChild child, SyncMode mode, SyncStats stats) {
    Optional<Attachment> cached = store.attachments().findByKey(child.key());
    store.upsertAttachment(
        Attachment.builder()
            .key(child.key())
            .parentItemKey(itemKey)
            .filename(child.filename())
            .contentType(child.contentType())
            .version(child.version())
            .lastSynced(Instant.now())
            .build());
    if (!child.hasDownloadableFile()) {
      return;
    }

    Attachment current = store.attachments().findByKey(child.key()).orElseThrow();
    FileStatus fileStatus = store.attachmentFileStatus(current);
    boolean unchanged =
        mode == SyncMode.INCREMENTAL
            && cached.isPresent()
            && cached.get().version() == child.version()
            && fileStatus == FileStatus.AVAILABLE;
    if (unchanged) {
      stats.attachmentSkipped();
      return;
    }
    if (fileStatus == FileStatus.MISSING) {
      log.info("Blob of attachment {} is missing on disk; downloading again", child.key());
    }
    byte[] bytes = sourceApiClient.downloadAttachment(child.key());
    Attachment stored = store.storeAttachmentFile(current, bytes);
    stats.attachmentDownloaded();
    log.debug(
        "Downloaded attachment {} ({} bytes) to {}", child.key(), bytes.length, stored.localPath());
  }

  /**
   * Caches the text of the first downloaded attachment that yields any. Kept as-is while it was
   * extracted from an attachment whose bytes are still present with the same hash.
   */
  private void extractContent(LocalStore store, String itemKey, SyncStats stats) {
    List<Attachment> candidates = new ArrayList<>();
    for (Attachment attachment : store.attachments().findByParent(itemKey)) {
      if (store.attachmentFileStatus(attachment) == FileStatus.AVAILABLE
          && extractorRouter.canExtract(attachment.contentType(), attachment.filename())) {
        candidates.add(attachment);
      }
    }
    if (candidates.isEmpty()) {
      return;
    }
    String extractedFrom =
        store.extractedContent().find(itemKey).map(ExtractedContent::sourceHash).orElse(null);
    if (extractedFrom != null
        && candidates.stream().anyMatch(a -> extractedFrom.equals(a.contentHash()))) {
      return;
    }

    for (Attachment attachment : candidates) {
      Optional<ExtractedText> text;
      try {
        text =
            extractorRouter.extract(
                Path.of(attachment.localPath()), attachment.contentType(), attachment.filename());
      } catch (ContentExtractionException e) {
        meterRegistry.counter("sync.extraction.failure").increment();
        log.warn("Could not extract text of attachment {}: {}", attachment.key(), e.getMessage());
        continue;
      }
      if (text.isPresent()) {
        store
            .extractedContent()
            .save(
                new ExtractedContent(
                    itemKey,
                    text.get().method(),
                    text.get().text(),
                    attachment.contentHash(),
                    Instant.now()));
        stats.contentExtracted();
        log.debug(
            "Extracted {} chars of {} text for item {}",
            text.get().text().length(),
            text.get().method(),
            itemKey);
        return;
      }
    }
  }

  // ---- orphans ----

  private void reconcileOrphans(
      LocalStore store, List<RemoteCollection> tree, PassState pass, SyncStats stats) {
    Set<String> collectionKeys = new LinkedHashSet<>();
    tree.forEach(node -> collectionKeys.add(node.key()));

    int removed = 0;
    for (String key : collectionKeys) {
      store.items().removeStaleMemberships(key, pass.membersOf(key));
      removed += store.removeOrphanedStandaloneNotes(key, pass.standaloneNotesOf(key));
    }
    removed += store.removeOrphanedItems(pass.remoteItemKeys, null);
    removed += store.removeOrphanedCollections(collectionKeys);
    stats.orphansRemoved(removed);
  }

  private static LibraryCollection toCollection(RemoteCollection remote, String parentKey) {
    return new LibraryCollection(
        remote.key(), remote.name(), parentKey, remote.version(), Instant.now());
  }

  /** What a pass has seen remotely so far. */
  private static final class PassState {
    private long maxVersion;
    private final Set<String> remoteItemKeys = new HashSet<>();
    // items already synced in an earlier collection of this pass
    private final Set<String> syncedItemKeys = new HashSet<>();
    private final Map<String, Set<String>> members = new HashMap<>();
    private final Map<String, Set<String>> standaloneNotes = new HashMap<>();

    private PassState(long previousVersion) {
      this.maxVersion = previousVersion;
    }

    void seeVersion(long version) {
      maxVersion = Math.max(maxVersion, version);
    }

    Set<String> membersOf(String collectionKey) {
      return members.computeIfAbsent(collectionKey, k -> new HashSet<>());
    }

    Set<String> standaloneNotesOf(String collectionKey) {
      return standaloneNotes.computeIfAbsent(collectionKey, k -> new HashSet<>());
    }
  }
}
