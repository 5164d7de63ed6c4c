package com.flamingo.ai.researchcache.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.researchcache.domain.enums.FileStatus;
import com.flamingo.ai.researchcache.domain.model.Attachment;
import com.flamingo.ai.researchcache.domain.model.CacheInfo;
import com.flamingo.ai.researchcache.domain.model.ChunkBatch;
import com.flamingo.ai.researchcache.domain.model.ChunkData;
import com.flamingo.ai.researchcache.domain.model.IndexState;
import com.flamingo.ai.researchcache.domain.model.LibraryCollection;
import com.flamingo.ai.researchcache.domain.model.LibraryItem;
import com.flamingo.ai.researchcache.domain.model.Note;
import com.flamingo.ai.researchcache.domain.model.SearchFilters;
import com.flamingo.ai.researchcache.domain.model.StoredChunk;
import com.flamingo.ai.researchcache.domain.model.SyncState;
import com.flamingo.ai.researchcache.domain.model.VectorStats;
import com.flamingo.ai.researchcache.exception.ChunkValidationException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

/**
 * The embedded store of one synced collection: a SQLite database plus an attachment blob
 * directory.
 *
 * <p>Connections are short-lived. Outside a transaction every statement opens its own connection;
 * inside {@link #inTransaction} all statements share one. Multi-row mutations that form a logical
 * unit (orphan removal, chunk replacement, clearing) run in a single transaction and are never
 * partially visible.
 */
@Slf4j
public class LocalStore implements AutoCloseable {

  public static final String DATABASE_FILE = "store.db";
  public static final String ATTACHMENTS_DIR = "attachments";

  private static final int BUSY_TIMEOUT_MS = 5000;

  private final String collectionKey;
  private final Path storeDir;
  private final TransactionTemplate transactionTemplate;
  private final TransactionTemplate savepointTemplate;
  private final SchemaManager schemaManager;
  private final AttachmentFileStore fileStore;
  private final StoreSessionCache sessionCache = new StoreSessionCache();
  private final Object blobJournalKey = new Object();

  private final CollectionRepository collections;
  private final ItemRepository items;
  private final AttachmentRepository attachments;
  private final NoteRepository notes;
  private final SyncStateRepository syncStates;
  private final ExtractedContentRepository extractedContent;
  private final ChunkRepository chunks;

  private LocalStore(String collectionKey, Path storeDir, ObjectMapper objectMapper) {
    this.collectionKey = collectionKey;
    this.storeDir = storeDir;

    SQLiteConfig config = new SQLiteConfig();
    config.enforceForeignKeys(true);
    config.setBusyTimeout(BUSY_TIMEOUT_MS);
    config.setJournalMode(SQLiteConfig.JournalMode.WAL);
    SQLiteDataSource dataSource = new SQLiteDataSource(config);
    dataSource.setUrl("jdbc:sqlite:" + storeDir.resolve(DATABASE_FILE).toAbsolutePath());

    JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
    DataSourceTransactionManager transactionManager = new DataSourceTransactionManager(dataSource);
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.savepointTemplate = new TransactionTemplate(transactionManager);
    this.savepointTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);

    this.schemaManager = new SchemaManager(jdbcTemplate, transactionTemplate);
    this.fileStore = new AttachmentFileStore(storeDir.resolve(ATTACHMENTS_DIR));
    this.collections = new CollectionRepository(jdbcTemplate);
    this.items = new ItemRepository(jdbcTemplate, objectMapper);
    this.attachments = new AttachmentRepository(jdbcTemplate);
    this.notes = new NoteRepository(jdbcTemplate);
    this.syncStates = new SyncStateRepository(jdbcTemplate);
    this.extractedContent = new ExtractedContentRepository(jdbcTemplate);
    this.chunks = new ChunkRepository(jdbcTemplate);
  }

  /**
   * Opens (creating if needed) the store in {@code storeDir} and brings its schema up to date.
   *
   * @throws IllegalStateException if the database was written by a newer schema version
   */
  public static LocalStore open(String collectionKey, Path storeDir, ObjectMapper objectMapper) {
    try {
      Files.createDirectories(storeDir.resolve(ATTACHMENTS_DIR));
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot create store directory " + storeDir, e);
    }
    LocalStore store = new LocalStore(collectionKey, storeDir, objectMapper);
    store.schemaManager.migrate();
    log.debug("Opened local store for collection {} at {}", collectionKey, storeDir);
    return store;
  }

  public String collectionKey() {
    return collectionKey;
  }

  public Path storeDir() {
    return storeDir;
  }

  public int schemaVersion() {
    return schemaManager.installedVersion();
  }

  // ---- transactions ----

  public <T> T inTransaction(Supplier<T> work) {
    return transactionTemplate.execute(status -> work.get());
  }

  public void inTransaction(Runnable work) {
    transactionTemplate.executeWithoutResult(status -> work.run());
  }

  /**
   * Runs {@code work} inside a savepoint of the current transaction (or a new transaction when none
   * is active). A failure rolls back only the work of this call before the exception propagates.
   */
  public void inSavepoint(Runnable work) {
    BlobJournal journal = currentBlobJournal();
    int mark = journal == null ? 0 : journal.size();
    try {
      savepointTemplate.executeWithoutResult(status -> work.run());
    } catch (RuntimeException e) {
      BlobJournal current = currentBlobJournal();
      if (current != null) {
        current.rollbackTo(current == journal ? mark : 0);
      }
      throw e;
    }
  }

  // ---- repositories ----

  public CollectionRepository collections() {
    return collections;
  }

  public ItemRepository items() {
    return items;
  }

  public AttachmentRepository attachments() {
    return attachments;
  }

  public NoteRepository notes() {
    return notes;
  }

  public SyncStateRepository syncStates() {
    return syncStates;
  }

  public ExtractedContentRepository extractedContent() {
    return extractedContent;
  }

  public ChunkRepository chunks() {
    return chunks;
  }

  public AttachmentFileStore files() {
    return fileStore;
  }

  // ---- writes that keep the session cache honest ----

  public void upsertCollection(LibraryCollection collection) {
    collections.upsert(collection);
  }

  public void upsertItem(LibraryItem item, String memberOf) {
    items.upsert(item);
    if (memberOf != null) {
      items.addToCollection(item.key(), memberOf);
    }
    sessionCache.invalidateItemLists();
  }

  /** Records that an already stored item is also a member of {@code collectionKey}. */
  public void addMembership(String itemKey, String collectionKey) {
    items.addToCollection(itemKey, collectionKey);
    sessionCache.invalidateItemLists();
  }

  public void upsertAttachment(Attachment attachment) {
    attachments.upsertMetadata(attachment);
    sessionCache.invalidateChildren(attachment.parentItemKey());
  }

  public void upsertNote(Note note) {
    notes.upsert(note);
    if (note.parentItemKey() != null) {
      sessionCache.invalidateChildren(note.parentItemKey());
    }
  }

  /**
   * Writes attachment bytes to the blob directory and records path, hash and size on the row. When
   * the row change rolls back, the blob that was on disk before is restored.
   *
   * @return the attachment as now stored
   */
  public Attachment storeAttachmentFile(Attachment attachment, byte[] bytes) {
    AttachmentFileStore.BlobReplacement replacement =
        fileStore.replace(attachment.key(), attachment.filename(), attachment.contentType(), bytes);
    journal(replacement);
    Path path = replacement.target();
    String hash = ContentHashes.sha256Hex(bytes);
    Instant now = Instant.now();
    attachments.recordDownload(attachment.key(), path.toString(), hash, bytes.length, now);
    sessionCache.invalidateChildren(attachment.parentItemKey());
    return attachment.toBuilder()
        .localPath(path.toString())
        .contentHash(hash)
        .fileSize((long) bytes.length)
        .downloadedAt(now)
        .build();
  }

  public FileStatus attachmentFileStatus(Attachment attachment) {
    if (attachment.localPath() == null) {
      return FileStatus.NOT_DOWNLOADED;
    }
    return fileStore.exists(attachment.localPath()) ? FileStatus.AVAILABLE : FileStatus.MISSING;
  }

  /**
   * Reads an attachment's bytes.
   *
   * @throws com.flamingo.ai.researchcache.exception.AttachmentMissingException if the blob is not
   *     on disk
   */
  public byte[] readAttachmentBytes(Attachment attachment) {
    return fileStore.read(attachment.key(), attachment.localPath());
  }

  // ---- cached reads ----

  public List<LibraryItem> itemsInCollection(String collection) {
    return sessionCache.itemsInCollection(collection, () -> items.findByCollection(collection));
  }

  public List<Attachment> attachmentsOf(String itemKey) {
    return sessionCache.attachmentsOf(itemKey, () -> attachments.findByParent(itemKey));
  }

  public List<Note> notesOf(String itemKey) {
    return sessionCache.notesOf(itemKey, () -> notes.findByParent(itemKey));
  }

  public SyncState syncState() {
    return syncStates.find(collectionKey).orElse(SyncState.initial(collectionKey));
  }

  // ---- orphan reconciliation ----

  /**
   * Deletes cached items whose keys are not in {@code validKeys}, cascading to membership,
   * attachments, child notes, extracted content, chunks and index state. Blob files are deleted
   * after the transaction commits.
   *
   * @param scope when non-null, only items belonging to one of these collections are candidates
   * @return number of items removed
   */
  public int removeOrphanedItems(Set<String> validKeys, Collection<String> scope) {
    List<String> blobPaths = new ArrayList<>();
    int removed =
        inTransaction(
            () -> {
              List<String> cached =
                  scope == null ? items.findAllKeys() : items.findKeysInCollections(scope);
              List<String> orphans = minus(cached, validKeys);
              if (orphans.isEmpty()) {
                return 0;
              }
              blobPaths.addAll(attachments.findLocalPathsByParents(orphans));
              int count = items.deleteByKeys(orphans);
              orphans.forEach(sessionCache::invalidateChildren);
              sessionCache.invalidateItemLists();
              return count;
            });
    afterCommit(() -> fileStore.deleteAll(blobPaths));
    if (removed > 0) {
      log.info("Removed {} orphaned items from collection {}", removed, collectionKey);
    }
    return removed;
  }

  /** Deletes attachments and child notes of {@code itemKey} that are no longer remote. */
  public int removeOrphanedChildren(String itemKey, Set<String> validChildKeys) {
    return inTransaction(
        () -> {
          List<String> orphanAttachments =
              minus(attachments.findKeysByParent(itemKey), validChildKeys);
          List<String> orphanNotes = minus(notes.findKeysByParent(itemKey), validChildKeys);
          if (orphanAttachments.isEmpty() && orphanNotes.isEmpty()) {
            return 0;
          }
          List<String> blobPaths = attachments.findLocalPathsByKeys(orphanAttachments);
          int removed =
              attachments.deleteByKeys(orphanAttachments) + notes.deleteByKeys(orphanNotes);
          sessionCache.invalidateChildren(itemKey);
          afterCommit(() -> fileStore.deleteAll(blobPaths));
          return removed;
        });
  }

  public int removeOrphanedStandaloneNotes(String collection, Set<String> validNoteKeys) {
    return inTransaction(
        () -> notes.deleteByKeys(minus(notes.findStandaloneKeys(collection), validNoteKeys)));
  }

  /** Deletes cached collections not in {@code validKeys}. The store's root is never removed. */
  public int removeOrphanedCollections(Set<String> validKeys) {
    return inTransaction(
        () -> {
          List<String> orphans = minus(collections.findAllKeys(), validKeys);
          orphans.remove(collectionKey);
          orphans.forEach(sessionCache::invalidateCollection);
          return collections.deleteByKeys(orphans);
        });
  }

  // ---- vector rows ----

  /**
   * Replaces every chunk of one item and its index state in a single transaction.
   *
   * @throws ChunkValidationException if the chunk and embedding lists differ in length; nothing is
   *     written in that case
   */
  public IndexState replaceChunks(ChunkBatch batch) {
    if (batch.chunks().size() != batch.embeddings().size()) {
      throw new ChunkValidationException(
          batch.itemKey(), batch.chunks().size(), batch.embeddings().size());
    }
    List<StoredChunk> rows = new ArrayList<>(batch.chunks().size());
    for (int i = 0; i < batch.chunks().size(); i++) {
      ChunkData chunk = batch.chunks().get(i);
      rows.add(
          new StoredChunk(
              null,
              batch.itemKey(),
              chunk.chunkIndex(),
              chunk.text(),
              batch.embeddings().get(i),
              chunk.pageNumber(),
              chunk.sectionId(),
              chunk.charStart(),
              chunk.charEnd(),
              batch.itemType(),
              batch.docType(),
              batch.contentHash()));
    }
    IndexState state =
        new IndexState(
            batch.itemKey(),
            rows.size(),
            batch.contentHash(),
            batch.embeddingModel(),
            Instant.now());
    return inTransaction(
        () -> {
          chunks.deleteByItem(batch.itemKey());
          chunks.deleteIndexState(batch.itemKey());
          chunks.insertAll(rows);
          chunks.upsertIndexState(state);
          return state;
        });
  }

  public void forEachCandidate(SearchFilters filters, Consumer<StoredChunk> consumer) {
    chunks.forEachCandidate(filters, consumer);
  }

  public Set<String> indexedItemKeys() {
    Set<String> keys = new HashSet<>();
    chunks.findAllIndexStates().forEach(state -> keys.add(state.itemKey()));
    return keys;
  }

  public VectorStats vectorStats() {
    return new VectorStats(
        chunks.countChunks(), chunks.countIndexedItems(), chunks.findEmbeddingModels());
  }

  public void clearVectors() {
    inTransaction(chunks::deleteAll);
    log.info("Cleared vector index of collection {}", collectionKey);
  }

  // ---- whole-store operations ----

  public CacheInfo cacheInfo() {
    SyncState state = syncState();
    return new CacheInfo(
        collectionKey,
        collections.count(),
        items.count(),
        attachments.count(),
        attachments.countDownloaded(),
        notes.count(),
        extractedContent.count(),
        chunks.countChunks(),
        chunks.countIndexedItems(),
        fileStore.totalBytes(),
        state.lastSyncVersion(),
        state.lastSyncTime());
  }

  /** Deletes every cached row and blob of this collection. The schema stays in place. */
  public void clearAll() {
    List<String> blobPaths = new ArrayList<>();
    inTransaction(
        () -> {
          blobPaths.addAll(attachments.findAllLocalPaths());
          chunks.deleteAll();
          items.deleteByKeys(items.findAllKeys());
          collections.deleteByKeys(collections.findAllKeys());
        });
    sessionCache.clear();
    int deleted = fileStore.deleteAll(blobPaths);
    log.info("Cleared local cache of collection {} ({} blob files)", collectionKey, deleted);
  }

  int sessionCacheSize() {
    return sessionCache.size();
  }

  @Override
  public void close() {
    sessionCache.clear();
    log.debug("Closed local store for collection {}", collectionKey);
  }

  private BlobJournal currentBlobJournal() {
    return (BlobJournal) TransactionSynchronizationManager.getResource(blobJournalKey);
  }

  private void journal(AttachmentFileStore.BlobReplacement replacement) {
    if (!TransactionSynchronizationManager.isSynchronizationActive()) {
      replacement.commit();
      return;
    }
    BlobJournal journal = currentBlobJournal();
    if (journal == null) {
      BlobJournal created = new BlobJournal();
      TransactionSynchronizationManager.bindResource(blobJournalKey, created);
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
              TransactionSynchronizationManager.unbindResourceIfPossible(blobJournalKey);
              if (status == STATUS_COMMITTED) {
                created.commit();
              } else {
                created.rollbackTo(0);
              }
            }
          });
      journal = created;
    }
    journal.record(replacement);
  }

  private void afterCommit(Runnable action) {
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              action.run();
            }
          });
    } else {
      action.run();
    }
  }

  private static List<String> minus(List<String> keys, Set<String> keep) {
    List<String> result = new ArrayList<>();
    for (String key : keys) {
      if (!keep.contains(key)) {
        result.add(key);
      }
    }
    return result;
  }
}
