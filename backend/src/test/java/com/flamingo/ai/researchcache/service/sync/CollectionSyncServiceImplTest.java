package com.flamingo.ai.researchcache.service.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.researchcache.config.ResearchCacheProperties;
import com.flamingo.ai.researchcache.domain.enums.ExtractionMethod;
import com.flamingo.ai.researchcache.domain.enums.FileStatus;
import com.flamingo.ai.researchcache.domain.model.Attachment;
import com.flamingo.ai.researchcache.domain.model.CacheInfo;
import com.flamingo.ai.researchcache.domain.model.ExtractedContent;
import com.flamingo.ai.researchcache.domain.model.LibraryCollection;
import com.flamingo.ai.researchcache.domain.model.LibraryItem;
import com.flamingo.ai.researchcache.domain.model.Note;
import com.flamingo.ai.researchcache.domain.model.SyncState;
import com.flamingo.ai.researchcache.exception.CacheNotInitializedException;
import com.flamingo.ai.researchcache.service.extraction.ContentExtractorRouter;
import com.flamingo.ai.researchcache.service.extraction.HtmlContentExtractor;
import com.flamingo.ai.researchcache.service.extraction.PdfBoxContentExtractor;
import com.flamingo.ai.researchcache.service.extraction.PlainTextContentExtractor;
import com.flamingo.ai.researchcache.store.LocalStore;
import com.flamingo.ai.researchcache.store.LocalStoreRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("CollectionSyncServiceImpl Tests")
class CollectionSyncServiceImplTest {

  private static final String ROOT = "ROOT0001";
  private static final String SUB1 = "SUB00001";
  private static final String SUB2 = "SUB00002";
  private static final String PAPER_TEXT = "Full text of the first paper.";

  @TempDir Path cacheRoot;

  private ResearchCacheProperties properties;
  private LocalStoreRegistry registry;
  private FakeSourceApiClient remote;
  private SimpleMeterRegistry meterRegistry;
  private CollectionSyncServiceImpl syncService;

  @BeforeEach
  void setUp() {
    properties = new ResearchCacheProperties();
    properties.setCacheDir(cacheRoot.toString());
    registry = new LocalStoreRegistry(properties, new ObjectMapper());
    meterRegistry = new SimpleMeterRegistry();
    remote =
        new FakeSourceApiClient()
            .collection(ROOT, "Thesis", "OUTSIDE", 10)
            .collection(SUB1, "Methods", ROOT, 11)
            .collection(SUB2, "Reading", SUB1, 12)
            .item(ROOT, "P1", "Sampling frames", 20)
            .childNote("P1", "N1", "<p>check table 2</p>", 21)
            .attachment("P1", "ATT1", "paper.txt", "text/plain", PAPER_TEXT, 22)
            .linkedUrl("P1", "LNK1", 23)
            .standaloneNote(ROOT, "SN1", "<h1>Ideas</h1><p>more</p>", 24)
            .topLevelAttachment(ROOT, "TA1", 25)
            .item(SUB1, "P2", "Response rates", 30)
            .attachment("P2", "ATT2", "notes.md", "text/markdown", "# Rates\n\nAll waves.", 31);

    ContentExtractorRouter router =
        new ContentExtractorRouter(
            List.of(
                new PdfBoxContentExtractor(),
                new HtmlContentExtractor(),
                new PlainTextContentExtractor()));
    syncService =
        new CollectionSyncServiceImpl(registry, remote, router, properties, meterRegistry);
  }

  @AfterEach
  void tearDown() {
    registry.closeAll();
  }

  private LocalStore store() {
    return registry.openOrCreate(ROOT);
  }

  @Nested
  @DisplayName("Full sync")
  class FullSync {

    @Test
    @DisplayName("Should mirror the collection tree, items, children and extracted text")
    void shouldMirrorCollection() {
      SyncStats stats = syncService.sync(ROOT, SyncMode.FULL);

      assertThat(stats.isAborted()).isFalse();
      assertThat(stats.getCollectionsSynced()).isEqualTo(3);
      assertThat(stats.getItemsSynced()).isEqualTo(2);
      assertThat(stats.getNotesSynced()).isEqualTo(2);
      assertThat(stats.getAttachmentsDownloaded()).isEqualTo(2);
      assertThat(stats.getContentExtracted()).isEqualTo(2);
      assertThat(stats.getSkipped()).isEqualTo(1);
      assertThat(stats.getErrors()).isZero();
      assertThat(stats.processed()).isEqualTo(7);

      LocalStore store = store();
      assertThat(store.items().findCollectionKeys("P1")).containsExactly(ROOT);
      assertThat(store.items().findCollectionKeys("P2")).containsExactly(SUB1);
      assertThat(store.items().findByKey("TA1")).isEmpty();
      assertThat(store.notes().findByKey("N1"))
          .get()
          .extracting(Note::parentItemKey)
          .isEqualTo("P1");
      assertThat(store.notes().findStandalone(ROOT))
          .singleElement()
          .satisfies(n -> assertThat(n.title()).isEqualTo("Ideas"));

      Attachment att1 = store.attachments().findByKey("ATT1").orElseThrow();
      assertThat(store.attachmentFileStatus(att1)).isEqualTo(FileStatus.AVAILABLE);
      Attachment link = store.attachments().findByKey("LNK1").orElseThrow();
      assertThat(store.attachmentFileStatus(link)).isEqualTo(FileStatus.NOT_DOWNLOADED);

      ExtractedContent p1 = store.extractedContent().find("P1").orElseThrow();
      assertThat(p1.method()).isEqualTo(ExtractionMethod.PLAIN_TEXT);
      assertThat(p1.text()).isEqualTo(PAPER_TEXT);
      assertThat(p1.sourceHash()).isEqualTo(att1.contentHash());
      assertThat(store.extractedContent().find("P2"))
          .get()
          .extracting(ExtractedContent::method)
          .isEqualTo(ExtractionMethod.MARKDOWN);

      SyncState state = store.syncState();
      assertThat(state.hasSynced()).isTrue();
      assertThat(state.fullSyncCompleted()).isTrue();
      assertThat(state.lastSyncVersion()).isEqualTo(31L);
    }

    @Test
    @DisplayName("Should link parents after all nodes exist and drop parents outside the tree")
    void shouldLinkParents() {
      syncService.sync(ROOT, SyncMode.FULL);

      LocalStore store = store();
      assertThat(store.collections().findByKey(ROOT)).get().extracting(LibraryCollection::parentKey)
          .isNull();
      assertThat(store.collections().findByKey(SUB1)).get().extracting(LibraryCollection::parentKey)
          .isEqualTo(ROOT);
      assertThat(store.collections().findByKey(SUB2)).get().extracting(LibraryCollection::parentKey)
          .isEqualTo(SUB1);
    }

    @Test
    @DisplayName("Should leave the cache unchanged when run twice")
    void shouldBeIdempotent() {
      syncService.sync(ROOT, SyncMode.FULL);
      CacheInfo first = store().cacheInfo();

      syncService.sync(ROOT, SyncMode.FULL);
      CacheInfo second = store().cacheInfo();

      assertThat(second)
          .usingRecursiveComparison()
          .ignoringFields("lastSyncTime")
          .isEqualTo(first);
    }

    @Test
    @DisplayName("Should sync an item filed in several collections once and record each membership")
    void shouldSyncSharedItemOnce() {
      remote.item(SUB2, "P1", "Sampling frames", 20);

      SyncStats stats = syncService.sync(ROOT, SyncMode.FULL);

      assertThat(stats.getItemsSynced()).isEqualTo(2);
      assertThat(stats.getAttachmentsDownloaded()).isEqualTo(2);
      assertThat(stats.getErrors()).isZero();
      assertThat(remote.childListingsOf("P1")).isEqualTo(1);
      assertThat(remote.downloadsOf("ATT1")).isEqualTo(1);
      LocalStore store = store();
      assertThat(store.items().findCollectionKeys("P1")).containsExactlyInAnyOrder(ROOT, SUB2);
      assertThat(store.items().findByCollection(SUB2))
          .extracting(LibraryItem::key)
          .containsExactly("P1");
    }

    @Test
    @DisplayName("Should only sync the root when subcollections are excluded")
    void shouldSkipSubcollections() {
      properties.getSync().setIncludeSubcollections(false);

      syncService.sync(ROOT, SyncMode.FULL);

      assertThat(store().collections().findAllKeys()).containsExactly(ROOT);
      assertThat(store().items().findAllKeys()).containsExactly("P1");
    }
  }

  @Nested
  @DisplayName("Incremental sync")
  class IncrementalSync {

    @Test
    @DisplayName("Should run a full sync when the collection was never synced")
    void shouldUpgradeFirstRunToFull() {
      SyncStats stats = syncService.sync(ROOT, SyncMode.INCREMENTAL);

      assertThat(stats.getMode()).isEqualTo(SyncMode.FULL);
      assertThat(stats.getAttachmentsDownloaded()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should skip unchanged attachments that are present on disk")
    void shouldSkipUnchangedAttachments() {
      syncService.sync(ROOT, SyncMode.FULL);

      SyncStats stats = syncService.sync(ROOT, SyncMode.INCREMENTAL);

      assertThat(stats.getMode()).isEqualTo(SyncMode.INCREMENTAL);
      assertThat(stats.getAttachmentsSkipped()).isEqualTo(2);
      assertThat(stats.getAttachmentsDownloaded()).isZero();
      assertThat(stats.getContentExtracted()).isZero();
      assertThat(remote.downloadsOf("ATT1")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should download again when the blob went missing")
    void shouldRedownloadMissingBlob() throws Exception {
      syncService.sync(ROOT, SyncMode.FULL);
      Attachment att1 = store().attachments().findByKey("ATT1").orElseThrow();
      Files.delete(Path.of(att1.localPath()));

      SyncStats stats = syncService.sync(ROOT, SyncMode.INCREMENTAL);

      assertThat(stats.getAttachmentsDownloaded()).isEqualTo(1);
      assertThat(remote.downloadsOf("ATT1")).isEqualTo(2);
      assertThat(Path.of(att1.localPath())).isRegularFile();
    }

    @Test
    @DisplayName("Should download and extract again when the attachment changed")
    void shouldRefreshChangedAttachment() {
      syncService.sync(ROOT, SyncMode.FULL);
      remote.removeChild("P1", "ATT1");
      remote.attachment("P1", "ATT1", "paper.txt", "text/plain", "Revised full text.", 40);

      SyncStats stats = syncService.sync(ROOT, SyncMode.INCREMENTAL);

      assertThat(stats.getAttachmentsDownloaded()).isEqualTo(1);
      assertThat(stats.getContentExtracted()).isEqualTo(1);
      assertThat(store().extractedContent().find("P1"))
          .get()
          .extracting(ExtractedContent::text)
          .isEqualTo("Revised full text.");
      assertThat(store().syncState().lastSyncVersion()).isEqualTo(40L);
    }
  }

  @Nested
  @DisplayName("Orphans")
  class Orphans {

    @Test
    @DisplayName("Should remove items, notes and collections that disappeared remotely")
    void shouldRemoveOrphans() {
      syncService.sync(ROOT, SyncMode.FULL);
      String blob = store().attachments().findByKey("ATT1").orElseThrow().localPath();
      remote.removeItem(ROOT, "P1");
      remote.removeItem(ROOT, "SN1");
      remote.removeCollection(SUB2);

      SyncStats stats = syncService.sync(ROOT, SyncMode.FULL);

      assertThat(stats.getOrphansRemoved()).isEqualTo(3);
      LocalStore store = store();
      assertThat(store.items().findAllKeys()).containsExactly("P2");
      assertThat(store.attachments().findByKey("ATT1")).isEmpty();
      assertThat(store.notes().findByKey("N1")).isEmpty();
      assertThat(store.notes().findByKey("SN1")).isEmpty();
      assertThat(store.collections().findAllKeys()).containsExactlyInAnyOrder(ROOT, SUB1);
      assertThat(Path.of(blob)).doesNotExist();

      syncService.sync(ROOT, SyncMode.INCREMENTAL);
      assertThat(store.items().findByKey("P1")).isEmpty();
    }

    @Test
    @DisplayName("Should follow an item that moved between collections")
    void shouldFollowMovedItem() {
      syncService.sync(ROOT, SyncMode.FULL);
      remote.removeItem(SUB1, "P2");
      remote.item(ROOT, "P2", "Response rates", 32);

      syncService.sync(ROOT, SyncMode.INCREMENTAL);

      assertThat(store().items().findCollectionKeys("P2")).containsExactly(ROOT);
      assertThat(store().items().findByCollection(SUB1)).isEmpty();
    }

    @Test
    @DisplayName("Should remove child notes that disappeared remotely")
    void shouldRemoveChildNotes() {
      syncService.sync(ROOT, SyncMode.FULL);
      remote.removeChild("P1", "N1");

      SyncStats stats = syncService.sync(ROOT, SyncMode.INCREMENTAL);

      assertThat(stats.getOrphansRemoved()).isEqualTo(1);
      assertThat(store().notesOf("P1")).isEmpty();
    }
  }

  @Nested
  @DisplayName("Failures")
  class Failures {

    @Test
    @DisplayName("Should isolate a failing item and continue with the rest")
    void shouldIsolateItemFailure() {
      remote.failingChildren.add("P1");

      SyncStats stats = syncService.sync(ROOT, SyncMode.FULL);

      assertThat(stats.isAborted()).isFalse();
      assertThat(stats.getErrors()).isEqualTo(1);
      assertThat(stats.getItemsSynced()).isEqualTo(1);
      assertThat(store().items().findByKey("P1")).isEmpty();
      assertThat(store().items().findByKey("P2")).isPresent();
      assertThat(store().notes().findByKey("SN1")).isPresent();
      assertThat(meterRegistry.counter("sync.item.failure").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should abort without orphan removal or state update when the remote is lost")
    void shouldAbortOnConnectionLoss() {
      syncService.sync(ROOT, SyncMode.FULL);
      SyncState before = store().syncState();
      remote.removeItem(ROOT, "P1");
      remote.unreachableCollections.add(SUB1);

      SyncStats stats = syncService.sync(ROOT, SyncMode.INCREMENTAL);

      assertThat(stats.isAborted()).isTrue();
      assertThat(store().items().findByKey("P1")).isPresent();
      assertThat(store().syncState()).isEqualTo(before);
      assertThat(meterRegistry.counter("sync.aborted").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should keep committed collections of an aborted first sync unsynced")
    void shouldKeepFirstAbortedSyncUnsynced() {
      remote.unreachableCollections.add(SUB1);

      SyncStats stats = syncService.sync(ROOT, SyncMode.FULL);

      assertThat(stats.isAborted()).isTrue();
      assertThat(stats.getItemsSynced()).isEqualTo(1);
      assertThat(store().items().findByKey("P1")).isPresent();
      assertThat(store().syncState().hasSynced()).isFalse();
    }
  }

  @Nested
  @DisplayName("Cache lifecycle")
  class CacheLifecycle {

    @Test
    @DisplayName("Should initialize an empty cache once")
    void shouldInitialize() {
      CacheInfo info = syncService.initialize(ROOT);

      assertThat(info.collections()).isEqualTo(1);
      assertThat(info.items()).isZero();
      assertThat(info.lastSyncTime()).isNull();
      assertThat(syncService.initialize(ROOT)).isEqualTo(info);
      assertThat(syncService.status(ROOT)).isEqualTo(info);
    }

    @Test
    @DisplayName("Should refuse status of a collection without cache")
    void shouldRefuseStatusWithoutCache() {
      assertThatThrownBy(() -> syncService.status("NOCACHE1"))
          .isInstanceOf(CacheNotInitializedException.class);
    }

    @Test
    @DisplayName("Should clear every cached record")
    void shouldClear() {
      syncService.sync(ROOT, SyncMode.FULL);

      syncService.clear(ROOT);

      CacheInfo info = syncService.status(ROOT);
      assertThat(info.items()).isZero();
      assertThat(info.attachments()).isZero();
      assertThat(info.blobBytes()).isZero();
    }
  }
}
