package com.flamingo.ai.researchcache.service.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.researchcache.domain.model.ChunkBatch;
import com.flamingo.ai.researchcache.domain.model.SearchFilters;
import com.flamingo.ai.researchcache.exception.DimensionMismatchException;
import com.flamingo.ai.researchcache.store.LocalStore;
import com.flamingo.ai.researchcache.store.StoreFixtures;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("BruteForceVectorSearch Tests")
class BruteForceVectorSearchTest {

  private static final String MODEL = "all-MiniLM-L6-v2";
  private static final float[] QUERY = {1f, 0f};

  @TempDir Path tempDir;

  private LocalStore store;
  private final BruteForceVectorSearch search = new BruteForceVectorSearch();

  @BeforeEach
  void setUp() {
    store = LocalStore.open("ROOT0001", tempDir, new ObjectMapper());
    StoreFixtures.seedRootWithItems(store, "A", "B");
  }

  @AfterEach
  void tearDown() {
    store.close();
  }

  @Test
  @DisplayName("Should return the top k chunks by descending similarity")
  void shouldReturnTopK() {
    store.replaceChunks(StoreFixtures.chunkBatch("A", MODEL, unitAt(0.9), unitAt(0.5)));
    store.replaceChunks(StoreFixtures.chunkBatch("B", MODEL, unitAt(0.95)));

    List<ChunkSearchResult> results = search.search(store, QUERY, 2, SearchFilters.NONE);

    assertThat(results).hasSize(2);
    assertThat(results.get(0).similarity()).isCloseTo(0.95, within(1e-5));
    assertThat(results.get(0).itemKey()).isEqualTo("B");
    assertThat(results.get(1).similarity()).isCloseTo(0.9, within(1e-5));
    assertThat(results.get(1).chunkIndex()).isZero();
    assertThat(results.get(1).text()).isEqualTo("chunk 0 of A");
  }

  @Test
  @DisplayName("Should return every candidate when k exceeds the index size")
  void shouldReturnAllWhenKIsLarge() {
    store.replaceChunks(StoreFixtures.chunkBatch("A", MODEL, unitAt(0.2), unitAt(0.8)));

    List<ChunkSearchResult> results = search.search(store, QUERY, 50, SearchFilters.NONE);

    assertThat(results).extracting(ChunkSearchResult::chunkIndex).containsExactly(1, 0);
  }

  @Test
  @DisplayName("Should return nothing for a non-positive k or an empty index")
  void shouldReturnNothing() {
    assertThat(search.search(store, QUERY, 5, SearchFilters.NONE)).isEmpty();

    store.replaceChunks(StoreFixtures.chunkBatch("A", MODEL, unitAt(0.2)));
    assertThat(search.search(store, QUERY, 0, SearchFilters.NONE)).isEmpty();
  }

  @Test
  @DisplayName("Should only score chunks that pass the filters")
  void shouldApplyFilters() {
    store.replaceChunks(StoreFixtures.chunkBatch("A", MODEL, unitAt(0.99)));
    ChunkBatch b = StoreFixtures.chunkBatch("B", MODEL, unitAt(0.1));
    store.replaceChunks(
        new ChunkBatch("B", "report", "preprint", "h", MODEL, b.chunks(), b.embeddings()));

    List<ChunkSearchResult> results =
        search.search(store, QUERY, 5, new SearchFilters(Set.of("report"), null, null));

    assertThat(results).singleElement().satisfies(r -> {
      assertThat(r.itemKey()).isEqualTo("B");
      assertThat(r.itemType()).isEqualTo("report");
      assertThat(r.docType()).isEqualTo("preprint");
    });
  }

  @Test
  @DisplayName("Should fail when stored vectors differ in width from the query")
  void shouldFailOnDimensionMismatch() {
    store.replaceChunks(StoreFixtures.chunkBatch("A", MODEL, new float[] {1f, 0f, 0f}));

    assertThatThrownBy(() -> search.search(store, QUERY, 5, SearchFilters.NONE))
        .isInstanceOf(DimensionMismatchException.class)
        .hasMessageContaining("expected 2 but got 3");
  }

  /** A unit vector whose cosine similarity with {@link #QUERY} is {@code similarity}. */
  static float[] unitAt(double similarity) {
    return new float[] {(float) similarity, (float) Math.sqrt(1 - similarity * similarity)};
  }
}
