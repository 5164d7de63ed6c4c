package com.flamingo.ai.researchcache.store;

import static com.flamingo.ai.researchcache.store.StoreColumns.instant;
import static com.flamingo.ai.researchcache.store.StoreColumns.nullableInt;
import static com.flamingo.ai.researchcache.store.StoreColumns.toText;

import com.flamingo.ai.researchcache.domain.model.IndexState;
import com.flamingo.ai.researchcache.domain.model.SearchFilters;
import com.flamingo.ai.researchcache.domain.model.StoredChunk;
import java.sql.Types;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/** Access to the {@code chunks} and {@code index_state} tables. */
public class ChunkRepository {

  private static final RowMapper<StoredChunk> CHUNK_MAPPER =
      (rs, rowNum) ->
          new StoredChunk(
              rs.getLong("id"),
              rs.getString("item_key"),
              rs.getInt("chunk_index"),
              rs.getString("chunk_text"),
              rs.getBytes("embedding"),
              nullableInt(rs, "page_number"),
              rs.getString("section_id"),
              rs.getInt("char_start"),
              rs.getInt("char_end"),
              rs.getString("item_type"),
              rs.getString("doc_type"),
              rs.getString("content_hash"));

  private static final RowMapper<IndexState> INDEX_STATE_MAPPER =
      (rs, rowNum) ->
          new IndexState(
              rs.getString("item_key"),
              rs.getInt("chunk_count"),
              rs.getString("content_hash"),
              rs.getString("embedding_model"),
              instant(rs, "indexed_at"));

  private final JdbcTemplate jdbcTemplate;
  private final NamedParameterJdbcTemplate namedJdbcTemplate;

  ChunkRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
    this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
  }

  public int deleteByItem(String itemKey) {
    return jdbcTemplate.update("DELETE FROM chunks WHERE item_key = ?", itemKey);
  }

  public void insertAll(List<StoredChunk> chunks) {
    jdbcTemplate.batchUpdate(
        """
        INSERT INTO chunks (item_key, chunk_index, chunk_text, embedding, page_number, section_id,
                            char_start, char_end, item_type, doc_type, content_hash)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """,
        chunks,
        200,
        (ps, chunk) -> {
          ps.setString(1, chunk.itemKey());
          ps.setInt(2, chunk.chunkIndex());
          ps.setString(3, chunk.text());
          ps.setBytes(4, chunk.embedding());
          if (chunk.pageNumber() == null) {
            ps.setNull(5, Types.INTEGER);
          } else {
            ps.setInt(5, chunk.pageNumber());
          }
          ps.setString(6, chunk.sectionId());
          ps.setInt(7, chunk.charStart());
          ps.setInt(8, chunk.charEnd());
          ps.setString(9, chunk.itemType());
          ps.setString(10, chunk.docType());
          ps.setString(11, chunk.contentHash());
        });
  }

  public List<StoredChunk> findByItem(String itemKey) {
    return jdbcTemplate.query(
        "SELECT * FROM chunks WHERE item_key = ? ORDER BY chunk_index", CHUNK_MAPPER, itemKey);
  }

  /**
   * Streams every chunk that passes the filters to {@code consumer}, one row at a time, so callers
   * can score candidates without holding the whole table in memory.
   */
  public void forEachCandidate(SearchFilters filters, Consumer<StoredChunk> consumer) {
    StringBuilder sql = new StringBuilder("SELECT * FROM chunks WHERE 1 = 1");
    Map<String, Object> params = new HashMap<>();
    if (!filters.itemTypes().isEmpty()) {
      sql.append(" AND item_type IN (:itemTypes)");
      params.put("itemTypes", new ArrayList<>(filters.itemTypes()));
    }
    if (!filters.docTypes().isEmpty()) {
      sql.append(" AND doc_type IN (:docTypes)");
      params.put("docTypes", new ArrayList<>(filters.docTypes()));
    }
    if (!filters.itemKeys().isEmpty()) {
      sql.append(" AND item_key IN (:itemKeys)");
      params.put("itemKeys", new ArrayList<>(filters.itemKeys()));
    }
    int[] rowNum = {0};
    RowCallbackHandler handler = rs -> consumer.accept(CHUNK_MAPPER.mapRow(rs, rowNum[0]++));
    namedJdbcTemplate.query(sql.toString(), params, handler);
  }

  public void upsertIndexState(IndexState state) {
    jdbcTemplate.update(
        """
        INSERT INTO index_state (item_key, chunk_count, content_hash, embedding_model, indexed_at)
        VALUES (?, ?, ?, ?, ?)
        ON CONFLICT (item_key) DO UPDATE SET
          chunk_count = excluded.chunk_count,
          content_hash = excluded.content_hash,
          embedding_model = excluded.embedding_model,
          indexed_at = excluded.indexed_at
        """,
        state.itemKey(),
        state.chunkCount(),
        state.contentHash(),
        state.embeddingModel(),
        toText(state.indexedAt()));
  }

  public int deleteIndexState(String itemKey) {
    return jdbcTemplate.update("DELETE FROM index_state WHERE item_key = ?", itemKey);
  }

  public Optional<IndexState> findIndexState(String itemKey) {
    return jdbcTemplate
        .query("SELECT * FROM index_state WHERE item_key = ?", INDEX_STATE_MAPPER, itemKey)
        .stream()
        .findFirst();
  }

  public List<IndexState> findAllIndexStates() {
    return jdbcTemplate.query("SELECT * FROM index_state ORDER BY item_key", INDEX_STATE_MAPPER);
  }

  public List<String> findEmbeddingModels() {
    return jdbcTemplate.queryForList(
        "SELECT DISTINCT embedding_model FROM index_state ORDER BY embedding_model", String.class);
  }

  public long countChunks() {
    return jdbcTemplate.queryForObject("SELECT COUNT(*) FROM chunks", Long.class);
  }

  public long countIndexedItems() {
    return jdbcTemplate.queryForObject("SELECT COUNT(*) FROM index_state", Long.class);
  }

  public void deleteAll() {
    jdbcTemplate.update("DELETE FROM chunks");
    jdbcTemplate.update("DELETE FROM index_state");
  }
}
