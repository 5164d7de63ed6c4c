package com.flamingo.ai.researchcache.store;

import static com.flamingo.ai.researchcache.store.StoreColumns.instant;
import static com.flamingo.ai.researchcache.store.StoreColumns.toText;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.researchcache.domain.model.LibraryItem;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/** Access to {@code items} and the {@code collection_items} membership table. */
public class ItemRepository {

  private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

  private final JdbcTemplate jdbcTemplate;
  private final NamedParameterJdbcTemplate namedJdbcTemplate;
  private final ObjectMapper objectMapper;
  private final RowMapper<LibraryItem> rowMapper;

  ItemRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
    this.jdbcTemplate = jdbcTemplate;
    this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
    this.objectMapper = objectMapper;
    this.rowMapper =
        (rs, rowNum) ->
            LibraryItem.builder()
                .key(rs.getString("key"))
                .itemType(rs.getString("item_type"))
                .title(rs.getString("title"))
                .date(rs.getString("date"))
                .url(rs.getString("url"))
                .metadata(readMetadata(rs.getString("metadata_json")))
                .version(rs.getLong("version"))
                .lastSynced(instant(rs, "last_synced"))
                .build();
  }

  public void upsert(LibraryItem item) {
    jdbcTemplate.update(
        """
        INSERT INTO items (key, item_type, title, date, url, metadata_json, version, last_synced)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (key) DO UPDATE SET
          item_type = excluded.item_type,
          title = excluded.title,
          date = excluded.date,
          url = excluded.url,
          metadata_json = excluded.metadata_json,
          version = excluded.version,
          last_synced = excluded.last_synced
        """,
        item.key(),
        item.itemType(),
        item.title(),
        item.date(),
        item.url(),
        writeMetadata(item.metadata()),
        item.version(),
        toText(item.lastSynced()));
  }

  public void addToCollection(String itemKey, String collectionKey) {
    jdbcTemplate.update(
        "INSERT OR IGNORE INTO collection_items (collection_key, item_key) VALUES (?, ?)",
        collectionKey,
        itemKey);
  }

  /** Drops membership rows of {@code collectionKey} for items not in {@code validItemKeys}. */
  public int removeStaleMemberships(String collectionKey, Collection<String> validItemKeys) {
    if (validItemKeys.isEmpty()) {
      return jdbcTemplate.update(
          "DELETE FROM collection_items WHERE collection_key = ?", collectionKey);
    }
    return namedJdbcTemplate.update(
        "DELETE FROM collection_items WHERE collection_key = :collection"
            + " AND item_key NOT IN (:keys)",
        Map.of("collection", collectionKey, "keys", validItemKeys));
  }

  public Optional<LibraryItem> findByKey(String key) {
    return jdbcTemplate.query("SELECT * FROM items WHERE key = ?", rowMapper, key).stream()
        .findFirst();
  }

  public List<LibraryItem> findByCollection(String collectionKey) {
    return jdbcTemplate.query(
        """
        SELECT i.* FROM items i
        JOIN collection_items ci ON ci.item_key = i.key
        WHERE ci.collection_key = ?
        ORDER BY i.title, i.key
        """,
        rowMapper,
        collectionKey);
  }

  public List<LibraryItem> findByCollections(Collection<String> collectionKeys) {
    if (collectionKeys.isEmpty()) {
      return List.of();
    }
    return namedJdbcTemplate.query(
        """
        SELECT DISTINCT i.* FROM items i
        JOIN collection_items ci ON ci.item_key = i.key
        WHERE ci.collection_key IN (:collections)
        ORDER BY i.title, i.key
        """,
        Map.of("collections", collectionKeys),
        rowMapper);
  }

  public List<LibraryItem> findAll() {
    return jdbcTemplate.query("SELECT * FROM items ORDER BY title, key", rowMapper);
  }

  public List<String> findAllKeys() {
    return jdbcTemplate.queryForList("SELECT key FROM items", String.class);
  }

  /** Keys of items that belong to at least one of {@code collectionKeys}. */
  public List<String> findKeysInCollections(Collection<String> collectionKeys) {
    if (collectionKeys.isEmpty()) {
      return List.of();
    }
    return namedJdbcTemplate.queryForList(
        "SELECT DISTINCT item_key FROM collection_items WHERE collection_key IN (:collections)",
        Map.of("collections", collectionKeys),
        String.class);
  }

  public List<String> findCollectionKeys(String itemKey) {
    return jdbcTemplate.queryForList(
        "SELECT collection_key FROM collection_items WHERE item_key = ?", String.class, itemKey);
  }

  public int deleteByKeys(Collection<String> keys) {
    if (keys.isEmpty()) {
      return 0;
    }
    return namedJdbcTemplate.update("DELETE FROM items WHERE key IN (:keys)", Map.of("keys", keys));
  }

  public long count() {
    return jdbcTemplate.queryForObject("SELECT COUNT(*) FROM items", Long.class);
  }

  private String writeMetadata(Map<String, Object> metadata) {
    try {
      return objectMapper.writeValueAsString(metadata);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Item metadata is not serializable to JSON", e);
    }
  }

  private Map<String, Object> readMetadata(String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(json, METADATA_TYPE);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Corrupt item metadata JSON in store", e);
    }
  }
}
