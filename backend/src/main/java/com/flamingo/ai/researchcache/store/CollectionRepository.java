package com.flamingo.ai.researchcache.store;

import static com.flamingo.ai.researchcache.store.StoreColumns.instant;
import static com.flamingo.ai.researchcache.store.StoreColumns.toText;

import com.flamingo.ai.researchcache.domain.model.LibraryCollection;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/** Access to the {@code collections} table. */
public class CollectionRepository {

  private static final RowMapper<LibraryCollection> ROW_MAPPER =
      (rs, rowNum) ->
          new LibraryCollection(
              rs.getString("key"),
              rs.getString("name"),
              rs.getString("parent_key"),
              rs.getLong("version"),
              instant(rs, "last_synced"));

  private final JdbcTemplate jdbcTemplate;
  private final NamedParameterJdbcTemplate namedJdbcTemplate;

  CollectionRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
    this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
  }

  /** Inserts or overwrites a collection node, including its parent pointer. */
  public void upsert(LibraryCollection collection) {
    jdbcTemplate.update(
        """
        INSERT INTO collections (key, name, parent_key, version, last_synced)
        VALUES (?, ?, ?, ?, ?)
        ON CONFLICT (key) DO UPDATE SET
          name = excluded.name,
          parent_key = excluded.parent_key,
          version = excluded.version,
          last_synced = excluded.last_synced
        """,
        collection.key(),
        collection.name(),
        collection.parentKey(),
        collection.version(),
        toText(collection.lastSynced()));
  }

  public void updateParent(String key, String parentKey) {
    jdbcTemplate.update("UPDATE collections SET parent_key = ? WHERE key = ?", parentKey, key);
  }

  public Optional<LibraryCollection> findByKey(String key) {
    return jdbcTemplate.query("SELECT * FROM collections WHERE key = ?", ROW_MAPPER, key).stream()
        .findFirst();
  }

  public List<LibraryCollection> findAll() {
    return jdbcTemplate.query("SELECT * FROM collections ORDER BY name", ROW_MAPPER);
  }

  public List<LibraryCollection> findChildren(String parentKey) {
    return jdbcTemplate.query(
        "SELECT * FROM collections WHERE parent_key = ? ORDER BY name", ROW_MAPPER, parentKey);
  }

  public List<String> findAllKeys() {
    return jdbcTemplate.queryForList("SELECT key FROM collections", String.class);
  }

  /** Resolves child collections of {@code parentKey} by display name. */
  public List<LibraryCollection> findChildrenByNames(String parentKey, Collection<String> names) {
    if (names.isEmpty()) {
      return List.of();
    }
    return namedJdbcTemplate.query(
        "SELECT * FROM collections WHERE parent_key = :parent AND name IN (:names)",
        Map.of("parent", parentKey, "names", names),
        ROW_MAPPER);
  }

  public int deleteByKeys(Collection<String> keys) {
    if (keys.isEmpty()) {
      return 0;
    }
    return namedJdbcTemplate.update(
        "DELETE FROM collections WHERE key IN (:keys)", Map.of("keys", keys));
  }

  public long count() {
    return jdbcTemplate.queryForObject("SELECT COUNT(*) FROM collections", Long.class);
  }
}
