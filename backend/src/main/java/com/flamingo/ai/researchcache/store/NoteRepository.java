package com.flamingo.ai.researchcache.store;

import static com.flamingo.ai.researchcache.store.StoreColumns.instant;
import static com.flamingo.ai.researchcache.store.StoreColumns.toText;

import com.flamingo.ai.researchcache.domain.model.Note;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/** Access to the {@code notes} table, covering child notes and standalone collection notes. */
public class NoteRepository {

  private static final RowMapper<Note> ROW_MAPPER =
      (rs, rowNum) ->
          new Note(
              rs.getString("key"),
              rs.getString("parent_item_key"),
              rs.getString("collection_key"),
              rs.getString("title"),
              rs.getString("content"),
              rs.getLong("version"),
              instant(rs, "last_synced"));

  private final JdbcTemplate jdbcTemplate;
  private final NamedParameterJdbcTemplate namedJdbcTemplate;

  NoteRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
    this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
  }

  public void upsert(Note note) {
    jdbcTemplate.update(
        """
        INSERT INTO notes (key, parent_item_key, collection_key, title, content, version,
                           last_synced)
        VALUES (?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (key) DO UPDATE SET
          parent_item_key = excluded.parent_item_key,
          collection_key = excluded.collection_key,
          title = excluded.title,
          content = excluded.content,
          version = excluded.version,
          last_synced = excluded.last_synced
        """,
        note.key(),
        note.parentItemKey(),
        note.collectionKey(),
        note.title(),
        note.content(),
        note.version(),
        toText(note.lastSynced()));
  }

  public Optional<Note> findByKey(String key) {
    return jdbcTemplate.query("SELECT * FROM notes WHERE key = ?", ROW_MAPPER, key).stream()
        .findFirst();
  }

  public List<Note> findByParent(String itemKey) {
    return jdbcTemplate.query(
        "SELECT * FROM notes WHERE parent_item_key = ? ORDER BY key", ROW_MAPPER, itemKey);
  }

  public List<Note> findStandalone(String collectionKey) {
    return jdbcTemplate.query(
        "SELECT * FROM notes WHERE parent_item_key IS NULL AND collection_key = ? ORDER BY key",
        ROW_MAPPER,
        collectionKey);
  }

  /** Standalone note of a collection whose title contains {@code titleFragment}, if any. */
  public Optional<Note> findStandaloneByTitle(String collectionKey, String titleFragment) {
    return jdbcTemplate
        .query(
            "SELECT * FROM notes WHERE parent_item_key IS NULL AND collection_key = ?"
                + " AND title LIKE ? ORDER BY version DESC",
            ROW_MAPPER,
            collectionKey,
            "%" + titleFragment + "%")
        .stream()
        .findFirst();
  }

  public List<String> findKeysByParent(String itemKey) {
    return jdbcTemplate.queryForList(
        "SELECT key FROM notes WHERE parent_item_key = ?", String.class, itemKey);
  }

  public List<String> findStandaloneKeys(String collectionKey) {
    return jdbcTemplate.queryForList(
        "SELECT key FROM notes WHERE parent_item_key IS NULL AND collection_key = ?",
        String.class,
        collectionKey);
  }

  public int deleteByKeys(Collection<String> keys) {
    if (keys.isEmpty()) {
      return 0;
    }
    return namedJdbcTemplate.update("DELETE FROM notes WHERE key IN (:keys)", Map.of("keys", keys));
  }

  public long count() {
    return jdbcTemplate.queryForObject("SELECT COUNT(*) FROM notes", Long.class);
  }
}
