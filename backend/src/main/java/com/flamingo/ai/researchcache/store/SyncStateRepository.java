package com.flamingo.ai.researchcache.store;

import static com.flamingo.ai.researchcache.store.StoreColumns.instant;
import static com.flamingo.ai.researchcache.store.StoreColumns.toText;

import com.flamingo.ai.researchcache.domain.model.SyncState;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/** Access to the {@code sync_state} table. */
public class SyncStateRepository {

  private static final RowMapper<SyncState> ROW_MAPPER =
      (rs, rowNum) ->
          new SyncState(
              rs.getString("collection_key"),
              rs.getLong("last_sync_version"),
              instant(rs, "last_sync_time"),
              rs.getInt("full_sync_completed") != 0);

  private final JdbcTemplate jdbcTemplate;

  SyncStateRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  public Optional<SyncState> find(String collectionKey) {
    return jdbcTemplate
        .query("SELECT * FROM sync_state WHERE collection_key = ?", ROW_MAPPER, collectionKey)
        .stream()
        .findFirst();
  }

  /** Creates an empty state row unless one exists. The collection row must exist. */
  public void ensure(String collectionKey) {
    jdbcTemplate.update(
        "INSERT OR IGNORE INTO sync_state (collection_key) VALUES (?)", collectionKey);
  }

  public void save(SyncState state) {
    jdbcTemplate.update(
        """
        INSERT INTO sync_state (collection_key, last_sync_version, last_sync_time,
                                full_sync_completed)
        VALUES (?, ?, ?, ?)
        ON CONFLICT (collection_key) DO UPDATE SET
          last_sync_version = excluded.last_sync_version,
          last_sync_time = excluded.last_sync_time,
          full_sync_completed = excluded.full_sync_completed
        """,
        state.collectionKey(),
        state.lastSyncVersion(),
        toText(state.lastSyncTime()),
        state.fullSyncCompleted() ? 1 : 0);
  }
}
