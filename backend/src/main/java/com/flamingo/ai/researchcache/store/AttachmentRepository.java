package com.flamingo.ai.researchcache.store;

import static com.flamingo.ai.researchcache.store.StoreColumns.instant;
import static com.flamingo.ai.researchcache.store.StoreColumns.nullableLong;
import static com.flamingo.ai.researchcache.store.StoreColumns.toText;

import com.flamingo.ai.researchcache.domain.model.Attachment;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/** Access to the {@code attachments} table. */
public class AttachmentRepository {

  private static final RowMapper<Attachment> ROW_MAPPER =
      (rs, rowNum) ->
          Attachment.builder()
              .key(rs.getString("key"))
              .parentItemKey(rs.getString("parent_item_key"))
              .filename(rs.getString("filename"))
              .contentType(rs.getString("content_type"))
              .localPath(rs.getString("local_path"))
              .contentHash(rs.getString("content_hash"))
              .fileSize(nullableLong(rs, "file_size"))
              .downloadedAt(instant(rs, "downloaded_at"))
              .version(rs.getLong("version"))
              .lastSynced(instant(rs, "last_synced"))
              .build();

  private final JdbcTemplate jdbcTemplate;
  private final NamedParameterJdbcTemplate namedJdbcTemplate;

  AttachmentRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
    this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
  }

  /**
   * Upserts remote metadata. The download columns ({@code local_path}, {@code content_hash}, {@code
   * file_size}, {@code downloaded_at}) are only set on first insert and survive later refreshes.
   */
  public void upsertMetadata(Attachment attachment) {
    jdbcTemplate.update(
        """
        INSERT INTO attachments (key, parent_item_key, filename, content_type, local_path,
                                 content_hash, file_size, downloaded_at, version, last_synced)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (key) DO UPDATE SET
          parent_item_key = excluded.parent_item_key,
          filename = excluded.filename,
          content_type = excluded.content_type,
          version = excluded.version,
          last_synced = excluded.last_synced
        """,
        attachment.key(),
        attachment.parentItemKey(),
        attachment.filename(),
        attachment.contentType(),
        attachment.localPath(),
        attachment.contentHash(),
        attachment.fileSize(),
        toText(attachment.downloadedAt()),
        attachment.version(),
        toText(attachment.lastSynced()));
  }

  public void recordDownload(
      String key, String localPath, String contentHash, long fileSize, Instant downloadedAt) {
    jdbcTemplate.update(
        """
        UPDATE attachments
        SET local_path = ?, content_hash = ?, file_size = ?, downloaded_at = ?
        WHERE key = ?
        """,
        localPath,
        contentHash,
        fileSize,
        toText(downloadedAt),
        key);
  }

  public Optional<Attachment> findByKey(String key) {
    return jdbcTemplate.query("SELECT * FROM attachments WHERE key = ?", ROW_MAPPER, key).stream()
        .findFirst();
  }

  public List<Attachment> findByParent(String itemKey) {
    return jdbcTemplate.query(
        "SELECT * FROM attachments WHERE parent_item_key = ? ORDER BY key", ROW_MAPPER, itemKey);
  }

  public List<String> findKeysByParent(String itemKey) {
    return jdbcTemplate.queryForList(
        "SELECT key FROM attachments WHERE parent_item_key = ?", String.class, itemKey);
  }

  /** Local blob paths recorded for the attachments of the given items. */
  public List<String> findLocalPathsByParents(Collection<String> itemKeys) {
    if (itemKeys.isEmpty()) {
      return List.of();
    }
    return namedJdbcTemplate.queryForList(
        "SELECT local_path FROM attachments"
            + " WHERE parent_item_key IN (:items) AND local_path IS NOT NULL",
        Map.of("items", itemKeys),
        String.class);
  }

  public List<String> findLocalPathsByKeys(Collection<String> keys) {
    if (keys.isEmpty()) {
      return List.of();
    }
    return namedJdbcTemplate.queryForList(
        "SELECT local_path FROM attachments WHERE key IN (:keys) AND local_path IS NOT NULL",
        Map.of("keys", keys),
        String.class);
  }

  public List<String> findAllLocalPaths() {
    return jdbcTemplate.queryForList(
        "SELECT local_path FROM attachments WHERE local_path IS NOT NULL", String.class);
  }

  public int deleteByKeys(Collection<String> keys) {
    if (keys.isEmpty()) {
      return 0;
    }
    return namedJdbcTemplate.update(
        "DELETE FROM attachments WHERE key IN (:keys)", Map.of("keys", keys));
  }

  public long count() {
    return jdbcTemplate.queryForObject("SELECT COUNT(*) FROM attachments", Long.class);
  }

  public long countDownloaded() {
    return jdbcTemplate.queryForObject(
        "SELECT COUNT(*) FROM attachments WHERE local_path IS NOT NULL", Long.class);
  }
}
