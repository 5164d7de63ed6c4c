package com.flamingo.ai.researchcache.store;

import static com.flamingo.ai.researchcache.store.StoreColumns.instant;
import static com.flamingo.ai.researchcache.store.StoreColumns.toText;

import com.flamingo.ai.researchcache.domain.enums.ExtractionMethod;
import com.flamingo.ai.researchcache.domain.model.ExtractedContent;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/** Access to the {@code extracted_content} table. */
public class ExtractedContentRepository {

  private static final RowMapper<ExtractedContent> ROW_MAPPER =
      (rs, rowNum) ->
          new ExtractedContent(
              rs.getString("item_key"),
              ExtractionMethod.valueOf(rs.getString("extraction_method")),
              rs.getString("extracted_text"),
              rs.getString("source_hash"),
              instant(rs, "extraction_date"));

  private final JdbcTemplate jdbcTemplate;

  ExtractedContentRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  public Optional<ExtractedContent> find(String itemKey) {
    return jdbcTemplate
        .query("SELECT * FROM extracted_content WHERE item_key = ?", ROW_MAPPER, itemKey)
        .stream()
        .findFirst();
  }

  public void save(ExtractedContent content) {
    jdbcTemplate.update(
        """
        INSERT INTO extracted_content (item_key, extraction_method, extracted_text, source_hash,
                                       extraction_date)
        VALUES (?, ?, ?, ?, ?)
        ON CONFLICT (item_key) DO UPDATE SET
          extraction_method = excluded.extraction_method,
          extracted_text = excluded.extracted_text,
          source_hash = excluded.source_hash,
          extraction_date = excluded.extraction_date
        """,
        content.itemKey(),
        content.method().name(),
        content.text(),
        content.sourceHash(),
        toText(content.extractionDate()));
  }

  public long count() {
    return jdbcTemplate.queryForObject("SELECT COUNT(*) FROM extracted_content", Long.class);
  }
}
