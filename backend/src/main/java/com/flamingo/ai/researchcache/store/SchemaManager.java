package com.flamingo.ai.researchcache.store;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.ScriptUtils;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Creates and upgrades a store's schema. The {@code schema_version} table records every applied
 * migration; scripts live on the classpath as {@code db/migration/V<n>__<name>.sql}.
 */
@Slf4j
class SchemaManager {

  static final int CURRENT_VERSION = 1;

  private static final List<String> MIGRATIONS = List.of("db/migration/V1__init.sql");

  private final JdbcTemplate jdbcTemplate;
  private final TransactionTemplate transactionTemplate;

  SchemaManager(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
    this.jdbcTemplate = jdbcTemplate;
    this.transactionTemplate = transactionTemplate;
  }

  /**
   * Brings the schema up to {@link #CURRENT_VERSION}. Safe to call on every open.
   *
   * @throws IllegalStateException if the file was written by a newer schema version
   */
  void migrate() {
    transactionTemplate.executeWithoutResult(
        status -> {
          jdbcTemplate.execute(
              "CREATE TABLE IF NOT EXISTS schema_version ("
                  + "version INTEGER PRIMARY KEY, applied_at TEXT NOT NULL)");
          int installed = installedVersion();
          if (installed > CURRENT_VERSION) {
            throw new IllegalStateException(
                "Store schema version "
                    + installed
                    + " is newer than supported version "
                    + CURRENT_VERSION);
          }
          for (int version = installed + 1; version <= CURRENT_VERSION; version++) {
            apply(version);
          }
        });
  }

  int installedVersion() {
    Integer version =
        jdbcTemplate.queryForObject("SELECT MAX(version) FROM schema_version", Integer.class);
    return version == null ? 0 : version;
  }

  private void apply(int version) {
    String script = MIGRATIONS.get(version - 1);
    log.info("Applying schema migration {}", script);
    jdbcTemplate.execute(
        (ConnectionCallback<Void>)
            connection -> {
              ScriptUtils.executeSqlScript(
                  connection,
                  new EncodedResource(new ClassPathResource(script), StandardCharsets.UTF_8));
              return null;
            });
    jdbcTemplate.update(
        "INSERT INTO schema_version (version, applied_at) VALUES (?, ?)",
        version,
        Instant.now().toString());
  }
}
