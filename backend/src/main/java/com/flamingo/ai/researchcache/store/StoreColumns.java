package com.flamingo.ai.researchcache.store;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

/** Column conversions shared by the repositories. Timestamps are stored as ISO-8601 text. */
final class StoreColumns {

  private StoreColumns() {}

  static String toText(Instant instant) {
    return instant == null ? null : instant.toString();
  }

  static Instant instant(ResultSet rs, String column) throws SQLException {
    String value = rs.getString(column);
    return value == null ? null : Instant.parse(value);
  }

  static Integer nullableInt(ResultSet rs, String column) throws SQLException {
    int value = rs.getInt(column);
    return rs.wasNull() ? null : value;
  }

  static Long nullableLong(ResultSet rs, String column) throws SQLException {
    long value = rs.getLong(column);
    return rs.wasNull() ? null : value;
  }
}
