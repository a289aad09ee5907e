/*
 * Where: Common utilities
 * What: Converts between Instant and java.sql.Timestamp for JDBC binding
 * Why: The PostgreSQL driver cannot infer a type for Instant parameters
 */
package com.parcelsms.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instants are UTC; Timestamp.from keeps the absolute value regardless of the DB session zone.
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
