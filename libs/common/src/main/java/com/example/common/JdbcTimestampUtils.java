/*
 * Where: shared JDBC helpers
 * What: Converts Instant/LocalDate to and from JDBC temporal types explicitly
 * Why: Keep every repository binding timestamps and dates the same way, independent of driver type inference
 */
package com.example.common;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant is UTC; Timestamp.from keeps it as-is regardless of the database time zone
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  // DATE columns carry no zone, so the calendar date is bound as-is
  public static Date toSqlDate(LocalDate date) {
    return date == null ? null : Date.valueOf(date);
  }

  public static LocalDate toLocalDate(Date date) {
    return date == null ? null : date.toLocalDate();
  }
}
