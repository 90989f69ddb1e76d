/*
 * どこで: 共通ユーティリティ
 * 何を: JDBC で扱う Instant/LocalDate を Timestamp/Date に明示変換する
 * なぜ: PostgreSQL JDBC が java.time 型の推論に失敗するケースを回避するため
 */
package com.machinerental.common;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // 前提: Instant は UTC を表現するため Timestamp.from で UTC のまま渡す
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  // 期限日や通知日はタイムゾーンを持たない暦日として DATE 列へ渡す
  public static Date toSqlDate(LocalDate date) {
    return date == null ? null : Date.valueOf(date);
  }

  public static LocalDate toLocalDate(Date date) {
    return date == null ? null : date.toLocalDate();
  }
}
