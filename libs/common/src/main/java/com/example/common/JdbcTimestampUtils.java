/*
 * どこで: 共通ユーティリティ
 * 何を: JDBC で扱う Instant/LocalTime と SQL 型を相互に明示変換する
 * なぜ: PostgreSQL JDBC が java.time の型推論に失敗するケースを回避するため
 */
package com.example.common;

import java.sql.Time;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalTime;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // 前提: Instant は UTC を表現するため Timestamp.from で UTC のまま渡す
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  // 時刻のみの列 (送信時刻/静音時間) は TIME 型で保持する
  public static Time toSqlTime(LocalTime localTime) {
    return localTime == null ? null : Time.valueOf(localTime);
  }

  public static LocalTime toLocalTime(Time time) {
    return time == null ? null : time.toLocalTime();
  }
}
