/*
 * どこで: 共通 JDBC ユーティリティ
 * 何を: Instant と java.sql.Timestamp を相互変換する
 * なぜ: PostgreSQL ドライバは Instant のままのパラメータから SQL 型を推論できないため
 */
package com.example.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Timestamp.from はセッションのタイムゾーンに関係なく UTC のまま保持する
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
