/*
 * どこで: 共通ユーティリティ
 * 何を: JDBC の Timestamp と Instant を null 安全に相互変換する
 * なぜ: 請求期間やトライアル期限など nullable な時刻列を各リポジトリで同じ規則で扱うため
 */
package com.firetrack.common;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant は UTC なので Timestamp.from でそのまま渡す。PostgreSQL JDBC の型推論には頼らない。
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  public static Instant getInstant(ResultSet rs, String column) throws SQLException {
    return toInstant(rs.getTimestamp(column));
  }
}
