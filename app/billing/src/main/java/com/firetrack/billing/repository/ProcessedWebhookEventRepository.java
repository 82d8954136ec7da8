/*
 * どこで: Billing データアクセス
 * 何を: processed_webhook_events の登録/存在確認/掃除を行う
 * なぜ: 同一 webhook の再送を検出して処理を 1 回に抑えるため
 */
package com.firetrack.billing.repository;

import static com.firetrack.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ProcessedWebhookEventRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public boolean exists(String eventId) {
    final String sql =
        "SELECT EXISTS (SELECT 1 FROM processed_webhook_events WHERE event_id = :eventId)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("eventId", eventId);
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  public boolean insertIfAbsent(String eventId, String eventType, Instant processedAt) {
    final String sql =
        """
        INSERT INTO processed_webhook_events (event_id, event_type, processed_at)
        VALUES (:eventId, :eventType, :processedAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("eventType", eventType)
            .addValue("processedAt", toTimestamp(processedAt));
    try {
      return jdbcTemplate.update(sql, params) > 0;
    } catch (DuplicateKeyException ex) {
      return false;
    }
  }

  public int deleteOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM processed_webhook_events
        WHERE processed_at < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }
}
