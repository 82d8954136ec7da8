/*
 * どこで: Billing データアクセス
 * 何を: billing_audit の登録/参照を行う
 * なぜ: 課金状態がいつ何を根拠に変わったかを後から追跡できるようにするため
 */
package com.firetrack.billing.repository;

import static com.firetrack.common.JdbcTimestampUtils.getInstant;
import static com.firetrack.common.JdbcTimestampUtils.toTimestamp;

import com.firetrack.billing.model.BillingAuditRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class BillingAuditRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int insert(BillingAuditRecord record) {
    final String sql =
        """
        INSERT INTO billing_audit (
          user_id,
          action,
          source,
          source_id,
          from_status,
          to_status,
          from_tier,
          to_tier,
          external_subscription_id,
          version,
          created_at
        ) VALUES (
          :userId,
          :action,
          :source,
          :sourceId,
          :fromStatus,
          :toStatus,
          :fromTier,
          :toTier,
          :subscriptionId,
          :version,
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", record.userId())
            .addValue("action", record.action())
            .addValue("source", record.source())
            .addValue("sourceId", record.sourceId())
            .addValue("fromStatus", record.fromStatus())
            .addValue("toStatus", record.toStatus())
            .addValue("fromTier", record.fromTier())
            .addValue("toTier", record.toTier())
            .addValue("subscriptionId", record.externalSubscriptionId())
            .addValue("version", record.version())
            .addValue("createdAt", toTimestamp(record.createdAt()));
    return jdbcTemplate.update(sql, params);
  }

  public List<BillingAuditRecord> findByUserId(String userId) {
    final String sql =
        """
        SELECT user_id, action, source, source_id, from_status, to_status, from_tier, to_tier,
               external_subscription_id, version, created_at
        FROM billing_audit
        WHERE user_id = :userId
        ORDER BY id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private BillingAuditRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new BillingAuditRecord(
        rs.getString("user_id"),
        rs.getString("action"),
        rs.getString("source"),
        rs.getString("source_id"),
        rs.getString("from_status"),
        rs.getString("to_status"),
        rs.getString("from_tier"),
        rs.getString("to_tier"),
        rs.getString("external_subscription_id"),
        rs.getLong("version"),
        getInstant(rs, "created_at"));
  }
}
