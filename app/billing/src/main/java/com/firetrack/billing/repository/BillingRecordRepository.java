/*
 * どこで: Billing データアクセス
 * 何を: billing_records の登録/CAS 更新/参照を行う
 * なぜ: 状態と上限を version 付きの 1 行単位で書き換え、並行 webhook 間の部分上書きを防ぐため
 */
package com.firetrack.billing.repository;

import static com.firetrack.common.JdbcTimestampUtils.getInstant;
import static com.firetrack.common.JdbcTimestampUtils.toTimestamp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.firetrack.billing.model.BillingState;
import com.firetrack.billing.model.LimitBundle;
import com.firetrack.billing.model.SubscriptionStatus;
import com.firetrack.billing.model.SubscriptionTier;
import com.firetrack.billing.model.UserBillingRecord;
import com.firetrack.billing.service.LimitProjector;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class BillingRecordRepository {

  private static final String COLUMNS =
      """
      user_id, external_customer_id, external_subscription_id, tier, status,
      current_period_start, current_period_end, trial_started_at, trial_ends_at,
      limits, last_event_at, version, created_at, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final LimitProjector limitProjector;
  private final ObjectMapper objectMapper;

  public Optional<UserBillingRecord> findByUserId(String userId) {
    final String sql = "SELECT " + COLUMNS + " FROM billing_records WHERE user_id = :userId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<UserBillingRecord> findByExternalCustomerId(String externalCustomerId) {
    final String sql =
        "SELECT " + COLUMNS + " FROM billing_records WHERE external_customer_id = :customerId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("customerId", externalCustomerId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * Inserts a row for the user unless one already exists.
   *
   * @return true when this call created the row
   */
  public boolean insertIfAbsent(String userId, BillingState state, Instant now) {
    // 上限は tier から算出した値だけを書き込む
    final String sql =
        """
        INSERT INTO billing_records (
          user_id, external_customer_id, external_subscription_id, tier, status,
          current_period_start, current_period_end, trial_started_at, trial_ends_at,
          limits, last_event_at, version, created_at, updated_at
        ) VALUES (
          :userId, :customerId, :subscriptionId, :tier, :status,
          :periodStart, :periodEnd, :trialStartedAt, :trialEndsAt,
          CAST(:limits AS jsonb), :lastEventAt, 0, :now, :now
        )
        ON CONFLICT (user_id) DO NOTHING
        """;
    final MapSqlParameterSource params = stateParams(userId, state).addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params) > 0;
  }

  /**
   * Replaces the whole mutable state when the stored version still matches.
   *
   * @return the stored record, or empty when another writer won the race
   */
  public Optional<UserBillingRecord> compareAndSet(
      String userId, BillingState next, long expectedVersion, Instant updatedAt) {
    final String sql =
        """
        UPDATE billing_records SET
          external_customer_id = :customerId,
          external_subscription_id = :subscriptionId,
          tier = :tier,
          status = :status,
          current_period_start = :periodStart,
          current_period_end = :periodEnd,
          trial_started_at = :trialStartedAt,
          trial_ends_at = :trialEndsAt,
          limits = CAST(:limits AS jsonb),
          last_event_at = :lastEventAt,
          version = version + 1,
          updated_at = :updatedAt
        WHERE user_id = :userId AND version = :expectedVersion
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        stateParams(userId, next)
            .addValue("expectedVersion", expectedVersion)
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * Links a provider customer to the user only when none is linked yet.
   *
   * @return the customer id stored after the call, empty when the user has no row
   */
  public Optional<String> linkCustomerIfAbsent(String userId, String externalCustomerId, Instant now) {
    final String sql =
        """
        UPDATE billing_records SET
          external_customer_id = :customerId,
          version = version + 1,
          updated_at = GREATEST(updated_at, :now)
        WHERE user_id = :userId AND external_customer_id IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("customerId", externalCustomerId)
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
    return findByUserId(userId).map(UserBillingRecord::externalCustomerId);
  }

  /** Trials without a paid subscription whose window closed at or before {@code now}. */
  public List<String> findExpiredTrialUserIds(Instant now, int limit) {
    final String sql =
        """
        SELECT user_id
        FROM billing_records
        WHERE status = 'TRIALING'
          AND external_subscription_id IS NULL
          AND trial_ends_at <= :now
        ORDER BY trial_ends_at
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("limit", limit);
    return jdbcTemplate.queryForList(sql, params, String.class);
  }

  private MapSqlParameterSource stateParams(String userId, BillingState state) {
    return new MapSqlParameterSource()
        .addValue("userId", userId)
        .addValue("customerId", state.externalCustomerId())
        .addValue("subscriptionId", state.externalSubscriptionId())
        .addValue("tier", state.tier().name())
        .addValue("status", state.status().name())
        .addValue("periodStart", toTimestamp(state.currentPeriodStart()))
        .addValue("periodEnd", toTimestamp(state.currentPeriodEnd()))
        .addValue("trialStartedAt", toTimestamp(state.trialStartedAt()))
        .addValue("trialEndsAt", toTimestamp(state.trialEndsAt()))
        .addValue("limits", writeLimits(limitProjector.project(state.tier())))
        .addValue("lastEventAt", toTimestamp(state.lastEventAt()));
  }

  private String writeLimits(LimitBundle limits) {
    try {
      return objectMapper.writeValueAsString(limits);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize limits", ex);
    }
  }

  private LimitBundle readLimits(String json) {
    try {
      return objectMapper.readValue(json, LimitBundle.class);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to parse stored limits", ex);
    }
  }

  private UserBillingRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final BillingState state =
        new BillingState(
            rs.getString("external_customer_id"),
            rs.getString("external_subscription_id"),
            SubscriptionTier.valueOf(rs.getString("tier")),
            SubscriptionStatus.valueOf(rs.getString("status")),
            getInstant(rs, "current_period_start"),
            getInstant(rs, "current_period_end"),
            getInstant(rs, "trial_started_at"),
            getInstant(rs, "trial_ends_at"),
            getInstant(rs, "last_event_at"));
    return new UserBillingRecord(
        rs.getString("user_id"),
        state,
        readLimits(rs.getString("limits")),
        rs.getLong("version"),
        getInstant(rs, "created_at"),
        getInstant(rs, "updated_at"));
  }
}
