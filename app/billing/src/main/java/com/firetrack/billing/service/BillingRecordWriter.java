/*
 * どこで: Billing サービス層
 * 何を: 読み取り→遷移計算→version 付き CAS 更新→監査記録を再試行つきで行う
 * なぜ: 同一ユーザーへの並行 webhook でも更新を失わず、各書き込みを直列化可能にするため
 */
package com.firetrack.billing.service;

import com.firetrack.billing.api.BillingRecordConflictException;
import com.firetrack.billing.config.BillingReconcileProperties;
import com.firetrack.billing.model.BillingAuditRecord;
import com.firetrack.billing.model.BillingState;
import com.firetrack.billing.model.ReconcileResult;
import com.firetrack.billing.model.UserBillingRecord;
import com.firetrack.billing.repository.BillingAuditRepository;
import com.firetrack.billing.repository.BillingRecordRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

@Component
@RequiredArgsConstructor
public class BillingRecordWriter {

  private static final Logger logger = LoggerFactory.getLogger(BillingRecordWriter.class);

  private final BillingRecordRepository billingRecordRepository;
  private final BillingAuditRepository auditRepository;
  private final BillingReconcileProperties reconcileProperties;
  private final BillingMetrics metrics;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  /**
   * Applies {@code transition} to the user's record, creating an initial record when the user has
   * none. Provider calls must happen before this method; the transition itself only computes.
   */
  public ReconcileResult apply(String userId, BillingChange change, BillingTransition transition) {
    final int maxAttempts = reconcileProperties.maxAttempts();
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      final Optional<ReconcileResult> result =
          transactionTemplate.execute(status -> attemptOnce(userId, change, transition));
      if (result != null && result.isPresent()) {
        return result.get();
      }
      metrics.recordReconcileConflict();
      logger.info(
          "billing record version conflict userId={} source={} attempt={}/{}",
          userId,
          change.source(),
          attempt,
          maxAttempts);
    }
    throw new BillingRecordConflictException(
        "billing record for " + userId + " kept changing; retry later");
  }

  // 競合時のみ空を返す。
  private Optional<ReconcileResult> attemptOnce(
      String userId, BillingChange change, BillingTransition transition) {
    final Instant now = Instant.now(clock);
    final UserBillingRecord current = loadOrCreate(userId, now);
    final BillingState state = current.state();

    if (isStale(change, state)) {
      logger.info(
          "stale billing event dropped userId={} source={} sourceId={} occurredAt={} lastEventAt={}",
          userId,
          change.source(),
          change.sourceId(),
          change.occurredAt(),
          state.lastEventAt());
      return Optional.of(ReconcileResult.STALE);
    }

    final BillingTransition.Decision decision = transition.decide(current);
    if (decision.isIgnored()) {
      logger.info(
          "billing event ignored userId={} source={} sourceId={} reason={}",
          userId,
          change.source(),
          change.sourceId(),
          decision.reason());
      return Optional.of(ReconcileResult.IGNORED);
    }

    final Instant mark =
        change.ordering().advancesMark()
            ? latest(state.lastEventAt(), change.occurredAt())
            : state.lastEventAt();
    final BillingState next = decision.next().withLastEventAt(mark);
    final Instant updatedAt = latest(now, current.updatedAt());
    if (next.sameEffectiveState(state)) {
      if (Objects.equals(next.lastEventAt(), state.lastEventAt())) {
        return Optional.of(ReconcileResult.UNCHANGED);
      }
      // 内容が同じでも順序判定の基準時刻だけは進める。監査には残さない。
      return billingRecordRepository
          .compareAndSet(userId, next, current.version(), updatedAt)
          .map(ignored -> ReconcileResult.UNCHANGED);
    }

    final Optional<UserBillingRecord> written =
        billingRecordRepository.compareAndSet(userId, next, current.version(), updatedAt);
    if (written.isEmpty()) {
      return Optional.empty();
    }
    final UserBillingRecord stored = written.get();
    auditRepository.insert(
        new BillingAuditRecord(
            userId,
            resolveAction(state, next),
            change.source(),
            change.sourceId(),
            state.status().name(),
            next.status().name(),
            state.tier().name(),
            next.tier().name(),
            next.externalSubscriptionId(),
            stored.version(),
            updatedAt));
    logger.info(
        "billing record updated userId={} source={} status={}->{} tier={}->{} version={}",
        userId,
        change.source(),
        state.status(),
        next.status(),
        state.tier(),
        next.tier(),
        stored.version());
    return Optional.of(ReconcileResult.APPLIED);
  }

  private UserBillingRecord loadOrCreate(String userId, Instant now) {
    final Optional<UserBillingRecord> existing = billingRecordRepository.findByUserId(userId);
    if (existing.isPresent()) {
      return existing.get();
    }
    billingRecordRepository.insertIfAbsent(userId, BillingState.initial(), now);
    return billingRecordRepository
        .findByUserId(userId)
        .orElseThrow(() -> new IllegalStateException("billing record missing after insert: " + userId));
  }

  private static boolean isStale(BillingChange change, BillingState state) {
    return change.ordering().guarded()
        && change.occurredAt() != null
        && state.lastEventAt() != null
        && change.occurredAt().isBefore(state.lastEventAt());
  }

  private static String resolveAction(BillingState from, BillingState to) {
    if (from.status() != to.status()) {
      return "STATUS_" + to.status().name();
    }
    if (from.tier() != to.tier()) {
      return "TIER_" + to.tier().name();
    }
    return "REFRESH";
  }

  private static Instant latest(Instant first, Instant second) {
    if (first == null) {
      return second;
    }
    if (second == null) {
      return first;
    }
    return first.isAfter(second) ? first : second;
  }
}
