/*
 * どこで: Billing サービス層
 * 何を: 期限を過ぎた無料トライアルを CANCELED へ遷移させる
 * なぜ: 支払いに移行しなかったユーザーへプラン上限を与え続けないため
 */
package com.firetrack.billing.service;

import com.firetrack.billing.config.BillingReconcileProperties;
import com.firetrack.billing.config.BillingTrialProperties;
import com.firetrack.billing.model.BillingState;
import com.firetrack.billing.model.ReconcileResult;
import com.firetrack.billing.model.SubscriptionStatus;
import com.firetrack.billing.repository.BillingRecordRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TrialExpiryService {

  private static final Logger logger = LoggerFactory.getLogger(TrialExpiryService.class);
  private static final String SOURCE_TRIAL_EXPIRY = "trial_expiry";

  private final BillingRecordRepository billingRecordRepository;
  private final BillingRecordWriter writer;
  private final BillingTrialProperties trialProperties;
  private final BillingReconcileProperties reconcileProperties;
  private final BillingMetrics metrics;
  private final Clock clock;

  /** @return number of trials moved to canceled in this run */
  public int expireDueTrials() {
    final Instant now = Instant.now(clock);
    final List<String> userIds =
        billingRecordRepository.findExpiredTrialUserIds(now, trialProperties.expiryBatchSize());
    int expired = 0;
    for (String userId : userIds) {
      final ReconcileResult result =
          writer.apply(
              userId,
              BillingChange.local(SOURCE_TRIAL_EXPIRY),
              current -> {
                final BillingState state = current.state();
                // 取得後にチェックアウトが完了していれば触らない。
                if (state.status() != SubscriptionStatus.TRIALING
                    || state.hasSubscription()
                    || state.trialEndsAt() == null
                    || state.trialEndsAt().isAfter(now)) {
                  return BillingTransition.Decision.ignore("trial no longer due");
                }
                return BillingTransition.Decision.moveTo(
                    state
                        .withStatus(SubscriptionStatus.CANCELED)
                        .withTier(
                            reconcileProperties.cancellationPolicy().tierAfterCancellation(state.tier())));
              });
      if (result == ReconcileResult.APPLIED) {
        expired++;
      }
    }
    metrics.recordTrialExpired(expired);
    if (!userIds.isEmpty()) {
      logger.info("trial expiry run candidates={} expired={}", userIds.size(), expired);
    }
    return expired;
  }
}
