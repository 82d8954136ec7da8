/*
 * どこで: Billing サービス層
 * 何を: 支払い情報なしの無料トライアルを 1 ユーザー 1 回だけ開始する
 * なぜ: 契約履歴のあるユーザーへの再付与を防ぎつつ、初回は CAS 書き込みで確実に反映するため
 */
package com.firetrack.billing.service;

import com.firetrack.billing.api.TrialNotAllowedException;
import com.firetrack.billing.api.response.BillingSummaryResponse;
import com.firetrack.billing.config.BillingTrialProperties;
import com.firetrack.billing.model.BillingState;
import com.firetrack.billing.model.ReconcileResult;
import com.firetrack.billing.model.SubscriptionStatus;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TrialService {

  private static final Logger logger = LoggerFactory.getLogger(TrialService.class);
  private static final String SOURCE_TRIAL = "trial";

  private final BillingRecordWriter writer;
  private final BillingQueryService queryService;
  private final BillingTrialProperties trialProperties;
  private final Clock clock;

  public BillingSummaryResponse startTrial(String userId) {
    final Instant startedAt = Instant.now(clock);
    final Instant endsAt = startedAt.plus(trialProperties.duration());
    final ReconcileResult result =
        writer.apply(
            userId,
            BillingChange.local(SOURCE_TRIAL),
            current -> {
              final BillingState state = current.state();
              if (state.hasSubscription()) {
                return BillingTransition.Decision.ignore("user already has a subscription");
              }
              if (state.trialStartedAt() != null) {
                return BillingTransition.Decision.ignore("trial already used");
              }
              return BillingTransition.Decision.moveTo(
                  state
                      .withTier(trialProperties.tier())
                      .withStatus(SubscriptionStatus.TRIALING)
                      .withTrial(startedAt, endsAt));
            });
    if (result != ReconcileResult.APPLIED) {
      throw new TrialNotAllowedException("trial is only available once and before subscribing");
    }
    logger.info("trial started userId={} tier={} endsAt={}", userId, trialProperties.tier(), endsAt);
    return queryService.getSummary(userId);
  }
}
