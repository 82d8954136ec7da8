/*
 * どこで: Billing ドメインモデル
 * 何を: 課金レコードのうち状態遷移で書き換わる部分を保持する
 * なぜ: 遷移の計算結果を 1 つの値として CAS 更新へ渡し、部分更新による不整合を防ぐため
 */
package com.firetrack.billing.model;

import java.time.Instant;
import java.util.Objects;
import lombok.With;

@With
public record BillingState(
    String externalCustomerId,
    String externalSubscriptionId,
    SubscriptionTier tier,
    SubscriptionStatus status,
    Instant currentPeriodStart,
    Instant currentPeriodEnd,
    Instant trialStartedAt,
    Instant trialEndsAt,
    Instant lastEventAt) {

  public BillingState {
    Objects.requireNonNull(tier, "tier");
    Objects.requireNonNull(status, "status");
  }

  /** Fresh row for a user the engine has never seen: no subscription, lowest tier. */
  public static BillingState initial() {
    return new BillingState(
        null,
        null,
        SubscriptionTier.lowest(),
        SubscriptionStatus.INCOMPLETE,
        null,
        null,
        null,
        null,
        null);
  }

  public BillingState withPeriod(Instant start, Instant end) {
    return withCurrentPeriodStart(start).withCurrentPeriodEnd(end);
  }

  public BillingState withTrial(Instant startedAt, Instant endsAt) {
    return withTrialStartedAt(startedAt).withTrialEndsAt(endsAt);
  }

  // last_event_at は順序判定用の印であり、状態の実質的な差分には含めない。
  public boolean sameEffectiveState(BillingState other) {
    return other != null && equals(other.withLastEventAt(lastEventAt));
  }

  public boolean hasSubscription() {
    return externalSubscriptionId != null;
  }

  public boolean isSubscription(String subscriptionId) {
    return externalSubscriptionId != null && externalSubscriptionId.equals(subscriptionId);
  }
}
