/*
 * どこで: Billing ドメインモデル
 * 何を: billing_records の 1 行を表す
 * なぜ: 状態・算出済み上限・楽観ロック用の version をまとめて扱うため
 */
package com.firetrack.billing.model;

import java.time.Clock;
import java.time.Instant;

public record UserBillingRecord(
    String userId,
    BillingState state,
    LimitBundle limits,
    long version,
    Instant createdAt,
    Instant updatedAt) {

  public String externalCustomerId() {
    return state.externalCustomerId();
  }

  public String externalSubscriptionId() {
    return state.externalSubscriptionId();
  }

  public SubscriptionTier tier() {
    return state.tier();
  }

  public SubscriptionStatus status() {
    return state.status();
  }

  /** Active, or still inside a trial window. */
  public boolean isActive(Clock clock) {
    if (state.status() == SubscriptionStatus.ACTIVE) {
      return true;
    }
    return state.status() == SubscriptionStatus.TRIALING
        && state.trialEndsAt() != null
        && Instant.now(clock).isBefore(state.trialEndsAt());
  }
}
