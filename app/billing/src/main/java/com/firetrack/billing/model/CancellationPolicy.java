/*
 * どこで: Billing ドメインモデル
 * 何を: 解約時にプランと上限をどう扱うかを定義する
 * なぜ: 解約後のダウングレード有無を設定で明示的に選べるようにするため
 */
package com.firetrack.billing.model;

public enum CancellationPolicy {
  /** Keep tier and limits as they were when the subscription ended. */
  PRESERVE,
  /** Drop to the lowest tier and recompute limits. */
  DOWNGRADE;

  public SubscriptionTier tierAfterCancellation(SubscriptionTier current) {
    return this == DOWNGRADE ? SubscriptionTier.lowest() : current;
  }
}
