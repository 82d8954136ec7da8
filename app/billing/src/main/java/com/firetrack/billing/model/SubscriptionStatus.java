/*
 * どこで: Billing ドメインモデル
 * 何を: 課金レコードの契約状態を定義する
 * なぜ: 決済プロバイダの状態文字列を内部状態へ閉じた集合で写像するため
 */
package com.firetrack.billing.model;

import java.util.Locale;
import java.util.Optional;

public enum SubscriptionStatus {
  TRIALING,
  ACTIVE,
  PAST_DUE,
  CANCELED,
  INCOMPLETE;

  /** Maps a provider subscription status string; empty when the value is not recognised. */
  public static Optional<SubscriptionStatus> fromProviderStatus(String providerStatus) {
    if (providerStatus == null) {
      return Optional.empty();
    }
    return switch (providerStatus.trim().toLowerCase(Locale.ROOT)) {
      case "trialing" -> Optional.of(TRIALING);
      case "active" -> Optional.of(ACTIVE);
      case "past_due", "unpaid", "paused" -> Optional.of(PAST_DUE);
      case "canceled", "incomplete_expired" -> Optional.of(CANCELED);
      case "incomplete" -> Optional.of(INCOMPLETE);
      default -> Optional.empty();
    };
  }
}
