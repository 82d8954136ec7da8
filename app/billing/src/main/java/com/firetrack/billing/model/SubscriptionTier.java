/*
 * どこで: Billing ドメインモデル
 * 何を: 契約プランの段階を定義する
 * なぜ: 宣言順をそのまま上下関係として扱い、不明な価格を最下位へ寄せる判定に使うため
 */
package com.firetrack.billing.model;

import java.util.Locale;
import java.util.Optional;

// 宣言順 = 上下関係。先頭が最下位プラン。
public enum SubscriptionTier {
  BASIC,
  PRO,
  ENTERPRISE;

  public static SubscriptionTier lowest() {
    return values()[0];
  }

  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<SubscriptionTier> fromKey(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    final String normalized = value.trim().toUpperCase(Locale.ROOT);
    for (SubscriptionTier tier : values()) {
      if (tier.name().equals(normalized)) {
        return Optional.of(tier);
      }
    }
    return Optional.empty();
  }
}
