/*
 * どこで: Billing ドメインモデル
 * 何を: 1 プラン分の表示名・価格 ID・機能上限を保持する
 * なぜ: 設定から組み立てた不変のカタログ要素として各コンポーネントへ渡すため
 */
package com.firetrack.billing.model;

import java.util.List;

public record TierDefinition(
    SubscriptionTier tier,
    String displayName,
    String priceId,
    List<String> additionalPriceIds,
    LimitBundle limits) {

  public TierDefinition {
    additionalPriceIds = additionalPriceIds == null ? List.of() : List.copyOf(additionalPriceIds);
  }

  public boolean selfServiceCheckout() {
    return priceId != null && !priceId.isBlank();
  }

  public boolean matchesPriceId(String candidate) {
    if (candidate == null) {
      return false;
    }
    return candidate.equals(priceId) || additionalPriceIds.contains(candidate);
  }
}
