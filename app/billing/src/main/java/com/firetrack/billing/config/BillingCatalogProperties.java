/*
 * どこで: Billing 設定
 * 何を: プラン定義 (表示名・価格 ID・機能上限) の設定を保持する
 * なぜ: 価格 ID と上限値をデプロイ時の設定として差し替えられるようにするため
 */
package com.firetrack.billing.config;

import com.firetrack.billing.model.LimitBundle;
import com.firetrack.billing.model.SubscriptionTier;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "billing.catalog")
public record BillingCatalogProperties(Map<SubscriptionTier, Tier> tiers) {

  public BillingCatalogProperties {
    tiers = tiers == null ? Map.of() : Map.copyOf(tiers);
  }

  public record Tier(
      String displayName, String priceId, List<String> additionalPriceIds, LimitBundle limits) {

    public Tier {
      additionalPriceIds = additionalPriceIds == null ? List.of() : List.copyOf(additionalPriceIds);
    }
  }
}
