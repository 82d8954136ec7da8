/*
 * どこで: Billing サービス層
 * 何を: 設定から組み立てた不変のプランカタログを提供する
 * なぜ: 起動時に全プランの定義漏れ・価格 ID 重複を検出し、実行中は読み取り専用で共有するため
 */
package com.firetrack.billing.service;

import com.firetrack.billing.config.BillingCatalogProperties;
import com.firetrack.billing.model.SubscriptionTier;
import com.firetrack.billing.model.TierDefinition;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class TierCatalog {

  private final Map<SubscriptionTier, TierDefinition> definitions;
  private final Map<String, SubscriptionTier> tiersByPriceId;

  public TierCatalog(BillingCatalogProperties properties) {
    final Map<SubscriptionTier, TierDefinition> byTier = new EnumMap<>(SubscriptionTier.class);
    final Map<String, SubscriptionTier> byPrice = new HashMap<>();
    for (SubscriptionTier tier : SubscriptionTier.values()) {
      final BillingCatalogProperties.Tier configured = properties.tiers().get(tier);
      if (configured == null) {
        throw new IllegalStateException("billing.catalog.tiers." + tier.key() + " is not configured");
      }
      if (configured.limits() == null) {
        throw new IllegalStateException(
            "billing.catalog.tiers." + tier.key() + ".limits is not configured");
      }
      final TierDefinition definition =
          new TierDefinition(
              tier,
              configured.displayName() == null || configured.displayName().isBlank()
                  ? tier.name()
                  : configured.displayName(),
              blankToNull(configured.priceId()),
              configured.additionalPriceIds(),
              configured.limits());
      registerPrice(byPrice, definition.priceId(), tier);
      definition.additionalPriceIds().forEach(priceId -> registerPrice(byPrice, priceId, tier));
      byTier.put(tier, definition);
    }
    this.definitions = Collections.unmodifiableMap(byTier);
    this.tiersByPriceId = Map.copyOf(byPrice);
  }

  public TierDefinition definition(SubscriptionTier tier) {
    return definitions.get(tier);
  }

  /** All tiers, lowest first. */
  public List<TierDefinition> definitions() {
    return List.copyOf(definitions.values());
  }

  public Optional<SubscriptionTier> tierForPriceId(String priceId) {
    if (priceId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(tiersByPriceId.get(priceId));
  }

  /** Resolves a plan id given either as a tier key ("pro") or a configured price id. */
  public Optional<TierDefinition> findByPlanId(String planId) {
    if (planId == null || planId.isBlank()) {
      return Optional.empty();
    }
    return SubscriptionTier.fromKey(planId)
        .or(() -> tierForPriceId(planId.trim()))
        .map(definitions::get);
  }

  private static void registerPrice(
      Map<String, SubscriptionTier> byPrice, String priceId, SubscriptionTier tier) {
    if (priceId == null || priceId.isBlank()) {
      return;
    }
    final SubscriptionTier previous = byPrice.putIfAbsent(priceId, tier);
    if (previous != null && previous != tier) {
      throw new IllegalStateException(
          "price id " + priceId + " is configured for both " + previous + " and " + tier);
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
