/*
 * どこで: Billing サービス層
 * 何を: 決済プロバイダの価格 ID からプランを導出する
 * なぜ: 未登録の価格 ID でも最下位プランへ倒して処理を止めず、その事実を監視できるようにするため
 */
package com.firetrack.billing.service;

import com.firetrack.billing.config.BillingReconcileProperties;
import com.firetrack.billing.model.SubscriptionTier;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TierResolver {

  private static final Logger logger = LoggerFactory.getLogger(TierResolver.class);

  private final TierCatalog tierCatalog;
  private final BillingReconcileProperties reconcileProperties;
  private final BillingMetrics metrics;

  public SubscriptionTier resolve(String priceId) {
    if (priceId == null || priceId.isBlank()) {
      return fallback("missing_price", priceId);
    }
    final Optional<SubscriptionTier> exact = tierCatalog.tierForPriceId(priceId);
    if (exact.isPresent()) {
      return exact.get();
    }
    if (reconcileProperties.priceIdSubstringFallback()) {
      final Optional<SubscriptionTier> guessed = guessFromName(priceId);
      if (guessed.isPresent()) {
        logger.warn(
            "price id not configured, tier inferred from its name priceId={} tier={}",
            priceId,
            guessed.get());
        metrics.recordTierFallback("name_match");
        return guessed.get();
      }
    }
    return fallback("unknown_price", priceId);
  }

  // 複数のプラン名を含む場合は、過剰付与を避けるため最も低いプランを採る。
  private Optional<SubscriptionTier> guessFromName(String priceId) {
    final String normalized = priceId.toLowerCase(Locale.ROOT);
    for (SubscriptionTier tier : SubscriptionTier.values()) {
      if (normalized.contains(tier.key())) {
        return Optional.of(tier);
      }
    }
    return Optional.empty();
  }

  private SubscriptionTier fallback(String reason, String priceId) {
    final SubscriptionTier lowest = SubscriptionTier.lowest();
    logger.warn(
        "price id could not be mapped to a tier, falling back reason={} priceId={} tier={}",
        reason,
        priceId,
        lowest);
    metrics.recordTierFallback(reason);
    return lowest;
  }
}
