package com.firetrack.billing.service;

import com.firetrack.billing.config.BillingCatalogProperties;
import com.firetrack.billing.model.LimitBundle;
import com.firetrack.billing.model.SubscriptionTier;
import java.util.List;
import java.util.Map;

final class TierCatalogFixtures {

  static final LimitBundle BASIC_LIMITS = new LimitBundle(100, false, 0, false, false, false, false);
  static final LimitBundle PRO_LIMITS = new LimitBundle(500, true, 5, true, true, true, true);
  static final LimitBundle ENTERPRISE_LIMITS =
      new LimitBundle(LimitBundle.UNLIMITED, true, 10, true, true, true, true);

  private TierCatalogFixtures() {}

  static BillingCatalogProperties properties() {
    return new BillingCatalogProperties(
        Map.of(
            SubscriptionTier.BASIC,
            new BillingCatalogProperties.Tier("Basic", "price_basic_monthly", null, BASIC_LIMITS),
            SubscriptionTier.PRO,
            new BillingCatalogProperties.Tier(
                "Pro", "price_pro_monthly", List.of("price_pro_yearly"), PRO_LIMITS),
            SubscriptionTier.ENTERPRISE,
            new BillingCatalogProperties.Tier("Enterprise", null, null, ENTERPRISE_LIMITS)));
  }

  static TierCatalog catalog() {
    return new TierCatalog(properties());
  }
}
