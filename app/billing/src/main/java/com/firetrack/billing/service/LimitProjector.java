package com.firetrack.billing.service;

import com.firetrack.billing.model.LimitBundle;
import com.firetrack.billing.model.SubscriptionTier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

// 上限は常にプランから算出し、単独では書き換えない。
@Component
@RequiredArgsConstructor
public class LimitProjector {

  private final TierCatalog tierCatalog;

  public LimitBundle project(SubscriptionTier tier) {
    return tierCatalog.definition(tier).limits();
  }
}
