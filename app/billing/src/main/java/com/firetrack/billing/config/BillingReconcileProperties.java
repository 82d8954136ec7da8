/*
 * どこで: Billing 設定
 * 何を: webhook 反映時の挙動 (解約ポリシー・CAS 再試行・価格 ID 推定) を保持する
 * なぜ: 解約後の扱いなど運用判断が分かれる箇所を設定で明示するため
 */
package com.firetrack.billing.config;

import com.firetrack.billing.model.CancellationPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "billing.reconcile")
public record BillingReconcileProperties(
    CancellationPolicy cancellationPolicy,
    Integer maxAttempts,
    Boolean priceIdSubstringFallback) {

  public BillingReconcileProperties {
    cancellationPolicy = cancellationPolicy == null ? CancellationPolicy.PRESERVE : cancellationPolicy;
    maxAttempts = maxAttempts == null ? 5 : maxAttempts;
    priceIdSubstringFallback = priceIdSubstringFallback == null ? Boolean.TRUE : priceIdSubstringFallback;
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("billing.reconcile.max-attempts must be >= 1");
    }
  }
}
