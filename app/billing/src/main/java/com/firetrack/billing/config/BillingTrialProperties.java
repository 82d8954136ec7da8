/*
 * どこで: Billing 設定
 * 何を: 無料トライアルの付与内容と期限切れ処理の設定を保持する
 * なぜ: トライアル期間とワーカー間隔を運用で調整するため
 */
package com.firetrack.billing.config;

import com.firetrack.billing.model.SubscriptionTier;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "billing.trial")
public record BillingTrialProperties(
    SubscriptionTier tier,
    Duration duration,
    boolean expiryEnabled,
    Duration expiryInterval,
    Integer expiryBatchSize) {

  public BillingTrialProperties {
    tier = tier == null ? SubscriptionTier.PRO : tier;
    duration = duration == null ? Duration.ofDays(30) : duration;
    expiryInterval = expiryInterval == null ? Duration.ofMinutes(10) : expiryInterval;
    expiryBatchSize = expiryBatchSize == null ? 100 : expiryBatchSize;
    if (duration.isNegative() || duration.isZero()) {
      throw new IllegalArgumentException("billing.trial.duration must be positive");
    }
  }
}
