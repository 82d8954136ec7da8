/*
 * どこで: Billing 設定
 * 何を: 決済プロバイダ (Stripe) 接続と webhook 検証の設定を保持する
 * なぜ: API キーや署名シークレットをコードから切り離し、タイムアウトを運用で調整するため
 */
package com.firetrack.billing.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "billing.stripe")
public record BillingStripeProperties(
    String apiKey,
    String webhookSecret,
    Duration webhookTolerance,
    Duration connectTimeout,
    Duration readTimeout,
    Integer maxNetworkRetries) {

  public BillingStripeProperties {
    apiKey = apiKey == null ? "" : apiKey;
    webhookSecret = webhookSecret == null ? "" : webhookSecret;
    webhookTolerance = webhookTolerance == null ? Duration.ofMinutes(5) : webhookTolerance;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(20) : readTimeout;
    maxNetworkRetries = maxNetworkRetries == null ? 2 : maxNetworkRetries;
    if (maxNetworkRetries < 0) {
      throw new IllegalArgumentException("billing.stripe.max-network-retries must be >= 0");
    }
  }
}
