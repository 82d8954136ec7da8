/*
 * どこで: Billing 設定
 * 何を: 処理済み webhook 記録の保持期間と掃除間隔を保持する
 * なぜ: 重複排除テーブルの肥大化を運用設定で抑えるため
 */
package com.firetrack.billing.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "billing.retention")
public record BillingRetentionProperties(
    boolean enabled, Duration cleanupInterval, Duration processedEventTtl) {

  public BillingRetentionProperties {
    cleanupInterval = cleanupInterval == null ? Duration.ofHours(1) : cleanupInterval;
    processedEventTtl = processedEventTtl == null ? Duration.ofDays(30) : processedEventTtl;
  }
}
