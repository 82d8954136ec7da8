/*
 * どこで: Billing retention ワーカー
 * 何を: retention cleanup をスケジュールで起動する
 * なぜ: 手動介入なしで期限切れ削除を回すため
 */
package com.firetrack.billing.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "billing.retention.enabled", havingValue = "true")
public class BillingRetentionWorker {

  private final BillingRetentionService retentionService;

  @Scheduled(fixedDelayString = "${billing.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
