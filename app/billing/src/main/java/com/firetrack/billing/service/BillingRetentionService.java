/*
 * どこで: Billing retention サービス
 * 何を: 保持期間を過ぎた処理済み webhook 記録を削除する
 * なぜ: プロバイダの再送期間を過ぎた記録でテーブルが肥大化しないようにするため
 */
package com.firetrack.billing.service;

import com.firetrack.billing.config.BillingRetentionProperties;
import com.firetrack.billing.repository.ProcessedWebhookEventRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class BillingRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(BillingRetentionService.class);

  private final ProcessedWebhookEventRepository processedEventRepository;
  private final BillingRetentionProperties retentionProperties;
  private final Clock clock;

  public int cleanup() {
    final Instant threshold = Instant.now(clock).minus(retentionProperties.processedEventTtl());
    final int deleted = processedEventRepository.deleteOlderThan(threshold);
    logger.info(
        "billing retention cleanup deleted processedWebhookEvents={} threshold={}",
        deleted,
        threshold);
    return deleted;
  }
}
