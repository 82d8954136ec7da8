/*
 * どこで: Billing サービス層
 * 何を: webhook 処理・セッション作成・CAS 競合などのメトリクスを記録する
 * なぜ: 反映漏れや決済プロバイダ障害を運用で継続監視できるようにするため
 */
package com.firetrack.billing.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class BillingMetrics {

  private static final String METRIC_WEBHOOK_TOTAL = "billing.webhook.total";
  private static final String METRIC_SESSION_TOTAL = "billing.session.total";
  private static final String METRIC_RECONCILE_CONFLICT_TOTAL = "billing.reconcile.conflict.total";
  private static final String METRIC_TIER_FALLBACK_TOTAL = "billing.tier.fallback.total";
  private static final String METRIC_TRIAL_EXPIRED_TOTAL = "billing.trial.expired.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Counter reconcileConflictCounter;
  private final Counter trialExpiredCounter;

  public BillingMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.reconcileConflictCounter =
        Counter.builder(METRIC_RECONCILE_CONFLICT_TOTAL)
            .description("Billing record compare-and-set conflicts")
            .register(meterRegistry);
    this.trialExpiredCounter =
        Counter.builder(METRIC_TRIAL_EXPIRED_TOTAL)
            .description("Trials moved to canceled by the expiry worker")
            .register(meterRegistry);
  }

  public void recordWebhook(String kind, String result) {
    increment(METRIC_WEBHOOK_TOTAL, "Stripe webhook deliveries", Tags.of("kind", kind, "result", result));
  }

  public void recordSession(String type, String result) {
    increment(METRIC_SESSION_TOTAL, "Hosted session creations", Tags.of("type", type, "result", result));
  }

  public void recordTierFallback(String reason) {
    increment(
        METRIC_TIER_FALLBACK_TOTAL,
        "Price ids that did not map to a configured tier",
        Tags.of("reason", reason));
  }

  public void recordReconcileConflict() {
    reconcileConflictCounter.increment();
  }

  public void recordTrialExpired(int count) {
    if (count > 0) {
      trialExpiredCounter.increment(count);
    }
  }

  private void increment(String name, String description, Tags tags) {
    final String key = name + tags;
    counters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(name).description(description).tags(tags).register(meterRegistry))
        .increment();
  }
}
