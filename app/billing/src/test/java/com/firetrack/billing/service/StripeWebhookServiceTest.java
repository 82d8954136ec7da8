/*
 * どこで: StripeWebhookService の単体テスト
 * 何を: 署名検証の先行・重複排除・処理済み記録のタイミングを検証する
 * なぜ: 一時障害で処理済みになってしまうと再送でも反映されなくなるため
 */
package com.firetrack.billing.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.firetrack.billing.WebhookPayloads;
import com.firetrack.billing.api.BillingRecordConflictException;
import com.firetrack.billing.api.WebhookSignatureException;
import com.firetrack.billing.config.BillingStripeProperties;
import com.firetrack.billing.model.ReconcileResult;
import com.firetrack.billing.repository.ProcessedWebhookEventRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

@ExtendWith(MockitoExtension.class)
class StripeWebhookServiceTest {

  private static final Instant NOW = Instant.parse("2026-04-01T00:00:00Z");

  @Mock private SubscriptionReconciler reconciler;
  @Mock private ProcessedWebhookEventRepository processedEventRepository;

  private SimpleMeterRegistry meterRegistry;
  private StripeWebhookService service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    service =
        new StripeWebhookService(
            new WebhookSignatureVerifier(
                new BillingStripeProperties(
                    "sk_test", WebhookPayloads.SECRET, Duration.ofMinutes(5), null, null, null)),
            new WebhookEventParser(new ObjectMapper()),
            reconciler,
            processedEventRepository,
            new BillingMetrics(meterRegistry),
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "checkout.session.completed",
        "customer.subscription.updated",
        "customer.subscription.deleted",
        "invoice.payment_succeeded",
        "invoice.payment_failed",
        "product.created"
      })
  void rejectsBadSignatureBeforeTouchingAnything(String type) {
    final String payload = WebhookPayloads.event("evt_1", type, NOW, objectFor(type));
    final String header = WebhookPayloads.signatureHeader(payload, "whsec_other", Instant.now());

    assertThatThrownBy(() -> service.handle(WebhookPayloads.bytes(payload), header))
        .isInstanceOf(WebhookSignatureException.class);
    verifyNoInteractions(reconciler, processedEventRepository);
    assertThat(webhookCount("unverified", "signature_invalid")).isEqualTo(1.0);
  }

  @Test
  void rejectsBodyChangedAfterSigning() {
    final String signed = subscriptionUpdated("evt_1");
    final String header = WebhookPayloads.signatureHeader(signed);
    final String tampered = signed.replace("\"active\"", "\"past_due\"");

    assertThatThrownBy(() -> service.handle(WebhookPayloads.bytes(tampered), header))
        .isInstanceOf(WebhookSignatureException.class);
    verifyNoInteractions(reconciler, processedEventRepository);
  }

  @Test
  void dispatchesAndMarksProcessedAfterSuccess() {
    final String payload = subscriptionUpdated("evt_2");
    when(processedEventRepository.exists("evt_2")).thenReturn(false);
    when(reconciler.onSubscriptionUpdated(any())).thenReturn(ReconcileResult.APPLIED);

    final ReconcileResult result =
        service.handle(WebhookPayloads.bytes(payload), WebhookPayloads.signatureHeader(payload));

    assertThat(result).isEqualTo(ReconcileResult.APPLIED);
    verify(processedEventRepository).insertIfAbsent("evt_2", "customer.subscription.updated", NOW);
    assertThat(webhookCount("subscription_updated", "applied")).isEqualTo(1.0);
    assertThat(MDC.get("webhook_event_id")).isNull();
  }

  @Test
  void duplicateDeliveryIsAcknowledgedWithoutReconciling() {
    final String payload = subscriptionUpdated("evt_3");
    when(processedEventRepository.exists("evt_3")).thenReturn(true);

    assertThat(
            service.handle(
                WebhookPayloads.bytes(payload), WebhookPayloads.signatureHeader(payload)))
        .isEqualTo(ReconcileResult.DUPLICATE);
    verifyNoInteractions(reconciler);
    verify(processedEventRepository, never()).insertIfAbsent(anyString(), anyString(), any());
  }

  @Test
  void transientFailureLeavesEventUnprocessed() {
    final String payload = subscriptionUpdated("evt_4");
    when(processedEventRepository.exists("evt_4")).thenReturn(false);
    when(reconciler.onSubscriptionUpdated(any()))
        .thenThrow(new BillingRecordConflictException("busy"));

    assertThatThrownBy(
            () ->
                service.handle(
                    WebhookPayloads.bytes(payload), WebhookPayloads.signatureHeader(payload)))
        .isInstanceOf(BillingRecordConflictException.class);
    verify(processedEventRepository, never()).insertIfAbsent(anyString(), anyString(), any());
    assertThat(webhookCount("subscription_updated", "error")).isEqualTo(1.0);
  }

  @Test
  void unknownEventTypeIsAcknowledgedAndRecorded() {
    final String payload =
        WebhookPayloads.event(
            "evt_5", "product.created", NOW, "{\"id\":\"prod_1\",\"object\":\"product\"}");
    when(processedEventRepository.exists("evt_5")).thenReturn(false);

    assertThat(
            service.handle(
                WebhookPayloads.bytes(payload), WebhookPayloads.signatureHeader(payload)))
        .isEqualTo(ReconcileResult.IGNORED);
    verifyNoInteractions(reconciler);
    verify(processedEventRepository).insertIfAbsent("evt_5", "product.created", NOW);
  }

  private static String objectFor(String type) {
    if (type.startsWith("checkout.")) {
      return WebhookPayloads.checkoutSession("user-1", "cus_1", "sub_1");
    }
    if (type.startsWith("invoice.")) {
      return WebhookPayloads.invoice("cus_1", "sub_1");
    }
    if (type.startsWith("customer.subscription.")) {
      return WebhookPayloads.subscription(
          "sub_1", "cus_1", "active", "price_pro_monthly", NOW, NOW.plus(Duration.ofDays(30)));
    }
    return "{\"id\":\"prod_1\",\"object\":\"product\"}";
  }

  private static String subscriptionUpdated(String eventId) {
    return WebhookPayloads.event(
        eventId,
        "customer.subscription.updated",
        NOW,
        WebhookPayloads.subscription(
            "sub_1",
            "cus_1",
            "active",
            "price_pro_monthly",
            NOW,
            NOW.plus(Duration.ofDays(30))));
  }

  private double webhookCount(String kind, String result) {
    return meterRegistry
        .get("billing.webhook.total")
        .tags("kind", kind, "result", result)
        .counter()
        .count();
  }
}
