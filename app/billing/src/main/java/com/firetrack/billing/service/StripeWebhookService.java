/*
 * どこで: Billing webhook 受付
 * 何を: 署名検証→解析→重複排除→種別ごとの反映→処理済み記録を順に行う
 * なぜ: 検証前の本文を一切解釈せず、一時障害時は記録を残さずプロバイダの再送に委ねるため
 */
package com.firetrack.billing.service;

import com.firetrack.billing.model.ReconcileResult;
import com.firetrack.billing.model.WebhookEvent;
import com.firetrack.billing.repository.ProcessedWebhookEventRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class StripeWebhookService {

  private static final Logger logger = LoggerFactory.getLogger(StripeWebhookService.class);
  private static final String MDC_EVENT_ID = "webhook_event_id";
  private static final String MDC_EVENT_TYPE = "webhook_event_type";

  private final WebhookSignatureVerifier signatureVerifier;
  private final WebhookEventParser eventParser;
  private final SubscriptionReconciler reconciler;
  private final ProcessedWebhookEventRepository processedEventRepository;
  private final BillingMetrics metrics;
  private final Clock clock;

  public ReconcileResult handle(byte[] rawBody, String signatureHeader) {
    try {
      signatureVerifier.verify(rawBody, signatureHeader);
    } catch (RuntimeException ex) {
      metrics.recordWebhook("unverified", "signature_invalid");
      throw ex;
    }
    final WebhookEvent event = eventParser.parse(rawBody);
    MDC.put(MDC_EVENT_ID, event.eventId());
    MDC.put(MDC_EVENT_TYPE, event.type());
    final String kindTag = event.kind().name().toLowerCase(Locale.ROOT);
    try {
      if (processedEventRepository.exists(event.eventId())) {
        logger.info("duplicate webhook delivery skipped");
        metrics.recordWebhook(kindTag, ReconcileResult.DUPLICATE.tag());
        return ReconcileResult.DUPLICATE;
      }
      final ReconcileResult result;
      try {
        result = dispatch(event);
      } catch (RuntimeException ex) {
        metrics.recordWebhook(kindTag, "error");
        throw ex;
      }
      // 反映が終わってから処理済みにする。途中で落ちた場合は再送で再実行される。
      processedEventRepository.insertIfAbsent(event.eventId(), event.type(), Instant.now(clock));
      metrics.recordWebhook(kindTag, result.tag());
      logger.info("webhook processed result={}", result);
      return result;
    } finally {
      MDC.remove(MDC_EVENT_ID);
      MDC.remove(MDC_EVENT_TYPE);
    }
  }

  private ReconcileResult dispatch(WebhookEvent event) {
    return switch (event.kind()) {
      case CHECKOUT_COMPLETED -> reconciler.onCheckoutCompleted(event);
      case SUBSCRIPTION_UPDATED -> reconciler.onSubscriptionUpdated(event);
      case SUBSCRIPTION_DELETED -> reconciler.onSubscriptionDeleted(event);
      case INVOICE_PAYMENT_SUCCEEDED -> reconciler.onInvoicePaymentSucceeded(event);
      case INVOICE_PAYMENT_FAILED -> reconciler.onInvoicePaymentFailed(event);
      case UNKNOWN -> {
        logger.info("webhook type not handled, acknowledged");
        yield ReconcileResult.IGNORED;
      }
    };
  }
}
