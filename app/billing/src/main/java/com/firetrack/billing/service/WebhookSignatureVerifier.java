/*
 * どこで: Billing webhook 受付
 * 何を: 生の本文と署名ヘッダを共有シークレットで検証する
 * なぜ: 本文を解釈する前に送信元を確定させ、偽造イベントを状態へ反映させないため
 */
package com.firetrack.billing.service;

import com.firetrack.billing.api.WebhookSignatureException;
import com.firetrack.billing.config.BillingStripeProperties;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.net.Webhook;
import java.nio.charset.StandardCharsets;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class WebhookSignatureVerifier {

  private static final Logger logger = LoggerFactory.getLogger(WebhookSignatureVerifier.class);

  private final BillingStripeProperties stripeProperties;

  public void verify(byte[] rawBody, String signatureHeader) {
    if (stripeProperties.webhookSecret().isBlank()) {
      // シークレット未設定のまま受理すると誰でも状態を書き換えられるため、常に拒否する。
      logger.error("webhook secret is not configured; rejecting webhook delivery");
      throw new WebhookSignatureException("webhook secret is not configured");
    }
    if (signatureHeader == null || signatureHeader.isBlank()) {
      throw new WebhookSignatureException("signature header is missing");
    }
    if (rawBody == null) {
      throw new WebhookSignatureException("payload is missing");
    }
    final String payload = new String(rawBody, StandardCharsets.UTF_8);
    try {
      Webhook.Signature.verifyHeader(
          payload,
          signatureHeader,
          stripeProperties.webhookSecret(),
          stripeProperties.webhookTolerance().toSeconds());
    } catch (SignatureVerificationException ex) {
      logger.warn("webhook signature verification failed: {}", ex.getMessage());
      throw new WebhookSignatureException("signature verification failed", ex);
    }
  }
}
