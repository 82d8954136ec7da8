/*
 * どこで: WebhookSignatureVerifier の単体テスト
 * 何を: 署名・改ざん・期限切れ・シークレット未設定の判定を検証する
 * なぜ: 偽造 webhook が解析段階へ進まないことを保証するため
 */
package com.firetrack.billing.service;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.firetrack.billing.WebhookPayloads;
import com.firetrack.billing.api.WebhookSignatureException;
import com.firetrack.billing.config.BillingStripeProperties;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class WebhookSignatureVerifierTest {

  private static final String PAYLOAD =
      WebhookPayloads.event("evt_1", "invoice.payment_failed", Instant.now(), "{\"id\":\"in_1\"}");

  private final WebhookSignatureVerifier verifier = verifier(WebhookPayloads.SECRET);

  @Test
  void acceptsValidSignature() {
    assertThatCode(
            () ->
                verifier.verify(
                    WebhookPayloads.bytes(PAYLOAD), WebhookPayloads.signatureHeader(PAYLOAD)))
        .doesNotThrowAnyException();
  }

  @Test
  void rejectsTamperedPayload() {
    final String header = WebhookPayloads.signatureHeader(PAYLOAD);
    final String tampered = PAYLOAD.replace("in_1", "in_2");

    assertThatThrownBy(() -> verifier.verify(WebhookPayloads.bytes(tampered), header))
        .isInstanceOf(WebhookSignatureException.class);
  }

  @Test
  void rejectsSignatureFromAnotherSecret() {
    final String header =
        WebhookPayloads.signatureHeader(PAYLOAD, "whsec_other", Instant.now());

    assertThatThrownBy(() -> verifier.verify(WebhookPayloads.bytes(PAYLOAD), header))
        .isInstanceOf(WebhookSignatureException.class);
  }

  @Test
  void rejectsTimestampOutsideTolerance() {
    final String header =
        WebhookPayloads.signatureHeader(
            PAYLOAD, WebhookPayloads.SECRET, Instant.now().minus(Duration.ofMinutes(10)));

    assertThatThrownBy(() -> verifier.verify(WebhookPayloads.bytes(PAYLOAD), header))
        .isInstanceOf(WebhookSignatureException.class);
  }

  @Test
  void rejectsMissingHeader() {
    assertThatThrownBy(() -> verifier.verify(WebhookPayloads.bytes(PAYLOAD), null))
        .isInstanceOf(WebhookSignatureException.class)
        .hasMessageContaining("missing");
  }

  @Test
  void rejectsEverythingWhenSecretIsNotConfigured() {
    final WebhookSignatureVerifier unconfigured = verifier("");

    assertThatThrownBy(
            () ->
                unconfigured.verify(
                    WebhookPayloads.bytes(PAYLOAD), WebhookPayloads.signatureHeader(PAYLOAD)))
        .isInstanceOf(WebhookSignatureException.class)
        .hasMessageContaining("not configured");
  }

  private static WebhookSignatureVerifier verifier(String secret) {
    return new WebhookSignatureVerifier(
        new BillingStripeProperties("sk_test", secret, Duration.ofMinutes(5), null, null, null));
  }
}
