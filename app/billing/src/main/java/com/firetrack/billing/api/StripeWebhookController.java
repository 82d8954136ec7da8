/*
 * どこで: Billing API
 * 何を: 決済プロバイダからの webhook を生の本文のまま受け取る
 * なぜ: 署名は受信バイト列そのものに対して計算されるため、デシリアライズ前に検証へ渡す必要があるから
 */
package com.firetrack.billing.api;

import com.firetrack.billing.api.response.WebhookAckResponse;
import com.firetrack.billing.model.ReconcileResult;
import com.firetrack.billing.service.StripeWebhookService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/webhooks")
@RequiredArgsConstructor
public class StripeWebhookController {

  static final String HEADER_SIGNATURE = "Stripe-Signature";

  private final StripeWebhookService webhookService;

  @PostMapping("/stripe")
  public ResponseEntity<WebhookAckResponse> receive(
      @RequestHeader(value = HEADER_SIGNATURE, required = false) String signature,
      @RequestBody(required = false) byte[] rawBody) {
    final ReconcileResult result = webhookService.handle(rawBody, signature);
    return ResponseEntity.ok(new WebhookAckResponse(true, result.tag()));
  }
}
