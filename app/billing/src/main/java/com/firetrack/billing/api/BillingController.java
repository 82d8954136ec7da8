/*
 * どこで: Billing API
 * 何を: チェックアウト/ポータルセッション発行・契約状態参照・トライアル開始のエンドポイントを提供する
 * なぜ: 上流ゲートウェイが認証済みユーザーとして課金操作を呼び出せるようにするため
 */
package com.firetrack.billing.api;

import com.firetrack.billing.api.request.CheckoutSessionRequest;
import com.firetrack.billing.api.request.PortalSessionRequest;
import com.firetrack.billing.api.response.BillingSummaryResponse;
import com.firetrack.billing.api.response.CheckoutSessionResponse;
import com.firetrack.billing.api.response.PlansResponse;
import com.firetrack.billing.api.response.PortalSessionResponse;
import com.firetrack.billing.config.BillingPrincipal;
import com.firetrack.billing.service.BillingQueryService;
import com.firetrack.billing.service.BillingSessionService;
import com.firetrack.billing.service.TrialService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/billing")
@RequiredArgsConstructor
public class BillingController {

  private static final String HEADER_IDEMPOTENCY_KEY = "Idempotency-Key";

  private final BillingSessionService sessionService;
  private final BillingQueryService queryService;
  private final TrialService trialService;

  @PostMapping("/checkout-sessions")
  public ResponseEntity<CheckoutSessionResponse> createCheckoutSession(
      @AuthenticationPrincipal BillingPrincipal caller,
      @RequestHeader(value = HEADER_IDEMPOTENCY_KEY, required = false) String idempotencyKey,
      @Valid @RequestBody CheckoutSessionRequest request) {
    return ResponseEntity.ok(
        sessionService.createCheckoutSession(requireCaller(caller), request, idempotencyKey));
  }

  @PostMapping("/portal-sessions")
  public ResponseEntity<PortalSessionResponse> createPortalSession(
      @AuthenticationPrincipal BillingPrincipal caller,
      @RequestHeader(value = HEADER_IDEMPOTENCY_KEY, required = false) String idempotencyKey,
      @Valid @RequestBody PortalSessionRequest request) {
    return ResponseEntity.ok(
        sessionService.createPortalSession(requireCaller(caller), request, idempotencyKey));
  }

  @GetMapping("/me")
  public BillingSummaryResponse me(@AuthenticationPrincipal BillingPrincipal caller) {
    return queryService.getSummary(requireCaller(caller).userId());
  }

  @PostMapping("/trials")
  public BillingSummaryResponse startTrial(@AuthenticationPrincipal BillingPrincipal caller) {
    return trialService.startTrial(requireCaller(caller).userId());
  }

  @GetMapping("/plans")
  public PlansResponse plans() {
    return queryService.listPlans();
  }

  private static BillingPrincipal requireCaller(BillingPrincipal caller) {
    if (caller == null) {
      throw new UnauthenticatedException("caller identity is required");
    }
    return caller;
  }
}
