/*
 * どこで: Billing サービス層
 * 何を: 決済プロバイダのホスト型チェックアウト/ポータルセッションを発行する
 * なぜ: 価格と顧客をサーバ側で確定させ、クライアントにはリダイレクト先だけを渡すため
 */
package com.firetrack.billing.service;

import com.firetrack.billing.api.BillingRelationshipMissingException;
import com.firetrack.billing.api.request.CheckoutSessionRequest;
import com.firetrack.billing.api.request.PortalSessionRequest;
import com.firetrack.billing.api.response.CheckoutSessionResponse;
import com.firetrack.billing.api.response.PortalSessionResponse;
import com.firetrack.billing.config.BillingPrincipal;
import com.firetrack.billing.model.TierDefinition;
import com.firetrack.billing.model.UserBillingRecord;
import com.firetrack.billing.provider.CheckoutSessionCommand;
import com.firetrack.billing.provider.PaymentProviderClient;
import com.firetrack.billing.provider.PaymentProviderException;
import com.firetrack.billing.provider.ProviderCheckoutSession;
import com.firetrack.billing.repository.BillingRecordRepository;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class BillingSessionService {

  private static final Logger logger = LoggerFactory.getLogger(BillingSessionService.class);
  private static final String TYPE_CHECKOUT = "checkout";
  private static final String TYPE_PORTAL = "portal";

  private final TierCatalog tierCatalog;
  private final CustomerResolver customerResolver;
  private final PaymentProviderClient paymentProviderClient;
  private final BillingRecordRepository billingRecordRepository;
  private final BillingMetrics metrics;

  public CheckoutSessionResponse createCheckoutSession(
      BillingPrincipal caller, CheckoutSessionRequest request, String idempotencyKey) {
    final TierDefinition plan =
        tierCatalog
            .findByPlanId(request.planId())
            .orElseThrow(() -> invalidPlan(request.planId()));
    if (!plan.selfServiceCheckout()) {
      metrics.recordSession(TYPE_CHECKOUT, "invalid_plan");
      throw new IllegalArgumentException(
          "plan_id " + request.planId() + " is not available for self-service checkout");
    }
    try {
      final String customerId = customerResolver.findOrCreateCustomer(caller.userId(), caller.email());
      final ProviderCheckoutSession session =
          paymentProviderClient.createCheckoutSession(
              new CheckoutSessionCommand(
                  caller.userId(),
                  customerId,
                  plan.priceId(),
                  request.successUrl(),
                  request.cancelUrl(),
                  scopedKey(TYPE_CHECKOUT, caller.userId(), idempotencyKey)));
      metrics.recordSession(TYPE_CHECKOUT, "success");
      logger.info(
          "checkout session created userId={} tier={} sessionId={}",
          caller.userId(),
          plan.tier(),
          session.sessionId());
      return new CheckoutSessionResponse(session.sessionId(), session.url());
    } catch (PaymentProviderException ex) {
      metrics.recordSession(TYPE_CHECKOUT, ex.reason().name().toLowerCase(Locale.ROOT));
      throw ex;
    }
  }

  public PortalSessionResponse createPortalSession(
      BillingPrincipal caller, PortalSessionRequest request, String idempotencyKey) {
    final String customerId =
        billingRecordRepository
            .findByUserId(caller.userId())
            .map(UserBillingRecord::externalCustomerId)
            .orElse(null);
    if (customerId == null) {
      metrics.recordSession(TYPE_PORTAL, "no_relationship");
      throw new BillingRelationshipMissingException(
          "no billing relationship exists yet; complete a checkout first");
    }
    try {
      final String url =
          paymentProviderClient.createPortalSession(
              customerId, request.returnUrl(), scopedKey(TYPE_PORTAL, caller.userId(), idempotencyKey));
      metrics.recordSession(TYPE_PORTAL, "success");
      logger.info("portal session created userId={}", caller.userId());
      return new PortalSessionResponse(url);
    } catch (PaymentProviderException ex) {
      metrics.recordSession(TYPE_PORTAL, ex.reason().name().toLowerCase(Locale.ROOT));
      throw ex;
    }
  }

  private IllegalArgumentException invalidPlan(String planId) {
    metrics.recordSession(TYPE_CHECKOUT, "invalid_plan");
    return new IllegalArgumentException("plan_id " + planId + " is not a known plan");
  }

  // 呼び出し元のキーはユーザーと用途で名前空間を分けてからプロバイダへ渡す。
  private static String scopedKey(String type, String userId, String idempotencyKey) {
    if (idempotencyKey == null || idempotencyKey.isBlank()) {
      return null;
    }
    return "billing-" + type + "-" + userId + "-" + idempotencyKey.trim();
  }
}
