/*
 * どこで: BillingController の Web 層テスト
 * 何を: 転送ヘッダ認証・入力検証・例外から HTTP ステータスへの変換を検証する
 * なぜ: 「課金関係なし」と「一時的に利用不可」を呼び出し側が区別できることを保証するため
 */
package com.firetrack.billing.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.firetrack.billing.api.request.CheckoutSessionRequest;
import com.firetrack.billing.api.request.PortalSessionRequest;
import com.firetrack.billing.api.response.CheckoutSessionResponse;
import com.firetrack.billing.api.response.PlanResponse;
import com.firetrack.billing.api.response.PlansResponse;
import com.firetrack.billing.config.BillingPrincipal;
import com.firetrack.billing.config.BillingSecurityConfig;
import com.firetrack.billing.model.LimitBundle;
import com.firetrack.billing.provider.PaymentProviderException;
import com.firetrack.billing.service.BillingQueryService;
import com.firetrack.billing.service.BillingSessionService;
import com.firetrack.billing.service.TrialService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

@WebMvcTest(BillingController.class)
@AutoConfigureMockMvc
@Import({BillingSecurityConfig.class, ApiExceptionHandler.class})
@TestPropertySource(properties = "billing.internal-api.token=test-internal-token")
class BillingControllerTest {

  private static final BillingPrincipal CALLER = new BillingPrincipal("user-1", "a@example.com");
  private static final String CHECKOUT_BODY =
      """
      {"plan_id":"pro","success_url":"https://app.example/ok","cancel_url":"https://app.example/no"}
      """;

  @Autowired private MockMvc mockMvc;

  @MockitoBean private BillingSessionService sessionService;
  @MockitoBean private BillingQueryService queryService;
  @MockitoBean private TrialService trialService;

  @Test
  void checkoutReturnsRedirect() throws Exception {
    when(sessionService.createCheckoutSession(
            eq(CALLER),
            eq(new CheckoutSessionRequest("pro", "https://app.example/ok", "https://app.example/no")),
            eq("key-1")))
        .thenReturn(new CheckoutSessionResponse("cs_1", "https://checkout.example/cs_1"));

    mockMvc
        .perform(asCaller(post("/v1/billing/checkout-sessions")).header("Idempotency-Key", "key-1").content(CHECKOUT_BODY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.session_id").value("cs_1"))
        .andExpect(jsonPath("$.redirect_url").value("https://checkout.example/cs_1"));
  }

  @Test
  void checkoutWithoutForwardedIdentityIsUnauthorized() throws Exception {
    mockMvc
        .perform(
            post("/v1/billing/checkout-sessions")
                .header("X-Internal-Token", "test-internal-token")
                .contentType(MediaType.APPLICATION_JSON)
                .content(CHECKOUT_BODY))
        .andExpect(status().isUnauthorized());
    verifyNoInteractions(sessionService);
  }

  @Test
  void checkoutWithWrongTokenIsUnauthorized() throws Exception {
    mockMvc
        .perform(
            post("/v1/billing/checkout-sessions")
                .header("X-Internal-Token", "wrong")
                .header("X-User-Id", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(CHECKOUT_BODY))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void checkoutRejectsRelativeUrls() throws Exception {
    mockMvc
        .perform(
            asCaller(post("/v1/billing/checkout-sessions"))
                .content("{\"plan_id\":\"pro\",\"success_url\":\"/ok\",\"cancel_url\":\"https://app.example/no\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("success_url must be an absolute http(s) URL"));
    verifyNoInteractions(sessionService);
  }

  @Test
  void checkoutUnknownPlanIsBadRequest() throws Exception {
    when(sessionService.createCheckoutSession(any(), any(), isNull()))
        .thenThrow(new IllegalArgumentException("plan_id gold is not a known plan"));

    mockMvc
        .perform(asCaller(post("/v1/billing/checkout-sessions")).content(CHECKOUT_BODY))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("plan_id gold is not a known plan"));
  }

  @Test
  void providerTimeoutIsGatewayTimeout() throws Exception {
    when(sessionService.createCheckoutSession(any(), any(), any()))
        .thenThrow(new PaymentProviderException(PaymentProviderException.Reason.TIMEOUT, "slow"));

    mockMvc
        .perform(asCaller(post("/v1/billing/checkout-sessions")).content(CHECKOUT_BODY))
        .andExpect(status().isGatewayTimeout())
        .andExpect(jsonPath("$.code").value("PROVIDER_TIMEOUT"));
  }

  @Test
  void providerRejectionIsBadGateway() throws Exception {
    when(sessionService.createCheckoutSession(any(), any(), any()))
        .thenThrow(new PaymentProviderException(PaymentProviderException.Reason.REJECTED, "no"));

    mockMvc
        .perform(asCaller(post("/v1/billing/checkout-sessions")).content(CHECKOUT_BODY))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.code").value("PROVIDER_REJECTED"));
  }

  @Test
  void portalWithoutRelationshipIsConflictNotUnavailable() throws Exception {
    when(sessionService.createPortalSession(
            eq(CALLER), eq(new PortalSessionRequest("https://app.example/account")), isNull()))
        .thenThrow(new BillingRelationshipMissingException("no billing relationship exists yet"));

    mockMvc
        .perform(
            asCaller(post("/v1/billing/portal-sessions"))
                .content("{\"return_url\":\"https://app.example/account\"}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("BILLING_RELATIONSHIP_MISSING"));
  }

  @Test
  void portalDuringProviderOutageIsServiceUnavailable() throws Exception {
    when(sessionService.createPortalSession(any(), any(), any()))
        .thenThrow(
            new PaymentProviderException(PaymentProviderException.Reason.UNAVAILABLE, "down"));

    mockMvc
        .perform(
            asCaller(post("/v1/billing/portal-sessions"))
                .content("{\"return_url\":\"https://app.example/account\"}"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("PROVIDER_UNAVAILABLE"));
  }

  @Test
  void summaryForUnknownUserIsNotFound() throws Exception {
    when(queryService.getSummary("user-1"))
        .thenThrow(new BillingRecordNotFoundException("no billing record for user"));

    mockMvc
        .perform(asCaller(get("/v1/billing/me")))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("BILLING_RECORD_NOT_FOUND"));
  }

  @Test
  void repeatedTrialIsConflict() throws Exception {
    when(trialService.startTrial("user-1"))
        .thenThrow(new TrialNotAllowedException("trial is only available once"));

    mockMvc
        .perform(asCaller(post("/v1/billing/trials")))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("TRIAL_NOT_ALLOWED"));
  }

  @Test
  void plansArePublic() throws Exception {
    when(queryService.listPlans())
        .thenReturn(
            new PlansResponse(
                List.of(
                    new PlanResponse(
                        "pro",
                        "Pro",
                        true,
                        new LimitBundle(500, true, 5, true, true, true, true)))));

    mockMvc
        .perform(get("/v1/billing/plans"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.plans[0].plan_id").value("pro"))
        .andExpect(jsonPath("$.plans[0].limits.max_extinguishers").value(500));
  }

  @Test
  void idempotencyKeyIsOptional() throws Exception {
    when(sessionService.createCheckoutSession(any(), any(), isNull()))
        .thenReturn(new CheckoutSessionResponse("cs_2", "https://checkout.example/cs_2"));

    mockMvc
        .perform(asCaller(post("/v1/billing/checkout-sessions")).content(CHECKOUT_BODY))
        .andExpect(status().isOk());
    verify(sessionService).createCheckoutSession(eq(CALLER), any(), isNull());
  }

  private static MockHttpServletRequestBuilder asCaller(MockHttpServletRequestBuilder builder) {
    return builder
        .header("X-Internal-Token", "test-internal-token")
        .header("X-User-Id", CALLER.userId())
        .header("X-User-Email", CALLER.email())
        .contentType(MediaType.APPLICATION_JSON);
  }
}
