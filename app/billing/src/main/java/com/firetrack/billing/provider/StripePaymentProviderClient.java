/*
 * どこで: Billing 決済プロバイダ連携
 * 何を: Stripe SDK を使って PaymentProviderClient を実装する
 * なぜ: SDK 例外を再試行可否つきの PaymentProviderException へ正規化するため
 */
package com.firetrack.billing.provider;

import com.stripe.StripeClient;
import com.stripe.exception.ApiConnectionException;
import com.stripe.exception.ApiException;
import com.stripe.exception.InvalidRequestException;
import com.stripe.exception.RateLimitException;
import com.stripe.exception.StripeException;
import com.stripe.model.Customer;
import com.stripe.model.Price;
import com.stripe.model.Subscription;
import com.stripe.model.SubscriptionItem;
import com.stripe.model.checkout.Session;
import com.stripe.net.RequestOptions;
import com.stripe.param.CustomerCreateParams;
import com.stripe.param.checkout.SessionCreateParams;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "StripeClient は Spring 管理のスレッドセーフな共有クライアントで防御的コピーが不要なため")
public class StripePaymentProviderClient implements PaymentProviderClient {

  private static final Logger logger = LoggerFactory.getLogger(StripePaymentProviderClient.class);
  private static final int HTTP_NOT_FOUND = 404;
  private static final int HTTP_SERVER_ERROR = 500;

  private final StripeClient stripeClient;

  @Override
  public String createCustomer(String userId, String email, String idempotencyKey) {
    final CustomerCreateParams.Builder params =
        CustomerCreateParams.builder().putMetadata(METADATA_USER_ID, userId);
    if (email != null && !email.isBlank()) {
      params.setEmail(email);
    }
    try {
      final Customer customer =
          stripeClient.customers().create(params.build(), idempotent(idempotencyKey));
      logger.info("provider customer created userId={} customerId={}", userId, customer.getId());
      return customer.getId();
    } catch (StripeException ex) {
      throw translate("create customer", ex);
    }
  }

  @Override
  public Optional<String> findCustomerUserId(String externalCustomerId) {
    final Customer customer;
    try {
      customer = stripeClient.customers().retrieve(externalCustomerId);
    } catch (StripeException ex) {
      final PaymentProviderException translated = translate("retrieve customer", ex);
      if (translated.reason() == PaymentProviderException.Reason.NOT_FOUND) {
        return Optional.empty();
      }
      throw translated;
    }
    if (Boolean.TRUE.equals(customer.getDeleted())) {
      return Optional.empty();
    }
    return metadataUserId(customer.getMetadata());
  }

  @Override
  public ProviderSubscription retrieveSubscription(String externalSubscriptionId) {
    try {
      final Subscription subscription = stripeClient.subscriptions().retrieve(externalSubscriptionId);
      return toProviderSubscription(subscription);
    } catch (StripeException ex) {
      throw translate("retrieve subscription", ex);
    }
  }

  @Override
  public ProviderCheckoutSession createCheckoutSession(CheckoutSessionCommand command) {
    final SessionCreateParams params =
        SessionCreateParams.builder()
            .setMode(SessionCreateParams.Mode.SUBSCRIPTION)
            .setCustomer(command.externalCustomerId())
            .setClientReferenceId(command.userId())
            .setSuccessUrl(command.successUrl())
            .setCancelUrl(command.cancelUrl())
            .addLineItem(
                SessionCreateParams.LineItem.builder()
                    .setPrice(command.priceId())
                    .setQuantity(1L)
                    .build())
            .putMetadata(METADATA_USER_ID, command.userId())
            .setSubscriptionData(
                SessionCreateParams.SubscriptionData.builder()
                    .putMetadata(METADATA_USER_ID, command.userId())
                    .build())
            .build();
    try {
      final Session session =
          stripeClient.checkout().sessions().create(params, idempotent(command.idempotencyKey()));
      return new ProviderCheckoutSession(session.getId(), session.getUrl());
    } catch (StripeException ex) {
      throw translate("create checkout session", ex);
    }
  }

  @Override
  public String createPortalSession(
      String externalCustomerId, String returnUrl, String idempotencyKey) {
    final com.stripe.param.billingportal.SessionCreateParams params =
        com.stripe.param.billingportal.SessionCreateParams.builder()
            .setCustomer(externalCustomerId)
            .setReturnUrl(returnUrl)
            .build();
    try {
      final com.stripe.model.billingportal.Session session =
          stripeClient.billingPortal().sessions().create(params, idempotent(idempotencyKey));
      return session.getUrl();
    } catch (StripeException ex) {
      throw translate("create portal session", ex);
    }
  }

  // 請求期間は SDK が固定する API バージョン (2024-12-18.acacia) ではサブスクリプション本体にある。
  static ProviderSubscription toProviderSubscription(Subscription subscription) {
    final SubscriptionItem item = firstItem(subscription);
    final Price price = item == null ? null : item.getPrice();
    return new ProviderSubscription(
        subscription.getId(),
        subscription.getCustomer(),
        subscription.getStatus(),
        price == null ? null : price.getId(),
        epochSeconds(subscription.getCurrentPeriodStart()),
        epochSeconds(subscription.getCurrentPeriodEnd()),
        epochSeconds(subscription.getTrialStart()),
        epochSeconds(subscription.getTrialEnd()),
        metadataUserId(subscription.getMetadata()).orElse(null));
  }

  static PaymentProviderException translate(String operation, StripeException ex) {
    final PaymentProviderException.Reason reason = classify(ex);
    final String message = "provider " + operation + " failed: " + reason;
    if (reason == PaymentProviderException.Reason.REJECTED) {
      logger.error("{} code={} requestId={}", message, ex.getCode(), ex.getRequestId(), ex);
    } else {
      logger.warn("{} code={} requestId={}", message, ex.getCode(), ex.getRequestId());
    }
    return new PaymentProviderException(reason, message, ex);
  }

  static PaymentProviderException.Reason classify(StripeException ex) {
    if (ex instanceof ApiConnectionException) {
      return hasTimeoutCause(ex)
          ? PaymentProviderException.Reason.TIMEOUT
          : PaymentProviderException.Reason.UNAVAILABLE;
    }
    // RateLimitException は InvalidRequestException より先に判定する。
    if (ex instanceof RateLimitException) {
      return PaymentProviderException.Reason.UNAVAILABLE;
    }
    final Integer statusCode = ex.getStatusCode();
    if (ex instanceof ApiException && (statusCode == null || statusCode >= HTTP_SERVER_ERROR)) {
      return PaymentProviderException.Reason.UNAVAILABLE;
    }
    if (statusCode != null && statusCode >= HTTP_SERVER_ERROR) {
      return PaymentProviderException.Reason.UNAVAILABLE;
    }
    if (ex instanceof InvalidRequestException
        && statusCode != null
        && statusCode == HTTP_NOT_FOUND) {
      return PaymentProviderException.Reason.NOT_FOUND;
    }
    return PaymentProviderException.Reason.REJECTED;
  }

  private static boolean hasTimeoutCause(Throwable ex) {
    Throwable current = ex.getCause();
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private static RequestOptions idempotent(String idempotencyKey) {
    if (idempotencyKey == null || idempotencyKey.isBlank()) {
      return RequestOptions.getDefault();
    }
    return RequestOptions.builder().setIdempotencyKey(idempotencyKey).build();
  }

  private static SubscriptionItem firstItem(Subscription subscription) {
    if (subscription.getItems() == null) {
      return null;
    }
    final List<SubscriptionItem> items = subscription.getItems().getData();
    if (items == null || items.isEmpty()) {
      return null;
    }
    return items.get(0);
  }

  private static Optional<String> metadataUserId(Map<String, String> metadata) {
    if (metadata == null) {
      return Optional.empty();
    }
    final String userId = metadata.get(METADATA_USER_ID);
    if (userId == null || userId.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(userId.trim());
  }

  private static Instant epochSeconds(Long value) {
    return value == null ? null : Instant.ofEpochSecond(value);
  }
}
