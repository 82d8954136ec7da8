/*
 * どこで: Billing サービス層
 * 何を: 検証済み webhook イベントを課金レコードの状態遷移へ写像する
 * なぜ: 到着順・重複・取り消し済みサブスクリプションの混在があっても最終状態を決定的に保つため
 */
package com.firetrack.billing.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.firetrack.billing.config.BillingReconcileProperties;
import com.firetrack.billing.model.BillingState;
import com.firetrack.billing.model.ReconcileResult;
import com.firetrack.billing.model.SubscriptionStatus;
import com.firetrack.billing.model.SubscriptionTier;
import com.firetrack.billing.model.WebhookEvent;
import com.firetrack.billing.provider.PaymentProviderClient;
import com.firetrack.billing.provider.PaymentProviderException;
import com.firetrack.billing.provider.ProviderSubscription;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

/**
 * Event handlers for the subscription lifecycle.
 *
 * <p>Every handler does its provider lookups first and then hands a pure transition to {@link
 * BillingRecordWriter}. A canceled subscription id never comes back to life; only a different
 * subscription id delivered by a completed checkout or a subscription update replaces it.
 */
@Service
@RequiredArgsConstructor
public class SubscriptionReconciler {

  private static final Logger logger = LoggerFactory.getLogger(SubscriptionReconciler.class);
  private static final String CHECKOUT_MODE_SUBSCRIPTION = "subscription";

  private final CustomerResolver customerResolver;
  private final PaymentProviderClient paymentProviderClient;
  private final TierResolver tierResolver;
  private final BillingRecordWriter writer;
  private final WebhookEventParser eventParser;
  private final BillingReconcileProperties reconcileProperties;

  public ReconcileResult onCheckoutCompleted(WebhookEvent event) {
    final JsonNode session = event.object();
    final String mode = WebhookEventParser.text(session, "mode");
    if (mode != null && !CHECKOUT_MODE_SUBSCRIPTION.equals(mode)) {
      logger.info("checkout session ignored, not a subscription mode={}", mode);
      return ReconcileResult.IGNORED;
    }
    final String subscriptionId = event.externalSubscriptionId();
    if (subscriptionId == null) {
      logger.warn("checkout session completed without subscription eventId={}", event.eventId());
      return ReconcileResult.IGNORED;
    }
    final Optional<String> userId =
        firstPresent(
            WebhookEventParser.text(session.path("metadata"), PaymentProviderClient.METADATA_USER_ID),
            WebhookEventParser.text(session, "client_reference_id"),
            event.externalCustomerId());
    if (userId.isEmpty()) {
      return unresolved(event);
    }
    final Optional<ProviderSubscription> fetched = fetchSubscription(subscriptionId);
    if (fetched.isEmpty()) {
      return ReconcileResult.IGNORED;
    }
    final ProviderSubscription subscription = fetched.get();
    final SubscriptionTier tier = tierResolver.resolve(subscription.priceId());
    final String customerId =
        subscription.customerId() != null ? subscription.customerId() : event.externalCustomerId();
    final Optional<String> holder = customerResolver.findLinkedUserId(customerId);
    if (holder.isPresent() && !holder.get().equals(userId.get())) {
      return customerOwnedElsewhere(event, userId.get(), holder.get(), customerId);
    }

    return write(
        event,
        userId.get(),
        change(event),
        current -> {
          final BillingState state = current.state();
          if (isCanceledSubscription(state, subscription.subscriptionId())) {
            return BillingTransition.Decision.ignore("subscription already canceled");
          }
          return BillingTransition.Decision.moveTo(
              state
                  .withExternalCustomerId(keepOrFill(state.externalCustomerId(), customerId))
                  .withExternalSubscriptionId(subscription.subscriptionId())
                  .withTier(tier)
                  .withStatus(SubscriptionStatus.ACTIVE)
                  .withPeriod(subscription.currentPeriodStart(), subscription.currentPeriodEnd()));
        });
  }

  public ReconcileResult onSubscriptionUpdated(WebhookEvent event) {
    final ProviderSubscription subscription = eventParser.toSubscription(event.object());
    final Optional<String> userId = resolveSubscriptionOwner(subscription);
    if (userId.isEmpty()) {
      return unresolved(event);
    }
    final SubscriptionStatus status = mapStatus(subscription);
    final SubscriptionTier tier = tierResolver.resolve(subscription.priceId());

    return write(
        event,
        userId.get(),
        change(event),
        current -> {
          final BillingState state = current.state();
          if (isCanceledSubscription(state, subscription.subscriptionId())) {
            return BillingTransition.Decision.ignore("subscription already canceled");
          }
          final boolean replacing =
              state.hasSubscription() && !state.isSubscription(subscription.subscriptionId());
          if (replacing && status == SubscriptionStatus.CANCELED) {
            return BillingTransition.Decision.ignore("update for superseded subscription");
          }
          BillingState next =
              state
                  .withExternalCustomerId(
                      keepOrFill(state.externalCustomerId(), subscription.customerId()))
                  .withExternalSubscriptionId(subscription.subscriptionId())
                  .withStatus(status)
                  .withTier(tier)
                  .withPeriod(subscription.currentPeriodStart(), subscription.currentPeriodEnd());
          if (status == SubscriptionStatus.TRIALING) {
            next = next.withTrial(subscription.trialStart(), subscription.trialEnd());
          }
          if (status == SubscriptionStatus.CANCELED) {
            next = next.withTier(cancellationTier(state.tier()));
          }
          return BillingTransition.Decision.moveTo(next);
        });
  }

  public ReconcileResult onSubscriptionDeleted(WebhookEvent event) {
    final ProviderSubscription subscription = eventParser.toSubscription(event.object());
    final Optional<String> userId = resolveSubscriptionOwner(subscription);
    if (userId.isEmpty()) {
      return unresolved(event);
    }
    // 取り消しは終端状態なので、後から届いた古い削除イベントも捨てない。
    return write(
        event,
        userId.get(),
        change(event, BillingChange.Ordering.TERMINAL),
        current -> {
          final BillingState state = current.state();
          if (state.hasSubscription() && !state.isSubscription(subscription.subscriptionId())) {
            return BillingTransition.Decision.ignore("deleted subscription is not current");
          }
          return BillingTransition.Decision.moveTo(
              state
                  .withExternalSubscriptionId(subscription.subscriptionId())
                  .withStatus(SubscriptionStatus.CANCELED)
                  .withTier(cancellationTier(state.tier())));
        });
  }

  public ReconcileResult onInvoicePaymentSucceeded(WebhookEvent event) {
    final String subscriptionId = event.externalSubscriptionId();
    if (subscriptionId == null) {
      logger.info("invoice without subscription ignored eventId={}", event.eventId());
      return ReconcileResult.IGNORED;
    }
    final Optional<String> userId = customerResolver.resolveUserId(event.externalCustomerId());
    if (userId.isEmpty()) {
      return unresolved(event);
    }
    final Optional<ProviderSubscription> fetched = fetchSubscription(subscriptionId);
    if (fetched.isEmpty()) {
      return ReconcileResult.IGNORED;
    }
    final ProviderSubscription subscription = fetched.get();

    // 期間はプロバイダから取り直した最新値なので、状態の順序判定には参加させない。
    return write(
        event,
        userId.get(),
        change(event, BillingChange.Ordering.UNORDERED),
        current -> {
          final BillingState state = current.state();
          if (!state.isSubscription(subscriptionId)) {
            return BillingTransition.Decision.ignore("invoice for a subscription that is not current");
          }
          if (state.status() == SubscriptionStatus.CANCELED) {
            return BillingTransition.Decision.ignore("subscription already canceled");
          }
          // 状態は subscription.updated に任せ、ここでは請求期間だけを揃える。
          return BillingTransition.Decision.moveTo(
              state.withPeriod(subscription.currentPeriodStart(), subscription.currentPeriodEnd()));
        });
  }

  public ReconcileResult onInvoicePaymentFailed(WebhookEvent event) {
    final String subscriptionId = event.externalSubscriptionId();
    final Optional<String> userId = customerResolver.resolveUserId(event.externalCustomerId());
    if (userId.isEmpty()) {
      return unresolved(event);
    }
    return write(
        event,
        userId.get(),
        change(event),
        current -> {
          final BillingState state = current.state();
          if (!state.hasSubscription()) {
            return BillingTransition.Decision.ignore("no subscription to mark past due");
          }
          if (subscriptionId != null && !state.isSubscription(subscriptionId)) {
            return BillingTransition.Decision.ignore("invoice for a subscription that is not current");
          }
          if (state.status() == SubscriptionStatus.CANCELED) {
            return BillingTransition.Decision.ignore("subscription already canceled");
          }
          return BillingTransition.Decision.moveTo(state.withStatus(SubscriptionStatus.PAST_DUE));
        });
  }

  // 顧客 ID の一意制約違反は再送しても解消しないので、手動突き合わせ対象として受理する。
  private ReconcileResult write(
      WebhookEvent event, String userId, BillingChange change, BillingTransition transition) {
    try {
      return writer.apply(userId, change, transition);
    } catch (DuplicateKeyException ex) {
      logger.warn(
          "customer link rejected by unique index userId={} cause={}",
          userId,
          ex.getMostSpecificCause().getMessage());
      return customerOwnedElsewhere(event, userId, null, event.externalCustomerId());
    }
  }

  private static ReconcileResult customerOwnedElsewhere(
      WebhookEvent event, String userId, String holderUserId, String customerId) {
    logger.warn(
        "webhook dropped, customer already linked to another user eventId={} type={} userId={}"
            + " holderUserId={} customerId={}",
        event.eventId(),
        event.type(),
        userId,
        holderUserId,
        customerId);
    return ReconcileResult.UNRESOLVED;
  }

  private Optional<String> resolveSubscriptionOwner(ProviderSubscription subscription) {
    final Optional<String> resolved = customerResolver.resolveUserId(subscription.customerId());
    if (resolved.isPresent()) {
      return resolved;
    }
    return Optional.ofNullable(subscription.metadataUserId());
  }

  // checkout は session 側のタグを優先し、無ければ顧客から辿る。
  private Optional<String> firstPresent(String metadataUserId, String clientReferenceId, String customerId) {
    if (metadataUserId != null) {
      return Optional.of(metadataUserId);
    }
    if (clientReferenceId != null) {
      return Optional.of(clientReferenceId);
    }
    return customerResolver.resolveUserId(customerId);
  }

  private Optional<ProviderSubscription> fetchSubscription(String subscriptionId) {
    try {
      return Optional.of(paymentProviderClient.retrieveSubscription(subscriptionId));
    } catch (PaymentProviderException ex) {
      if (ex.reason() == PaymentProviderException.Reason.NOT_FOUND) {
        logger.warn("subscription not found at provider subscriptionId={}", subscriptionId);
        return Optional.empty();
      }
      throw ex;
    }
  }

  private SubscriptionStatus mapStatus(ProviderSubscription subscription) {
    return SubscriptionStatus.fromProviderStatus(subscription.status())
        .orElseGet(
            () -> {
              logger.warn(
                  "unrecognised provider subscription status subscriptionId={} status={}",
                  subscription.subscriptionId(),
                  subscription.status());
              return SubscriptionStatus.INCOMPLETE;
            });
  }

  private SubscriptionTier cancellationTier(SubscriptionTier current) {
    return reconcileProperties.cancellationPolicy().tierAfterCancellation(current);
  }

  private static boolean isCanceledSubscription(BillingState state, String subscriptionId) {
    return state.status() == SubscriptionStatus.CANCELED && state.isSubscription(subscriptionId);
  }

  private static String keepOrFill(String current, String candidate) {
    return current != null ? current : candidate;
  }

  private static BillingChange change(WebhookEvent event) {
    return change(event, BillingChange.Ordering.ORDERED);
  }

  private static BillingChange change(WebhookEvent event, BillingChange.Ordering ordering) {
    return new BillingChange(
        event.kind().providerType(), event.eventId(), event.createdAt(), ordering);
  }

  private static ReconcileResult unresolved(WebhookEvent event) {
    logger.warn(
        "webhook dropped, owning user unresolved eventId={} type={} customerId={} subscriptionId={}",
        event.eventId(),
        event.type(),
        event.externalCustomerId(),
        event.externalSubscriptionId());
    return ReconcileResult.UNRESOLVED;
  }
}
