package com.firetrack.billing.provider;

import java.time.Instant;

/**
 * Provider-side view of a subscription, reduced to the fields the billing record mirrors.
 *
 * @param priceId price of the first subscription item, may be null
 * @param metadataUserId user id tagged on the subscription at checkout, may be null
 */
public record ProviderSubscription(
    String subscriptionId,
    String customerId,
    String status,
    String priceId,
    Instant currentPeriodStart,
    Instant currentPeriodEnd,
    Instant trialStart,
    Instant trialEnd,
    String metadataUserId) {}
