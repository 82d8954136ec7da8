package com.firetrack.billing.provider;

public record CheckoutSessionCommand(
    String userId,
    String externalCustomerId,
    String priceId,
    String successUrl,
    String cancelUrl,
    String idempotencyKey) {}
