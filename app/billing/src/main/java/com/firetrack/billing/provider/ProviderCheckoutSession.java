package com.firetrack.billing.provider;

public record ProviderCheckoutSession(String sessionId, String url) {}
