package com.firetrack.billing.api.response;

public record WebhookAckResponse(boolean received, String result) {}
