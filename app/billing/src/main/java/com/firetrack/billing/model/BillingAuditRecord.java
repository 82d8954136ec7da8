package com.firetrack.billing.model;

import java.time.Instant;

public record BillingAuditRecord(
    String userId,
    String action,
    String source,
    String sourceId,
    String fromStatus,
    String toStatus,
    String fromTier,
    String toTier,
    String externalSubscriptionId,
    long version,
    Instant createdAt) {}
