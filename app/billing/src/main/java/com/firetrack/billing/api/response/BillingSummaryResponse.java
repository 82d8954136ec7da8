/*
 * どこで: app/billing/src/main/java/com/firetrack/billing/api/response/BillingSummaryResponse.java
 * 何を: GET /v1/billing/me と POST /v1/billing/trials の出力 DTO
 * なぜ: 機能制限の判定に必要な状態と算出済み上限を 1 回の呼び出しで返すため
 */
package com.firetrack.billing.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.firetrack.billing.model.LimitBundle;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BillingSummaryResponse(
    String userId,
    String tier,
    String status,
    boolean active,
    boolean hasBillingRelationship,
    Instant currentPeriodStart,
    Instant currentPeriodEnd,
    Instant trialStartedAt,
    Instant trialEndsAt,
    LimitBundle limits,
    long version,
    Instant updatedAt) {}
