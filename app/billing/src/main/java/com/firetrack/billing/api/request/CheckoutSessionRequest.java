/*
 * どこで: app/billing/src/main/java/com/firetrack/billing/api/request/CheckoutSessionRequest.java
 * 何を: POST /v1/billing/checkout-sessions の入力 DTO
 * なぜ: 購入プランと戻り先 URL だけを受け付け、価格はサーバ側の設定から決めるため
 */
package com.firetrack.billing.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CheckoutSessionRequest(
    @NotBlank(message = "plan_id is required") String planId,
    @NotBlank(message = "success_url is required")
        @Pattern(regexp = "https?://\\S+", message = "success_url must be an absolute http(s) URL")
        String successUrl,
    @NotBlank(message = "cancel_url is required")
        @Pattern(regexp = "https?://\\S+", message = "cancel_url must be an absolute http(s) URL")
        String cancelUrl) {}
