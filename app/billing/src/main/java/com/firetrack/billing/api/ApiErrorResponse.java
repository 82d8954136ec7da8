/*
 * どこで: Billing API
 * 何を: エラーレスポンスの共通フォーマットを定義する
 * なぜ: クライアントと決済プロバイダの再送判定が原因を識別しやすくするため
 */
package com.firetrack.billing.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ApiErrorResponse(ApiErrorCode code, String message) {}
