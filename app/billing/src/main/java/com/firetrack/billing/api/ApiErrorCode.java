/*
 * どこで: Billing API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.firetrack.billing.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  UNAUTHENTICATED,
  WEBHOOK_SIGNATURE_INVALID,
  BILLING_RECORD_NOT_FOUND,
  BILLING_RELATIONSHIP_MISSING,
  TRIAL_NOT_ALLOWED,
  PROVIDER_REJECTED,
  PROVIDER_UNAVAILABLE,
  PROVIDER_TIMEOUT,
  TEMPORARILY_UNAVAILABLE,
  INTERNAL
}
