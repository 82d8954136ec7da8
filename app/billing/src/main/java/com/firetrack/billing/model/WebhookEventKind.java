/*
 * どこで: Billing ドメインモデル
 * 何を: 受理する決済プロバイダ webhook の種別を定義する
 * なぜ: 種別文字列の分岐を列挙の網羅 switch に寄せ、未対応種別を明示的に扱うため
 */
package com.firetrack.billing.model;

public enum WebhookEventKind {
  CHECKOUT_COMPLETED("checkout.session.completed"),
  SUBSCRIPTION_UPDATED("customer.subscription.updated"),
  SUBSCRIPTION_DELETED("customer.subscription.deleted"),
  INVOICE_PAYMENT_SUCCEEDED("invoice.payment_succeeded"),
  INVOICE_PAYMENT_FAILED("invoice.payment_failed"),
  UNKNOWN(null);

  private final String providerType;

  WebhookEventKind(String providerType) {
    this.providerType = providerType;
  }

  public String providerType() {
    return providerType;
  }

  public static WebhookEventKind fromProviderType(String type) {
    if (type == null) {
      return UNKNOWN;
    }
    for (WebhookEventKind kind : values()) {
      if (type.equals(kind.providerType)) {
        return kind;
      }
    }
    return UNKNOWN;
  }
}
