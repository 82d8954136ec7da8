/*
 * どこで: Billing 決済プロバイダ連携
 * 何を: プロバイダ呼び出し失敗を理由つきで表現する
 * なぜ: API 層と webhook 処理で「再試行すべきか」を SDK 例外に依存せず判定するため
 */
package com.firetrack.billing.provider;

public class PaymentProviderException extends RuntimeException {

  public enum Reason {
    TIMEOUT,
    UNAVAILABLE,
    NOT_FOUND,
    REJECTED
  }

  private final Reason reason;

  public PaymentProviderException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public PaymentProviderException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }

  public boolean isRetryable() {
    return reason == Reason.TIMEOUT || reason == Reason.UNAVAILABLE;
  }
}
