/*
 * どこで: Billing API
 * 何を: CAS 更新が規定回数競合し続けたことを表す
 * なぜ: 一時的な失敗として 503 を返し、webhook の再送や呼び出し元の再試行に委ねるため
 */
package com.firetrack.billing.api;

public class BillingRecordConflictException extends RuntimeException {

  public BillingRecordConflictException(String message) {
    super(message);
  }
}
