package com.firetrack.billing.api;

public class BillingRecordNotFoundException extends RuntimeException {

  public BillingRecordNotFoundException(String message) {
    super(message);
  }
}
