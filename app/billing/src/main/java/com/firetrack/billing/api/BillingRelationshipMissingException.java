package com.firetrack.billing.api;

public class BillingRelationshipMissingException extends RuntimeException {

  public BillingRelationshipMissingException(String message) {
    super(message);
  }
}
