package com.firetrack.billing.api;

public class TrialNotAllowedException extends RuntimeException {

  public TrialNotAllowedException(String message) {
    super(message);
  }
}
