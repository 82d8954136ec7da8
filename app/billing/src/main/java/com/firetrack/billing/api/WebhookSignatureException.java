package com.firetrack.billing.api;

public class WebhookSignatureException extends RuntimeException {

  public WebhookSignatureException(String message) {
    super(message);
  }

  public WebhookSignatureException(String message, Throwable cause) {
    super(message, cause);
  }
}
