package com.firetrack.billing.api;

// 署名は正しいが本文が解釈できない場合。再送しても結果は変わらない。
public class InvalidWebhookPayloadException extends IllegalArgumentException {

  public InvalidWebhookPayloadException(String message) {
    super(message);
  }

  public InvalidWebhookPayloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
