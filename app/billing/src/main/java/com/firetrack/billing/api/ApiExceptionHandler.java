/*
 * どこで: Billing API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: 一時障害 (再送で回復) と恒久的な失敗をステータスで区別し、webhook 送信元の再送判定に使わせるため
 */
package com.firetrack.billing.api;

import com.firetrack.billing.provider.PaymentProviderException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(WebhookSignatureException.class)
  public ResponseEntity<ApiErrorResponse> handleWebhookSignature(WebhookSignatureException ex) {
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
        .body(new ApiErrorResponse(ApiErrorCode.WEBHOOK_SIGNATURE_INVALID, ex.getMessage()));
  }

  @ExceptionHandler(UnauthenticatedException.class)
  public ResponseEntity<ApiErrorResponse> handleUnauthenticated(UnauthenticatedException ex) {
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
        .body(new ApiErrorResponse(ApiErrorCode.UNAUTHENTICATED, ex.getMessage()));
  }

  @ExceptionHandler(BillingRecordNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleRecordNotFound(BillingRecordNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(ApiErrorCode.BILLING_RECORD_NOT_FOUND, ex.getMessage()));
  }

  @ExceptionHandler(BillingRelationshipMissingException.class)
  public ResponseEntity<ApiErrorResponse> handleRelationshipMissing(
      BillingRelationshipMissingException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse(ApiErrorCode.BILLING_RELATIONSHIP_MISSING, ex.getMessage()));
  }

  @ExceptionHandler(TrialNotAllowedException.class)
  public ResponseEntity<ApiErrorResponse> handleTrialNotAllowed(TrialNotAllowedException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse(ApiErrorCode.TRIAL_NOT_ALLOWED, ex.getMessage()));
  }

  @ExceptionHandler(PaymentProviderException.class)
  public ResponseEntity<ApiErrorResponse> handlePaymentProvider(PaymentProviderException ex) {
    final ApiErrorCode code =
        switch (ex.reason()) {
          case TIMEOUT -> ApiErrorCode.PROVIDER_TIMEOUT;
          case UNAVAILABLE -> ApiErrorCode.PROVIDER_UNAVAILABLE;
          case NOT_FOUND, REJECTED -> ApiErrorCode.PROVIDER_REJECTED;
        };
    final HttpStatus status =
        switch (ex.reason()) {
          case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
          case UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
          case NOT_FOUND, REJECTED -> HttpStatus.BAD_GATEWAY;
        };
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, ex.getMessage()));
  }

  @ExceptionHandler({
    BillingRecordConflictException.class,
    TransientDataAccessException.class,
    DataAccessResourceFailureException.class
  })
  public ResponseEntity<ApiErrorResponse> handleTransient(RuntimeException ex) {
    logger.warn("temporarily unavailable: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(
            new ApiErrorResponse(
                ApiErrorCode.TEMPORARILY_UNAVAILABLE, "temporarily unavailable, retry later"));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
    return badRequest(ex.getHeaderName() + " is required");
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request body is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
      ConstraintViolationException ex) {
    final String message =
        ex.getConstraintViolations().stream()
            .map(ConstraintViolation::getMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // JSONパーサの内部文言は露出しない。
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleUnexpected(RuntimeException ex) {
    logger.error("unexpected error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse(ApiErrorCode.INTERNAL, "internal error"));
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.BAD_REQUEST, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
