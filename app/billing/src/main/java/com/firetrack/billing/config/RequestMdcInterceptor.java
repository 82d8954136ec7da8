/*
 * どこで: Billing Web 層
 * 何を: リクエスト単位の相関キーを MDC に載せ、完了時に取り除く
 * なぜ: Stripe からの webhook と社内 API 呼び出しをログ上で区別し、再送を request_id で追えるようにするため
 */
package com.firetrack.billing.config;

import com.firetrack.common.RequestIds;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String REQUEST_ID_HEADER = "X-Request-Id";
  static final String SURFACE_WEBHOOK = "stripe_webhook";
  static final String SURFACE_BILLING = "billing_api";

  private static final String WEBHOOK_PREFIX = "/v1/webhooks/";
  private static final String BILLING_PREFIX = "/v1/billing/";
  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

  private final BillingInternalApiProperties internalApiProperties;

  public RequestMdcInterceptor(BillingInternalApiProperties internalApiProperties) {
    this.internalApiProperties = internalApiProperties;
  }

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final String path = request.getRequestURI();
    final String requestId = RequestIds.orNew(request.getHeader(REQUEST_ID_HEADER));
    response.setHeader(REQUEST_ID_HEADER, requestId);

    final List<String> keys = new ArrayList<>();
    put(keys, "request_id", requestId);
    put(keys, "http_method", request.getMethod());
    put(keys, "http_path", path);
    put(keys, "client_ip", resolveClientIp(request));
    put(keys, "api_surface", surfaceOf(path));
    // webhook は転送ヘッダを信用しないので、利用者 ID は社内 API 側だけで拾う。
    if (path != null && path.startsWith(BILLING_PREFIX)) {
      put(keys, "user_id", request.getHeader(internalApiProperties.userIdHeaderName()));
    }
    request.setAttribute(ATTRIBUTE_KEYS, keys);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    final Object attribute = request.getAttribute(ATTRIBUTE_KEYS);
    if (!(attribute instanceof List<?> rawKeys)) {
      return;
    }
    for (Object rawKey : rawKeys) {
      if (rawKey instanceof String key) {
        MDC.remove(key);
      }
    }
  }

  static String surfaceOf(@Nullable String path) {
    if (path == null) {
      return null;
    }
    if (path.startsWith(WEBHOOK_PREFIX)) {
      return SURFACE_WEBHOOK;
    }
    if (path.startsWith(BILLING_PREFIX)) {
      return SURFACE_BILLING;
    }
    return null;
  }

  private String resolveClientIp(HttpServletRequest request) {
    final String xForwardedFor = request.getHeader("X-Forwarded-For");
    if (xForwardedFor == null || xForwardedFor.isBlank()) {
      return request.getRemoteAddr();
    }
    final int commaIndex = xForwardedFor.indexOf(',');
    return (commaIndex < 0 ? xForwardedFor : xForwardedFor.substring(0, commaIndex)).trim();
  }

  private void put(List<String> keys, String key, @Nullable String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    MDC.put(key, value);
    keys.add(key);
  }
}
