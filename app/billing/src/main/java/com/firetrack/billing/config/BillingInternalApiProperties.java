package com.firetrack.billing.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "billing.internal-api")
public record BillingInternalApiProperties(
    String headerName, String token, String userIdHeaderName, String userEmailHeaderName) {

  public BillingInternalApiProperties {
    headerName = headerName == null || headerName.isBlank() ? "X-Internal-Token" : headerName;
    token = token == null ? "" : token;
    userIdHeaderName =
        userIdHeaderName == null || userIdHeaderName.isBlank() ? "X-User-Id" : userIdHeaderName;
    userEmailHeaderName =
        userEmailHeaderName == null || userEmailHeaderName.isBlank()
            ? "X-User-Email"
            : userEmailHeaderName;
  }
}
