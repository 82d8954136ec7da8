package com.firetrack.billing.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PortalSessionRequest(
    @NotBlank(message = "return_url is required")
        @Pattern(regexp = "https?://\\S+", message = "return_url must be an absolute http(s) URL")
        String returnUrl) {}
