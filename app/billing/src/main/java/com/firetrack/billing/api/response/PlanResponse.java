package com.firetrack.billing.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.firetrack.billing.model.LimitBundle;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PlanResponse(
    String planId, String displayName, boolean selfServiceCheckout, LimitBundle limits) {}
