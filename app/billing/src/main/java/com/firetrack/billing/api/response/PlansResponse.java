package com.firetrack.billing.api.response;

import java.util.List;

public record PlansResponse(List<PlanResponse> plans) {}
