package com.firetrack.billing.service;

import com.firetrack.billing.api.BillingRecordNotFoundException;
import com.firetrack.billing.api.response.BillingSummaryResponse;
import com.firetrack.billing.api.response.PlanResponse;
import com.firetrack.billing.api.response.PlansResponse;
import com.firetrack.billing.model.BillingState;
import com.firetrack.billing.model.UserBillingRecord;
import com.firetrack.billing.repository.BillingRecordRepository;
import java.time.Clock;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

// 読み取り専用の参照 API 向け。
@Service
@RequiredArgsConstructor
public class BillingQueryService {

  private final BillingRecordRepository billingRecordRepository;
  private final TierCatalog tierCatalog;
  private final Clock clock;

  public BillingSummaryResponse getSummary(String userId) {
    return billingRecordRepository
        .findByUserId(userId)
        .map(this::toSummary)
        .orElseThrow(() -> new BillingRecordNotFoundException("no billing record for user"));
  }

  public PlansResponse listPlans() {
    return new PlansResponse(
        tierCatalog.definitions().stream()
            .map(
                definition ->
                    new PlanResponse(
                        definition.tier().key(),
                        definition.displayName(),
                        definition.selfServiceCheckout(),
                        definition.limits()))
            .toList());
  }

  BillingSummaryResponse toSummary(UserBillingRecord record) {
    final BillingState state = record.state();
    return new BillingSummaryResponse(
        record.userId(),
        state.tier().key(),
        state.status().name().toLowerCase(Locale.ROOT),
        record.isActive(clock),
        state.externalCustomerId() != null,
        state.currentPeriodStart(),
        state.currentPeriodEnd(),
        state.trialStartedAt(),
        state.trialEndsAt(),
        record.limits(),
        record.version(),
        record.updatedAt());
  }
}
