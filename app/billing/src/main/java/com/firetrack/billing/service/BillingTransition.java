package com.firetrack.billing.service;

import com.firetrack.billing.model.BillingState;
import com.firetrack.billing.model.ReconcileResult;
import com.firetrack.billing.model.UserBillingRecord;
import java.util.Objects;

/** Computes the next state from the freshly read record; re-invoked on every CAS retry. */
@FunctionalInterface
public interface BillingTransition {

  Decision decide(UserBillingRecord current);

  record Decision(ReconcileResult result, BillingState next, String reason) {

    public static Decision moveTo(BillingState next) {
      return new Decision(ReconcileResult.APPLIED, Objects.requireNonNull(next, "next"), null);
    }

    public static Decision ignore(String reason) {
      return new Decision(ReconcileResult.IGNORED, null, reason);
    }

    public boolean isIgnored() {
      return next == null;
    }
  }
}
