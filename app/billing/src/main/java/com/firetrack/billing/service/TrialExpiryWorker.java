package com.firetrack.billing.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "billing.trial.expiry-enabled", havingValue = "true")
public class TrialExpiryWorker {

  private final TrialExpiryService trialExpiryService;

  @Scheduled(fixedDelayString = "${billing.trial.expiry-interval}")
  public void run() {
    trialExpiryService.expireDueTrials();
  }
}
