package com.firetrack.billing.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class SubscriptionStatusTest {

  @ParameterizedTest
  @CsvSource({
    "trialing, TRIALING",
    "active, ACTIVE",
    "past_due, PAST_DUE",
    "unpaid, PAST_DUE",
    "paused, PAST_DUE",
    "canceled, CANCELED",
    "incomplete_expired, CANCELED",
    "incomplete, INCOMPLETE",
    "ACTIVE, ACTIVE"
  })
  void mapsProviderStatuses(String providerStatus, SubscriptionStatus expected) {
    assertThat(SubscriptionStatus.fromProviderStatus(providerStatus)).contains(expected);
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "expired", "something_new"})
  void unknownProviderStatusIsEmpty(String providerStatus) {
    assertThat(SubscriptionStatus.fromProviderStatus(providerStatus)).isEmpty();
  }
}
