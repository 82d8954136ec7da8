package com.firetrack.billing.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.firetrack.billing.config.BillingRetentionProperties;
import com.firetrack.billing.repository.ProcessedWebhookEventRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class BillingRetentionServiceTest {

  @Test
  void deletesEventsOlderThanTtl() {
    final Instant now = Instant.parse("2026-04-01T00:00:00Z");
    final ProcessedWebhookEventRepository repository = mock(ProcessedWebhookEventRepository.class);
    when(repository.deleteOlderThan(Instant.parse("2026-03-25T00:00:00Z"))).thenReturn(3);
    final BillingRetentionService service =
        new BillingRetentionService(
            repository,
            new BillingRetentionProperties(true, null, Duration.ofDays(7)),
            Clock.fixed(now, ZoneOffset.UTC));

    assertThat(service.cleanup()).isEqualTo(3);
    verify(repository).deleteOlderThan(Instant.parse("2026-03-25T00:00:00Z"));
  }
}
