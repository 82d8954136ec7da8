/*
 * どこで: BillingRecordRepository の結合テスト
 * 何を: version 条件付き更新・顧客の初回紐付け・顧客 ID の一意性を Postgres で検証する
 * なぜ: 並行更新の直列化と webhook からのユーザー解決が DB 制約に依存しているため
 */
package com.firetrack.billing.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.firetrack.billing.AbstractPostgresContainerTest;
import com.firetrack.billing.model.BillingState;
import com.firetrack.billing.model.LimitBundle;
import com.firetrack.billing.model.SubscriptionStatus;
import com.firetrack.billing.model.SubscriptionTier;
import com.firetrack.billing.model.UserBillingRecord;
import com.firetrack.billing.provider.PaymentProviderClient;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

@SpringBootTest
@ActiveProfiles("test")
class BillingRecordRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant NOW = Instant.parse("2026-04-01T00:00:00Z");

  @Autowired private BillingRecordRepository repository;

  @MockitoBean private PaymentProviderClient paymentProviderClient;

  private String userId;

  @BeforeEach
  void setUp() {
    userId = "repo-" + UUID.randomUUID();
  }

  @Test
  void insertIfAbsentCreatesOnceWithProjectedLimits() {
    assertThat(repository.insertIfAbsent(userId, BillingState.initial(), NOW)).isTrue();
    assertThat(repository.insertIfAbsent(userId, BillingState.initial(), NOW)).isFalse();

    final UserBillingRecord record = repository.findByUserId(userId).orElseThrow();
    assertThat(record.version()).isZero();
    assertThat(record.tier()).isEqualTo(SubscriptionTier.BASIC);
    assertThat(record.limits().maxExtinguishers()).isEqualTo(100);
    assertThat(record.createdAt()).isEqualTo(NOW);
  }

  @Test
  void compareAndSetRequiresMatchingVersion() {
    repository.insertIfAbsent(userId, BillingState.initial(), NOW);
    final BillingState enterprise =
        BillingState.initial()
            .withTier(SubscriptionTier.ENTERPRISE)
            .withStatus(SubscriptionStatus.ACTIVE)
            .withPeriod(NOW, NOW.plus(Duration.ofDays(30)));

    final UserBillingRecord written =
        repository.compareAndSet(userId, enterprise, 0, NOW.plusSeconds(1)).orElseThrow();

    assertThat(written.version()).isEqualTo(1);
    assertThat(written.state()).isEqualTo(enterprise);
    assertThat(written.limits().maxExtinguishers()).isEqualTo(LimitBundle.UNLIMITED);
    assertThat(written.updatedAt()).isEqualTo(NOW.plusSeconds(1));
    assertThat(repository.compareAndSet(userId, BillingState.initial(), 0, NOW.plusSeconds(2)))
        .isEmpty();
    assertThat(repository.findByUserId(userId).orElseThrow().tier())
        .isEqualTo(SubscriptionTier.ENTERPRISE);
  }

  @Test
  void linkCustomerKeepsFirstCustomer() {
    repository.insertIfAbsent(userId, BillingState.initial(), NOW);
    final String first = "cus_" + UUID.randomUUID();

    assertThat(repository.linkCustomerIfAbsent(userId, first, NOW)).contains(first);
    assertThat(repository.linkCustomerIfAbsent(userId, "cus_" + UUID.randomUUID(), NOW))
        .contains(first);
    assertThat(repository.findByExternalCustomerId(first).map(UserBillingRecord::userId))
        .contains(userId);
    assertThat(repository.linkCustomerIfAbsent("missing-" + userId, first, NOW)).isEmpty();
  }

  @Test
  void customerCannotBelongToTwoUsers() {
    final String customerId = "cus_" + UUID.randomUUID();
    repository.insertIfAbsent(
        userId, BillingState.initial().withExternalCustomerId(customerId), NOW);

    assertThatThrownBy(
            () ->
                repository.insertIfAbsent(
                    "other-" + userId,
                    BillingState.initial().withExternalCustomerId(customerId),
                    NOW))
        .isInstanceOf(DuplicateKeyException.class);
  }

  @Test
  void findsOnlyUnpaidTrialsPastTheirEnd() {
    final Instant ended = Instant.parse("2000-01-02T00:00:00Z");
    final BillingState trial =
        BillingState.initial()
            .withStatus(SubscriptionStatus.TRIALING)
            .withTrial(ended.minus(Duration.ofDays(30)), ended);
    repository.insertIfAbsent(userId, trial, NOW);
    repository.insertIfAbsent(
        "paid-" + userId,
        trial.withExternalSubscriptionId("sub_" + UUID.randomUUID()),
        NOW);

    assertThat(repository.findExpiredTrialUserIds(ended, 1000))
        .contains(userId)
        .doesNotContain("paid-" + userId);
    assertThat(repository.findExpiredTrialUserIds(ended.minusSeconds(1), 1000))
        .doesNotContain(userId);
  }
}
