/*
 * どこで: Billing サービス層
 * 何を: 内部ユーザーと決済プロバイダ顧客の対応付けを解決/作成する
 * なぜ: 顧客を重複作成せず、webhook の顧客 ID から必ず元のユーザーへ辿れるようにするため
 */
package com.firetrack.billing.service;

import com.firetrack.billing.model.BillingState;
import com.firetrack.billing.model.UserBillingRecord;
import com.firetrack.billing.provider.PaymentProviderClient;
import com.firetrack.billing.repository.BillingRecordRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CustomerResolver {

  private static final Logger logger = LoggerFactory.getLogger(CustomerResolver.class);
  private static final String CUSTOMER_IDEMPOTENCY_PREFIX = "billing-customer-";

  private final BillingRecordRepository billingRecordRepository;
  private final PaymentProviderClient paymentProviderClient;
  private final Clock clock;

  /**
   * Returns the user's provider customer, creating and linking one on first use.
   *
   * <p>The provider call runs before anything is persisted and carries an idempotency key derived
   * from the user id, so a retry after a failed link lands on the same customer.
   */
  public String findOrCreateCustomer(String userId, String email) {
    final Optional<String> existing =
        billingRecordRepository.findByUserId(userId).map(UserBillingRecord::externalCustomerId);
    if (existing.isPresent()) {
      return existing.get();
    }
    final String created =
        paymentProviderClient.createCustomer(
            userId, email, CUSTOMER_IDEMPOTENCY_PREFIX + userId);
    final Instant now = Instant.now(clock);
    billingRecordRepository.insertIfAbsent(userId, BillingState.initial(), now);
    final String linked =
        billingRecordRepository
            .linkCustomerIfAbsent(userId, created, now)
            .orElseThrow(() -> new IllegalStateException("billing record vanished for " + userId));
    if (!linked.equals(created)) {
      // 並行リクエストが先に別の顧客を紐付けた。後勝ちにはせず既存を使う。
      logger.warn(
          "customer link lost race, keeping existing userId={} kept={} orphaned={}",
          userId,
          linked,
          created);
    } else {
      logger.info("provider customer linked userId={} customerId={}", userId, created);
    }
    return linked;
  }

  /** The user that already holds {@code externalCustomerId} in the local index, if any. */
  public Optional<String> findLinkedUserId(String externalCustomerId) {
    if (externalCustomerId == null || externalCustomerId.isBlank()) {
      return Optional.empty();
    }
    return billingRecordRepository
        .findByExternalCustomerId(externalCustomerId)
        .map(UserBillingRecord::userId);
  }

  /**
   * Maps a provider customer back to the user id: local index first, then the user id tag on
   * the provider customer. Empty when neither knows the customer.
   */
  public Optional<String> resolveUserId(String externalCustomerId) {
    if (externalCustomerId == null || externalCustomerId.isBlank()) {
      return Optional.empty();
    }
    final Optional<String> local =
        billingRecordRepository
            .findByExternalCustomerId(externalCustomerId)
            .map(UserBillingRecord::userId);
    if (local.isPresent()) {
      return local;
    }
    final Optional<String> tagged = paymentProviderClient.findCustomerUserId(externalCustomerId);
    if (tagged.isEmpty()) {
      logger.warn(
          "provider customer could not be mapped to a user customerId={}", externalCustomerId);
    }
    return tagged;
  }
}
