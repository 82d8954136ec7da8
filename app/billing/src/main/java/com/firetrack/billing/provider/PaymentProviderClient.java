/*
 * どこで: Billing 決済プロバイダ連携
 * 何を: 顧客作成・セッション作成・サブスクリプション参照の呼び出し口を定義する
 * なぜ: ドメイン側を特定 SDK から切り離し、テストで差し替えられるようにするため
 */
package com.firetrack.billing.provider;

import java.util.Optional;

public interface PaymentProviderClient {

  /** Metadata key carrying the owning user id on customers, sessions and subscriptions. */
  String METADATA_USER_ID = "userId";

  /**
   * Creates a provider customer tagged with the user id. Repeating the call with the same
   * idempotency key returns the customer created by the first call.
   *
   * @return the external customer id
   */
  String createCustomer(String userId, String email, String idempotencyKey);

  /**
   * Looks up the user id tagged on a provider customer. Empty when the customer does not exist,
   * was deleted, or carries no tag.
   */
  Optional<String> findCustomerUserId(String externalCustomerId);

  ProviderSubscription retrieveSubscription(String externalSubscriptionId);

  ProviderCheckoutSession createCheckoutSession(CheckoutSessionCommand command);

  /** @return the hosted portal URL */
  String createPortalSession(String externalCustomerId, String returnUrl, String idempotencyKey);
}
