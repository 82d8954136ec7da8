/*
 * どこで: Billing 設定
 * 何を: Stripe SDK のクライアントを組み立てる
 * なぜ: 接続/読み取りタイムアウトと再試行回数を設定から一元的に与えるため
 */
package com.firetrack.billing.config;

import com.stripe.StripeClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StripeClientConfig {

  @Bean
  StripeClient stripeClient(BillingStripeProperties properties) {
    return StripeClient.builder()
        .setApiKey(properties.apiKey())
        .setConnectTimeout(Math.toIntExact(properties.connectTimeout().toMillis()))
        .setReadTimeout(Math.toIntExact(properties.readTimeout().toMillis()))
        .setMaxNetworkRetries(properties.maxNetworkRetries())
        .build();
  }
}
