/*
 * どこで: Billing 認証
 * 何を: 上流ゲートウェイから転送された呼び出しユーザーを表す
 * なぜ: コントローラが認証済みユーザー ID とメールを型付きで受け取れるようにするため
 */
package com.firetrack.billing.config;

public record BillingPrincipal(String userId, String email) {}
