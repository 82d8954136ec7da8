/*
 * どこで: Billing ドメインモデル
 * 何を: イベント適用の結果区分を定義する
 * なぜ: メトリクスとログで「適用/変化なし/無視」を区別して追跡するため
 */
package com.firetrack.billing.model;

import java.util.Locale;

public enum ReconcileResult {
  APPLIED,
  UNCHANGED,
  IGNORED,
  STALE,
  UNRESOLVED,
  DUPLICATE;

  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
