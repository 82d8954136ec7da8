/*
 * どこで: Billing ドメインモデル
 * 何を: プランごとの機能上限をひとまとめに表す
 * なぜ: billing_records.limits (jsonb) と API 応答で同じ形を共有するため
 */
package com.firetrack.billing.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LimitBundle(
    int maxExtinguishers,
    boolean photosEnabled,
    int maxPhotosPerUnit,
    boolean gpsEnabled,
    boolean advancedExportEnabled,
    boolean inspectionHistoryEnabled,
    boolean prioritySupport) {

  // 消火器台数の上限なしを -1 で表す。
  public static final int UNLIMITED = -1;

  public LimitBundle {
    if (maxExtinguishers < UNLIMITED) {
      throw new IllegalArgumentException("max_extinguishers must be -1 (unlimited) or >= 0");
    }
    if (maxPhotosPerUnit < 0) {
      throw new IllegalArgumentException("max_photos_per_unit must be >= 0");
    }
  }

  @JsonIgnore
  public boolean isUnlimitedExtinguishers() {
    return maxExtinguishers == UNLIMITED;
  }
}
