package com.firetrack.billing.service;

import java.time.Instant;

/**
 * What triggered a billing record write.
 *
 * @param source origin of the change, for example a webhook kind or {@code trial}
 * @param sourceId provider event id or another correlation id, may be null
 * @param occurredAt provider-side time of the triggering event; null for local changes, which
 *     skip the ordering guard
 * @param ordering how the change takes part in the record's event ordering
 */
public record BillingChange(String source, String sourceId, Instant occurredAt, Ordering ordering) {

  public BillingChange {
    if (ordering == null) {
      ordering = Ordering.ORDERED;
    }
  }

  public BillingChange(String source, String sourceId, Instant occurredAt) {
    this(source, sourceId, occurredAt, Ordering.ORDERED);
  }

  public static BillingChange local(String source) {
    return new BillingChange(source, null, null, Ordering.ORDERED);
  }

  /**
   * The record keeps one ordering mark, the provider time of the newest event that decided its
   * status and tier.
   */
  public enum Ordering {
    /** Dropped when older than the mark; advances the mark. */
    ORDERED(true, true),
    /** Never dropped as stale; advances the mark. Used for cancellation, which is terminal. */
    TERMINAL(false, true),
    /** Never dropped as stale and leaves the mark alone. Used for period refreshes fetched live. */
    UNORDERED(false, false);

    private final boolean guarded;
    private final boolean advancesMark;

    Ordering(boolean guarded, boolean advancesMark) {
      this.guarded = guarded;
      this.advancesMark = advancesMark;
    }

    public boolean guarded() {
      return guarded;
    }

    public boolean advancesMark() {
      return advancesMark;
    }
  }
}
