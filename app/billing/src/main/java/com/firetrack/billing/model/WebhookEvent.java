/*
 * どこで: Billing ドメインモデル
 * 何を: 署名検証後に解析した webhook イベントを表す
 * なぜ: ハンドラが生 JSON の構造に依存せず参照 ID と発生時刻を扱えるようにするため
 */
package com.firetrack.billing.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * A verified provider event.
 *
 * @param eventId provider event id, used for deduplication
 * @param type raw provider type string
 * @param kind recognised kind, {@link WebhookEventKind#UNKNOWN} otherwise
 * @param createdAt provider-side creation time, may be null
 * @param externalCustomerId customer reference carried by the event object, may be null
 * @param externalSubscriptionId subscription reference carried by the event object, may be null
 * @param object the {@code data.object} node of the event
 */
public record WebhookEvent(
    String eventId,
    String type,
    WebhookEventKind kind,
    Instant createdAt,
    String externalCustomerId,
    String externalSubscriptionId,
    JsonNode object) {}
