/*
 * どこで: Billing webhook 受付
 * 何を: 検証済みの本文を WebhookEvent と ProviderSubscription へ解析する
 * なぜ: ハンドラが生 JSON の入れ子構造や API バージョン差を意識せずに済むようにするため
 */
package com.firetrack.billing.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.firetrack.billing.api.InvalidWebhookPayloadException;
import com.firetrack.billing.model.WebhookEvent;
import com.firetrack.billing.model.WebhookEventKind;
import com.firetrack.billing.provider.PaymentProviderClient;
import com.firetrack.billing.provider.ProviderSubscription;
import java.io.IOException;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class WebhookEventParser {

  private final ObjectMapper objectMapper;

  public WebhookEvent parse(byte[] rawBody) {
    final JsonNode root;
    try {
      root = objectMapper.readTree(rawBody);
    } catch (IOException ex) {
      throw new InvalidWebhookPayloadException("webhook payload is not valid JSON", ex);
    }
    if (root == null || !root.isObject()) {
      throw new InvalidWebhookPayloadException("webhook payload must be a JSON object");
    }
    final String eventId = text(root, "id");
    final String type = text(root, "type");
    if (eventId == null || type == null) {
      throw new InvalidWebhookPayloadException("webhook payload requires id and type");
    }
    final JsonNode object = root.path("data").path("object");
    if (!object.isObject()) {
      throw new InvalidWebhookPayloadException("webhook payload requires data.object");
    }
    final WebhookEventKind kind = WebhookEventKind.fromProviderType(type);
    return new WebhookEvent(
        eventId,
        type,
        kind,
        epochSeconds(root.get("created")),
        reference(object.get("customer")),
        subscriptionReference(kind, object),
        object);
  }

  /** Reads a subscription object as carried by customer.subscription.* events. */
  public ProviderSubscription toSubscription(JsonNode object) {
    final String subscriptionId = text(object, "id");
    if (subscriptionId == null) {
      throw new InvalidWebhookPayloadException("subscription object requires id");
    }
    final JsonNode firstItem = object.path("items").path("data").path(0);
    // 新しい API バージョンでは請求期間が item 側にある。
    final Instant periodStart =
        firstNonNull(
            epochSeconds(object.get("current_period_start")),
            epochSeconds(firstItem.get("current_period_start")));
    final Instant periodEnd =
        firstNonNull(
            epochSeconds(object.get("current_period_end")),
            epochSeconds(firstItem.get("current_period_end")));
    return new ProviderSubscription(
        subscriptionId,
        reference(object.get("customer")),
        text(object, "status"),
        text(firstItem.path("price"), "id"),
        periodStart,
        periodEnd,
        epochSeconds(object.get("trial_start")),
        epochSeconds(object.get("trial_end")),
        text(object.path("metadata"), PaymentProviderClient.METADATA_USER_ID));
  }

  private String subscriptionReference(WebhookEventKind kind, JsonNode object) {
    return switch (kind) {
      case SUBSCRIPTION_UPDATED, SUBSCRIPTION_DELETED -> text(object, "id");
      case CHECKOUT_COMPLETED -> reference(object.get("subscription"));
      case INVOICE_PAYMENT_SUCCEEDED, INVOICE_PAYMENT_FAILED ->
          firstNonNull(
              reference(object.get("subscription")),
              reference(object.path("parent").path("subscription_details").get("subscription")));
      case UNKNOWN -> null;
    };
  }

  // 展開済み (オブジェクト) と未展開 (ID 文字列) の両方を受け付ける。
  private static String reference(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return null;
    }
    if (node.isTextual()) {
      return blankToNull(node.asText());
    }
    if (node.isObject()) {
      return text(node, "id");
    }
    return null;
  }

  static String text(JsonNode node, String field) {
    if (node == null) {
      return null;
    }
    final JsonNode value = node.get(field);
    if (value == null || !value.isTextual()) {
      return null;
    }
    return blankToNull(value.asText());
  }

  private static Instant epochSeconds(JsonNode node) {
    if (node == null || !node.canConvertToLong()) {
      return null;
    }
    return Instant.ofEpochSecond(node.asLong());
  }

  private static <T> T firstNonNull(T first, T second) {
    return first != null ? first : second;
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
