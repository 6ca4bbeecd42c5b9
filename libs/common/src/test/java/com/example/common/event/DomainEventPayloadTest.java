/*
 * どこで: common のイベント payload テスト
 * 何を: snake_case JSON との対応と null を含む context の扱いを検証する
 * なぜ: 発行側と notifier の間でフィールド名がずれると通知が黙って欠落するため
 */
package com.example.common.event;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DomainEventPayloadTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void readsSnakeCaseFields() throws Exception {
    final String json =
        """
        {
          "event_id": "5b0f4c1e-1c1f-4f53-9a52-0f3c3e0b9a11",
          "event_type": "favorite_added",
          "occurred_at": "2026-03-04T12:00:00Z",
          "actor": {"username": "bob", "display_name": "Bob", "hide_favorites": true},
          "target": {"username": "alice"},
          "context": {"note": null, "count": 2},
          "trace_id": "trace-1"
        }
        """;

    final DomainEventPayload payload = objectMapper.readValue(json, DomainEventPayload.class);

    assertThat(payload.eventType()).isEqualTo("favorite_added");
    assertThat(payload.actor().displayName()).isEqualTo("Bob");
    assertThat(payload.actor().hideFavorites()).isTrue();
    assertThat(payload.target().hideProfileViews()).isFalse();
    assertThat(payload.target().publicProfile()).isEmpty();
    assertThat(payload.context()).containsEntry("count", 2).containsKey("note");
    assertThat(payload.traceId()).isEqualTo("trace-1");
  }

  @Test
  void missingContextBecomesEmptyMap() {
    final DomainEventPayload payload =
        new DomainEventPayload("id", "new_match", null, null, null, null, null);

    assertThat(payload.context()).isEmpty();
  }

  @Test
  void contextIsCopied() {
    final Map<String, Object> context = new HashMap<>();
    context.put("searchId", "s-1");
    final DomainEventPayload payload =
        new DomainEventPayload("id", "saved_search_match", null, null, null, context, null);

    context.put("searchId", "s-2");

    assertThat(payload.context()).containsEntry("searchId", "s-1");
  }

  @Test
  void writesSnakeCaseFields() {
    final JsonNode node =
        objectMapper.valueToTree(
            new DomainEventPayload(
                "id",
                "profile_viewed",
                null,
                new DomainEventPayload.Participant("bob", "Bob", null, false, true),
                null,
                Map.of(),
                "trace-2"));

    assertThat(node.get("event_type").asText()).isEqualTo("profile_viewed");
    assertThat(node.get("trace_id").asText()).isEqualTo("trace-2");
    assertThat(node.get("actor").get("hide_profile_views").asBoolean()).isTrue();
  }
}
