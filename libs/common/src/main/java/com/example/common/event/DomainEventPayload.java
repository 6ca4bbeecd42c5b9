/*
 * どこで: common のイベント payload 定義
 * 何を: プロフィール/メッセージ等のドメインイベントを共通レコードとして提供する
 * なぜ: 発行側サービスと notifier で同一の JSON 形状を共有するため
 */
package com.example.common.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DomainEventPayload(
    String eventId,
    String eventType,
    String occurredAt,
    Participant actor,
    Participant target,
    Map<String, Object> context,
    String traceId) {

  public DomainEventPayload {
    // JSON 由来の値は null を含み得るため Map.copyOf は使わない
    context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Participant(
      String username,
      String displayName,
      Map<String, Object> publicProfile,
      boolean hideFavorites,
      boolean hideProfileViews) {

    public Participant {
      publicProfile =
          publicProfile == null
              ? Map.of()
              : Collections.unmodifiableMap(new LinkedHashMap<>(publicProfile));
    }
  }
}
