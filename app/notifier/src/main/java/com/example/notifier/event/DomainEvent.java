package com.example.notifier.event;

import com.example.common.event.DomainEventPayload.Participant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** 配信判定の入力となるドメイン操作。actor/target は操作によって null になり得る。 */
public record DomainEvent(
    String eventType, Participant actor, Participant target, Map<String, Object> context) {

  public DomainEvent {
    context =
        context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  public String contextString(String key) {
    final Object value = context.get(key);
    return value == null ? null : value.toString();
  }

  /** actor と target が同じユーザーの操作。 */
  public boolean isSelfAction() {
    return actor != null
        && target != null
        && actor.username() != null
        && actor.username().equals(target.username());
  }
}
