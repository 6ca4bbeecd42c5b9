/*
 * どこで: Notifier イベント振り分け
 * 何を: 通知文面に差し込む templateData (match/recipient/event/eventType) を組み立てる
 * なぜ: 全ハンドラで同じキー構造を使い、描画側のプレースホルダと揃えるため
 */
package com.example.notifier.event;

import com.example.common.event.DomainEventPayload.Participant;
import java.util.LinkedHashMap;
import java.util.Map;

public final class TemplateDataBuilder {

  static final String KEY_MATCH = "match";
  static final String KEY_RECIPIENT = "recipient";
  static final String KEY_EVENT = "event";
  static final String KEY_EVENT_TYPE = "eventType";

  private TemplateDataBuilder() {}

  public static Map<String, Object> build(
      String eventType, Participant match, Participant recipient, Map<String, Object> context) {
    final Map<String, Object> data = new LinkedHashMap<>();
    if (match != null) {
      data.put(KEY_MATCH, participantFields(match));
    }
    if (recipient != null) {
      data.put(KEY_RECIPIENT, participantFields(recipient));
    }
    data.put(KEY_EVENT, context == null ? Map.of() : new LinkedHashMap<>(context));
    data.put(KEY_EVENT_TYPE, eventType);
    return data;
  }

  /** 公開プロフィール項目に username と displayName を加える。displayName が無ければ username。 */
  static Map<String, Object> participantFields(Participant participant) {
    final Map<String, Object> fields = new LinkedHashMap<>(participant.publicProfile());
    fields.put("username", participant.username());
    fields.put(
        "displayName",
        participant.displayName() == null || participant.displayName().isBlank()
            ? participant.username()
            : participant.displayName());
    return fields;
  }
}
