/*
 * どこで: Notifier ドメインモデル
 * 何を: ユーザー単位の通知設定全体 (ゾーン/静音時間/トリガー別設定) を表す
 * なぜ: enqueue 判定で必要な情報を 1 回の読み込みで渡すため
 */
package com.example.notifier.model;

import java.time.ZoneId;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

public record NotificationPreferences(
    String username,
    ZoneId timezone,
    QuietHours quietHours,
    Map<NotificationTrigger, TriggerPreference> triggers) {

  public NotificationPreferences {
    triggers =
        triggers == null || triggers.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(triggers));
  }

  /** 行が無いトリガーは empty。暗黙の「無効」とは区別する。 */
  public Optional<TriggerPreference> find(NotificationTrigger trigger) {
    return Optional.ofNullable(triggers.get(trigger));
  }
}
