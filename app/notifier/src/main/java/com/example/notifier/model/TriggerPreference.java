/*
 * どこで: Notifier ドメインモデル
 * 何を: 1 トリガー分のユーザー設定 (チャネル/頻度/送信時刻/曜日) を表す
 * なぜ: notification_preferences の 1 行を型で扱うため
 */
package com.example.notifier.model;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public record TriggerPreference(
    NotificationTrigger trigger,
    Set<NotificationChannel> channels,
    NotificationFrequency frequency,
    LocalTime sendTime,
    DayOfWeek dayOfWeek) {

  public TriggerPreference {
    channels =
        channels == null || channels.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(channels));
    frequency = frequency == null ? NotificationFrequency.INSTANT : frequency;
  }
}
