/*
 * どこで: Notifier ドメインモデル
 * 何を: admin_overrides の 1 行を表す
 * なぜ: disabled の短絡と各フィールドの置換を enqueue で参照するため
 */
package com.example.notifier.model;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public record AdminOverrideRecord(
    OverrideTarget target,
    boolean disabled,
    LocalTime overrideTime,
    NotificationFrequency overrideFrequency,
    DayOfWeek overrideDayOfWeek,
    Set<NotificationChannel> overrideChannels,
    String reason,
    boolean notifyUser,
    String overriddenBy,
    Instant overriddenAt) {

  public AdminOverrideRecord {
    // null は「チャネルは上書きしない」、空集合は「全チャネル停止」を意味する
    overrideChannels =
        overrideChannels == null
            ? null
            : overrideChannels.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(overrideChannels));
  }
}
