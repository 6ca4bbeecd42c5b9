/*
 * どこで: Notifier ドメインモデル
 * 何を: ユーザーの静音時間帯を表す
 * なぜ: 深夜帯の即時通知を時間帯明けへ繰り延べるため
 */
package com.example.notifier.model;

import java.time.LocalTime;

public record QuietHours(boolean enabled, LocalTime start, LocalTime end) {

  public static final LocalTime DEFAULT_START = LocalTime.of(22, 0);
  public static final LocalTime DEFAULT_END = LocalTime.of(8, 0);

  public static QuietHours defaults() {
    return new QuietHours(true, DEFAULT_START, DEFAULT_END);
  }

  /** start > end の場合は日付を跨ぐ時間帯として扱う。 */
  public boolean contains(LocalTime time) {
    if (!enabled || start == null || end == null || start.equals(end)) {
      return false;
    }
    if (start.isBefore(end)) {
      return !time.isBefore(start) && time.isBefore(end);
    }
    return !time.isBefore(start) || time.isBefore(end);
  }
}
