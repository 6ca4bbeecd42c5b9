package com.example.notifier.service;

import com.example.notifier.model.NotificationChannel;
import com.example.notifier.model.NotificationFrequency;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Set;

/** null の項目は「変更しない」。channels の空集合は全チャネル停止を意味する。 */
public record OverrideFields(
    LocalTime time,
    NotificationFrequency frequency,
    DayOfWeek dayOfWeek,
    Set<NotificationChannel> channels) {

  public boolean isEmpty() {
    return time == null && frequency == null && dayOfWeek == null && channels == null;
  }
}
