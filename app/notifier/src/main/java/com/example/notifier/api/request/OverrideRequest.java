package com.example.notifier.api.request;

import com.example.notifier.model.NotificationChannel;
import com.example.notifier.model.NotificationFrequency;
import com.example.notifier.service.OverrideFields;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/** channels は "email"/"sms"/"push"。空配列は全チャネル停止。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OverrideRequest(
    LocalTime time,
    NotificationFrequency frequency,
    DayOfWeek dayOfWeek,
    List<String> channels,
    String reason) {

  public OverrideFields toFields() {
    return new OverrideFields(time, frequency, dayOfWeek, channelSet(channels));
  }

  static Set<NotificationChannel> channelSet(List<String> keys) {
    if (keys == null) {
      return null;
    }
    final Set<NotificationChannel> channels = EnumSet.noneOf(NotificationChannel.class);
    for (String key : keys) {
      channels.add(NotificationChannel.fromKey(key));
    }
    return channels;
  }
}
