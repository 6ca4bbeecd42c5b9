package com.example.notifier.api.response;

import com.example.notifier.model.NotificationChannel;
import com.example.notifier.model.NotificationFrequency;
import com.example.notifier.model.NotificationPreferences;
import com.example.notifier.model.NotificationTrigger;
import com.example.notifier.model.TriggerPreference;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationPreferencesResponse(
    String username,
    String timezone,
    boolean quietHoursEnabled,
    LocalTime quietHoursStart,
    LocalTime quietHoursEnd,
    List<Trigger> triggers) {

  public static NotificationPreferencesResponse from(NotificationPreferences preferences) {
    return new NotificationPreferencesResponse(
        preferences.username(),
        preferences.timezone().getId(),
        preferences.quietHours().enabled(),
        preferences.quietHours().start(),
        preferences.quietHours().end(),
        preferences.triggers().values().stream().map(Trigger::from).toList());
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Trigger(
      NotificationTrigger trigger,
      List<String> channels,
      NotificationFrequency frequency,
      LocalTime sendTime,
      DayOfWeek dayOfWeek) {

    static Trigger from(TriggerPreference preference) {
      return new Trigger(
          preference.trigger(),
          preference.channels().stream().map(NotificationChannel::key).sorted().toList(),
          preference.frequency(),
          preference.sendTime(),
          preference.dayOfWeek());
    }
  }
}
