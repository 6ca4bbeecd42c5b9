package com.example.notifier.api.request;

import com.example.notifier.model.NotificationFrequency;
import com.example.notifier.model.NotificationTrigger;
import com.example.notifier.model.TriggerPreference;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TriggerPreferenceRequest(
    @NotNull(message = "channels is required") List<String> channels,
    NotificationFrequency frequency,
    LocalTime sendTime,
    DayOfWeek dayOfWeek) {

  public TriggerPreference toPreference(NotificationTrigger trigger) {
    return new TriggerPreference(
        trigger, OverrideRequest.channelSet(channels), frequency, sendTime, dayOfWeek);
  }
}
