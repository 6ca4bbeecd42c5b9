package com.example.notifier.api.response;

import com.example.notifier.model.AdminOverrideRecord;
import com.example.notifier.model.NotificationChannel;
import com.example.notifier.model.NotificationFrequency;
import com.example.notifier.model.OverrideTargetType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OverrideResponse(
    OverrideTargetType targetType,
    String username,
    String targetKey,
    boolean disabled,
    LocalTime time,
    NotificationFrequency frequency,
    DayOfWeek dayOfWeek,
    List<String> channels,
    String reason,
    boolean notifyUser,
    String overriddenBy,
    Instant overriddenAt) {

  public static OverrideResponse from(AdminOverrideRecord record) {
    return new OverrideResponse(
        record.target().type(),
        record.target().username(),
        record.target().targetKey(),
        record.disabled(),
        record.overrideTime(),
        record.overrideFrequency(),
        record.overrideDayOfWeek(),
        record.overrideChannels() == null
            ? null
            : record.overrideChannels().stream().map(NotificationChannel::key).sorted().toList(),
        record.reason(),
        record.notifyUser(),
        record.overriddenBy(),
        record.overriddenAt());
  }
}
