package com.example.notifier.api.request;

import com.example.notifier.model.JobSchedule;
import com.example.notifier.model.ScheduleType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobScheduleRequest(
    @NotNull(message = "schedule.type is required") ScheduleType type,
    Long intervalSeconds,
    String cronExpression,
    String timezone) {

  public JobSchedule toSchedule() {
    return new JobSchedule(type, intervalSeconds, cronExpression, timezone);
  }
}
