package com.example.notifier.api.response;

import com.example.notifier.model.JobDefinitionRecord;
import com.example.notifier.model.JobRunStatus;
import com.example.notifier.model.ScheduleType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobDefinitionResponse(
    UUID id,
    String name,
    String templateType,
    Map<String, Object> parameters,
    ScheduleType scheduleType,
    Long intervalSeconds,
    String cronExpression,
    String timezone,
    String scheduleDescription,
    boolean enabled,
    boolean running,
    Instant lastRunAt,
    Instant nextRunAt,
    JobRunStatus lastStatus,
    String lastError,
    int consecutiveFailures,
    Integer timeoutSeconds,
    Instant createdAt,
    Instant updatedAt) {

  public static JobDefinitionResponse from(JobDefinitionRecord record) {
    return new JobDefinitionResponse(
        record.id(),
        record.name(),
        record.templateType(),
        record.parameters(),
        record.schedule().type(),
        record.schedule().intervalSeconds(),
        record.schedule().cronExpression(),
        record.schedule().timezone(),
        record.schedule().describe(),
        record.enabled(),
        record.running(),
        record.lastRunAt(),
        record.nextRunAt(),
        record.lastStatus(),
        record.lastError(),
        record.consecutiveFailures(),
        record.timeoutSeconds(),
        record.createdAt(),
        record.updatedAt());
  }
}
