package com.example.notifier.api.response;

import com.example.notifier.model.JobExecutionRecord;
import com.example.notifier.model.JobExecutionStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobExecutionResponse(
    UUID executionId,
    UUID jobId,
    String jobName,
    String templateType,
    String triggeredBy,
    JobExecutionStatus status,
    Instant startedAt,
    Instant finishedAt,
    Long durationMillis,
    String message,
    int recordsProcessed,
    int recordsAffected,
    List<String> errors) {

  public static JobExecutionResponse from(JobExecutionRecord record) {
    return new JobExecutionResponse(
        record.executionId(),
        record.jobId(),
        record.jobName(),
        record.templateType(),
        record.triggeredBy(),
        record.status(),
        record.startedAt(),
        record.finishedAt(),
        record.durationMillis(),
        record.message(),
        record.recordsProcessed(),
        record.recordsAffected(),
        record.errors());
  }
}
