package com.example.notifier.api.response;

import com.example.notifier.scheduler.SchedulerStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SchedulerStatusResponse(
    boolean running,
    long tickIntervalMillis,
    Instant lastTickAt,
    int lastTickDispatched,
    int activeWorkers,
    int queuedRuns,
    int poolSize) {

  public static SchedulerStatusResponse from(SchedulerStatus status) {
    return new SchedulerStatusResponse(
        status.running(),
        status.tickInterval().toMillis(),
        status.lastTickAt(),
        status.lastTickDispatched(),
        status.activeWorkers(),
        status.queuedRuns(),
        status.poolSize());
  }
}
