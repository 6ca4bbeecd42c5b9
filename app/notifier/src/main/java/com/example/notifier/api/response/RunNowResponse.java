package com.example.notifier.api.response;

import com.example.notifier.scheduler.RunNowOutcome;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RunNowResponse(UUID jobId, RunNowOutcome outcome, UUID executionId) {}
