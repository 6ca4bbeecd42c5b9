package com.example.notifier.scheduler;

import java.time.Duration;
import java.time.Instant;

public record SchedulerStatus(
    boolean running,
    Duration tickInterval,
    Instant lastTickAt,
    int lastTickDispatched,
    int activeWorkers,
    int queuedRuns,
    int poolSize) {}
