package com.example.notifier.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.notifier.config.SchedulerProperties;
import com.example.notifier.job.JobExecutionContext;
import com.example.notifier.model.JobDefinitionRecord;
import com.example.notifier.model.JobSchedule;
import com.example.notifier.repository.JobDefinitionRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@ExtendWith(MockitoExtension.class)
class UnifiedSchedulerTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-04T12:00:00Z");
  private static final UUID FIRST = UUID.fromString("6f1e4a52-1b0e-4d7c-8f39-2a5c0e9b7d10");
  private static final UUID SECOND = UUID.fromString("6f1e4a52-1b0e-4d7c-8f39-2a5c0e9b7d11");

  @Mock private JobDefinitionRepository definitionRepository;
  @Mock private JobRunner jobRunner;
  @Mock private ThreadPoolTaskScheduler taskScheduler;
  @Mock private ThreadPoolTaskExecutor jobExecutor;
  @Mock private ScheduledFuture<Object> tickFuture;

  private UnifiedScheduler scheduler;

  @BeforeEach
  void setUp() {
    scheduler =
        new UnifiedScheduler(
            definitionRepository,
            jobRunner,
            new SchedulerProperties(
                true, Duration.ofSeconds(30), 4, 16, Duration.ofMinutes(5), 1000, List.of()),
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC),
            taskScheduler,
            jobExecutor);
  }

  @Test
  void tickDispatchesOnlyJobsWhoseRunningFlagWasAcquired() {
    final JobDefinitionRecord first = definition(FIRST, true);
    final JobDefinitionRecord second = definition(SECOND, true);
    when(definitionRepository.findDue(FIXED_NOW)).thenReturn(List.of(first, second));
    when(definitionRepository.tryMarkRunning(FIRST, FIXED_NOW)).thenReturn(true);
    when(definitionRepository.tryMarkRunning(SECOND, FIXED_NOW)).thenReturn(false);
    when(jobRunner.submit(first, JobExecutionContext.TRIGGERED_BY_SCHEDULER))
        .thenReturn(Optional.of(UUID.randomUUID()));

    scheduler.tick();

    verify(jobRunner, never()).submit(second, JobExecutionContext.TRIGGERED_BY_SCHEDULER);
    final SchedulerStatus status = scheduler.status();
    assertThat(status.lastTickAt()).isEqualTo(FIXED_NOW);
    assertThat(status.lastTickDispatched()).isEqualTo(1);
  }

  @Test
  void tickSurvivesRepositoryFailure() {
    when(definitionRepository.findDue(FIXED_NOW))
        .thenThrow(new DataAccessResourceFailureException("db down"));

    scheduler.tick();

    verifyNoInteractions(jobRunner);
    assertThat(scheduler.status().lastTickAt()).isEqualTo(FIXED_NOW);
  }

  @Test
  void tickContinuesAfterOneDispatchFails() {
    final JobDefinitionRecord first = definition(FIRST, true);
    final JobDefinitionRecord second = definition(SECOND, true);
    when(definitionRepository.findDue(FIXED_NOW)).thenReturn(List.of(first, second));
    when(definitionRepository.tryMarkRunning(FIRST, FIXED_NOW))
        .thenThrow(new DataAccessResourceFailureException("lock timeout"));
    when(definitionRepository.tryMarkRunning(SECOND, FIXED_NOW)).thenReturn(true);
    when(jobRunner.submit(second, JobExecutionContext.TRIGGERED_BY_SCHEDULER))
        .thenReturn(Optional.of(UUID.randomUUID()));

    scheduler.tick();

    assertThat(scheduler.status().lastTickDispatched()).isEqualTo(1);
  }

  @Test
  void runNowStartsEnabledIdleJob() {
    final JobDefinitionRecord definition = definition(FIRST, true);
    final UUID executionId = UUID.randomUUID();
    when(definitionRepository.findById(FIRST)).thenReturn(Optional.of(definition));
    when(definitionRepository.tryMarkRunning(FIRST, FIXED_NOW)).thenReturn(true);
    when(jobRunner.submit(definition, "manual:admin-1")).thenReturn(Optional.of(executionId));

    final RunNowResult result = scheduler.runNow(FIRST, "admin-1");

    assertThat(result).isEqualTo(RunNowResult.started(executionId));
  }

  @Test
  void runNowReturnsBusyWithoutQueueingSecondRun() {
    when(definitionRepository.findById(FIRST)).thenReturn(Optional.of(definition(FIRST, true)));
    when(definitionRepository.tryMarkRunning(FIRST, FIXED_NOW)).thenReturn(false);

    assertThat(scheduler.runNow(FIRST, "admin-1").outcome()).isEqualTo(RunNowOutcome.BUSY);
    verifyNoInteractions(jobRunner);
  }

  @Test
  void runNowReturnsBusyWhenPoolRejects() {
    final JobDefinitionRecord definition = definition(FIRST, true);
    when(definitionRepository.findById(FIRST)).thenReturn(Optional.of(definition));
    when(definitionRepository.tryMarkRunning(FIRST, FIXED_NOW)).thenReturn(true);
    when(jobRunner.submit(any(), anyString())).thenReturn(Optional.empty());

    assertThat(scheduler.runNow(FIRST, "admin-1").outcome()).isEqualTo(RunNowOutcome.BUSY);
  }

  @Test
  void runNowRejectsDisabledAndUnknownJobs() {
    when(definitionRepository.findById(FIRST)).thenReturn(Optional.of(definition(FIRST, false)));
    when(definitionRepository.findById(SECOND)).thenReturn(Optional.empty());

    assertThat(scheduler.runNow(FIRST, "admin-1").outcome()).isEqualTo(RunNowOutcome.DISABLED);
    assertThat(scheduler.runNow(SECOND, "admin-1").outcome()).isEqualTo(RunNowOutcome.NOT_FOUND);
    verify(definitionRepository, never()).tryMarkRunning(any(), any());
  }

  @Test
  void startClearsStaleRunningFlagsOnce() {
    doReturn(tickFuture)
        .when(taskScheduler)
        .scheduleWithFixedDelay(any(Runnable.class), any(Duration.class));

    scheduler.start();
    scheduler.start();

    verify(definitionRepository).clearAllRunning();
    verify(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), any(Duration.class));
    assertThat(scheduler.isRunning()).isTrue();

    scheduler.stop();
    verify(tickFuture).cancel(false);
    assertThat(scheduler.isRunning()).isFalse();
  }

  private static JobDefinitionRecord definition(UUID id, boolean enabled) {
    return new JobDefinitionRecord(
        id,
        "job-" + id,
        "email_notifier",
        Map.of(),
        JobSchedule.interval(60),
        enabled,
        false,
        null,
        null,
        FIXED_NOW,
        null,
        null,
        0,
        null,
        FIXED_NOW,
        FIXED_NOW);
  }
}
