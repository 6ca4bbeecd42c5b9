/*
 * どこで: Notifier スケジューラ
 * 何を: running を取得済みのジョブ定義をワーカープールで実行し、結果/タイムアウトを記録する
 * なぜ: tick スレッドをブロックせず、完了とタイムアウトのどちらか一方だけが結果を確定させるため
 */
package com.example.notifier.scheduler;

import com.example.notifier.config.SchedulerExecutorConfig;
import com.example.notifier.config.SchedulerProperties;
import com.example.notifier.job.JobExecutionContext;
import com.example.notifier.job.JobResult;
import com.example.notifier.job.JobResultStatus;
import com.example.notifier.job.JobTemplate;
import com.example.notifier.job.JobTemplateRegistry;
import com.example.notifier.job.JobValidationException;
import com.example.notifier.model.JobDefinitionRecord;
import com.example.notifier.model.JobExecutionStatus;
import com.example.notifier.model.JobRunStatus;
import com.example.notifier.repository.JobDefinitionRepository;
import com.example.notifier.repository.JobExecutionRepository;
import com.example.notifier.service.NotifierMetrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

@Component
public class JobRunner {

  private static final Logger logger = LoggerFactory.getLogger(JobRunner.class);

  static final String MDC_JOB_ID = "job_id";
  static final String MDC_JOB_NAME = "job_name";
  static final String MDC_EXECUTION_ID = "execution_id";

  private final JobTemplateRegistry templateRegistry;
  private final JobDefinitionRepository definitionRepository;
  private final JobExecutionRepository executionRepository;
  private final JobScheduleCalculator scheduleCalculator;
  private final NotifierMetrics metrics;
  private final SchedulerProperties properties;
  private final Clock clock;
  private final ThreadPoolTaskExecutor jobExecutor;
  private final ThreadPoolTaskScheduler taskScheduler;

  public JobRunner(
      JobTemplateRegistry templateRegistry,
      JobDefinitionRepository definitionRepository,
      JobExecutionRepository executionRepository,
      JobScheduleCalculator scheduleCalculator,
      NotifierMetrics metrics,
      SchedulerProperties properties,
      Clock clock,
      @Qualifier(SchedulerExecutorConfig.JOB_EXECUTOR) ThreadPoolTaskExecutor jobExecutor,
      @Qualifier(SchedulerExecutorConfig.SCHEDULER_TASK_SCHEDULER)
          ThreadPoolTaskScheduler taskScheduler) {
    this.templateRegistry = templateRegistry;
    this.definitionRepository = definitionRepository;
    this.executionRepository = executionRepository;
    this.scheduleCalculator = scheduleCalculator;
    this.metrics = metrics;
    this.properties = properties;
    this.clock = clock;
    this.jobExecutor = jobExecutor;
    this.taskScheduler = taskScheduler;
  }

  /**
   * running を取得済みの定義をワーカープールへ投入する。
   *
   * @return 投入できた場合は実行 ID。プールが満杯なら running を戻して empty
   */
  public Optional<UUID> submit(JobDefinitionRecord definition, String triggeredBy) {
    final JobExecutionContext context =
        new JobExecutionContext(
            definition.id(), definition.name(), UUID.randomUUID(), triggeredBy, Instant.now(clock));
    final RunState state = new RunState();
    try {
      state.future.set(jobExecutor.submit(() -> execute(definition, context, state)));
    } catch (RejectedExecutionException ex) {
      definitionRepository.releaseRunning(definition.id());
      logger.warn(
          "job run rejected because worker pool is saturated jobId={} name={}",
          definition.id(),
          definition.name());
      return Optional.empty();
    }
    return Optional.of(context.executionId());
  }

  Duration timeoutFor(JobDefinitionRecord definition) {
    final Integer seconds = definition.timeoutSeconds();
    return seconds == null || seconds <= 0 ? properties.defaultTimeout() : Duration.ofSeconds(seconds);
  }

  void execute(JobDefinitionRecord definition, JobExecutionContext context, RunState state) {
    MDC.put(MDC_JOB_ID, definition.id().toString());
    MDC.put(MDC_JOB_NAME, definition.name());
    MDC.put(MDC_EXECUTION_ID, context.executionId().toString());
    try {
      final Duration timeout = timeoutFor(definition);
      state.watchdog.set(
          taskScheduler.schedule(
              () -> onTimeout(definition, context, state, timeout),
              taskScheduler.getClock().instant().plus(timeout)));
      executionRepository.insertStarted(
          context.executionId(),
          definition.id(),
          definition.name(),
          definition.templateType(),
          context.triggeredBy(),
          context.startedAt());
      logger.info(
          "job run started jobId={} name={} template={} triggeredBy={}",
          definition.id(),
          definition.name(),
          definition.templateType(),
          context.triggeredBy());
      complete(definition, context, state, runTemplate(definition, context));
    } catch (RuntimeException ex) {
      logger.error("job run failed jobId={} name={}", definition.id(), definition.name(), ex);
      complete(definition, context, state, JobResult.failed(describe(ex), List.of(describe(ex))));
    } finally {
      final ScheduledFuture<?> watchdog = state.watchdog.get();
      if (watchdog != null) {
        watchdog.cancel(false);
      }
      MDC.remove(MDC_JOB_ID);
      MDC.remove(MDC_JOB_NAME);
      MDC.remove(MDC_EXECUTION_ID);
    }
  }

  private JobResult runTemplate(JobDefinitionRecord definition, JobExecutionContext context) {
    final Map<String, Object> parameters;
    final JobTemplate template;
    try {
      // 保存後にテンプレート側の宣言が変わっている場合はここで弾く
      parameters = templateRegistry.validateParameters(definition.templateType(), definition.parameters());
      template = templateRegistry.resolve(definition.templateType());
    } catch (JobValidationException ex) {
      logger.warn(
          "job parameters rejected at run time jobId={} name={} violations={}",
          definition.id(),
          definition.name(),
          ex.violations());
      return JobResult.failed(ex.getMessage(), ex.violations());
    }
    final JobResult result = template.execute(context, parameters);
    if (result == null) {
      return JobResult.failed("template returned no result", List.of());
    }
    return result;
  }

  void onTimeout(
      JobDefinitionRecord definition, JobExecutionContext context, RunState state, Duration timeout) {
    if (!state.finished.compareAndSet(false, true)) {
      return;
    }
    final Future<?> future = state.future.get();
    if (future != null) {
      future.cancel(true);
    }
    logger.error(
        "job run timed out jobId={} name={} timeout={}", definition.id(), definition.name(), timeout);
    record(definition, context, JobResult.timeout("timed out after " + timeout));
  }

  private void complete(
      JobDefinitionRecord definition, JobExecutionContext context, RunState state, JobResult result) {
    if (!state.finished.compareAndSet(false, true)) {
      // タイムアウト側が既に結果を確定させている
      logger.warn(
          "job result discarded after timeout jobId={} name={} status={}",
          definition.id(),
          definition.name(),
          result.status());
      return;
    }
    record(definition, context, result);
  }

  private void record(JobDefinitionRecord definition, JobExecutionContext context, JobResult result) {
    final Instant finishedAt = Instant.now(clock);
    final boolean success = result.status().isSuccessful();
    final JobRunStatus runStatus = success ? JobRunStatus.SUCCESS : JobRunStatus.FAILURE;
    final String lastError = success ? null : truncateError(result.message());
    try {
      // 実行中に管理 API でスケジュールが変わっていれば、保存済みの最新スケジュールで次回を決める
      final JobDefinitionRecord current =
          definitionRepository.findById(definition.id()).orElse(definition);
      final Instant nextRunAt = nextRunAt(current, context.startedAt(), finishedAt);
      executionRepository.complete(
          context.executionId(),
          toExecutionStatus(result.status()),
          finishedAt,
          truncateError(result.message()),
          result.recordsProcessed(),
          result.recordsAffected(),
          result.errors());
      final int updated =
          definitionRepository.completeRun(
              definition.id(), context.startedAt(), runStatus, nextRunAt, lastError);
      if (updated == 0) {
        logger.warn(
            "job completion skipped because running flag was already cleared jobId={} name={}",
            definition.id(),
            definition.name());
      }
    } catch (DataAccessException ex) {
      logger.error(
          "failed to record job result jobId={} name={}", definition.id(), definition.name(), ex);
      definitionRepository.releaseRunning(definition.id());
    }
    metrics.recordJobRun(
        definition.templateType(),
        result.status().name(),
        Duration.between(context.startedAt(), finishedAt));
    metrics.updateConsecutiveFailures(
        definition.name(), success ? 0 : definition.consecutiveFailures() + 1);
    if (success) {
      logger.info(
          "job run finished jobId={} name={} status={} message={}",
          definition.id(),
          definition.name(),
          result.status(),
          result.message());
    } else {
      logger.warn(
          "job run failed jobId={} name={} status={} message={}",
          definition.id(),
          definition.name(),
          result.status(),
          result.message());
    }
  }

  private Instant nextRunAt(JobDefinitionRecord definition, Instant lastRunAt, Instant now) {
    try {
      return scheduleCalculator.nextRunAt(definition.schedule(), lastRunAt, now);
    } catch (JobValidationException ex) {
      // next_run_at が NULL の定義は tick で拾われない
      logger.error(
          "job schedule is invalid; not rescheduling jobId={} name={} schedule={}",
          definition.id(),
          definition.name(),
          definition.schedule().describe(),
          ex);
      return null;
    }
  }

  private JobExecutionStatus toExecutionStatus(JobResultStatus status) {
    return switch (status) {
      case SUCCESS -> JobExecutionStatus.SUCCESS;
      case PARTIAL -> JobExecutionStatus.PARTIAL;
      case FAILED -> JobExecutionStatus.FAILED;
      case TIMEOUT -> JobExecutionStatus.TIMEOUT;
    };
  }

  private String describe(RuntimeException ex) {
    return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
  }

  private String truncateError(String message) {
    if (message == null) {
      return null;
    }
    final int maxLength = properties.errorMessageMaxLength();
    return message.length() <= maxLength ? message : message.substring(0, maxLength);
  }

  /** 1 回の実行で共有する状態。finished を先に立てた側だけが結果を記録する。 */
  static final class RunState {
    final AtomicBoolean finished = new AtomicBoolean(false);
    final AtomicReference<Future<?>> future = new AtomicReference<>();
    final AtomicReference<ScheduledFuture<?>> watchdog = new AtomicReference<>();
  }
}
