/*
 * どこで: Notifier スケジューラ
 * 何を: 一定間隔で期限到来したジョブ定義を評価し、CAS で running を取った定義だけを実行する
 * なぜ: 全バックグラウンド処理を永続化された定義から 1 つのループで駆動するため
 */
package com.example.notifier.scheduler;

import com.example.notifier.config.SchedulerExecutorConfig;
import com.example.notifier.config.SchedulerProperties;
import com.example.notifier.job.JobExecutionContext;
import com.example.notifier.model.JobDefinitionRecord;
import com.example.notifier.repository.JobDefinitionRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

@Component
public class UnifiedScheduler {

  private static final Logger logger = LoggerFactory.getLogger(UnifiedScheduler.class);

  private final JobDefinitionRepository definitionRepository;
  private final JobRunner jobRunner;
  private final SchedulerProperties properties;
  private final Clock clock;
  private final ThreadPoolTaskScheduler taskScheduler;
  private final ThreadPoolTaskExecutor jobExecutor;

  private ScheduledFuture<?> tickHandle;
  private volatile Instant lastTickAt;
  private volatile int lastTickDispatched;

  public UnifiedScheduler(
      JobDefinitionRepository definitionRepository,
      JobRunner jobRunner,
      SchedulerProperties properties,
      Clock clock,
      @Qualifier(SchedulerExecutorConfig.SCHEDULER_TASK_SCHEDULER)
          ThreadPoolTaskScheduler taskScheduler,
      @Qualifier(SchedulerExecutorConfig.JOB_EXECUTOR) ThreadPoolTaskExecutor jobExecutor) {
    this.definitionRepository = definitionRepository;
    this.jobRunner = jobRunner;
    this.properties = properties;
    this.clock = clock;
    this.taskScheduler = taskScheduler;
    this.jobExecutor = jobExecutor;
  }

  public synchronized void start() {
    if (tickHandle != null) {
      logger.warn("scheduler start ignored because it is already running");
      return;
    }
    // 単一プロセス前提: 前回プロセスのクラッシュで残った running を解除する
    final int cleared = definitionRepository.clearAllRunning();
    if (cleared > 0) {
      logger.warn("cleared stale running flags count={}", cleared);
    }
    tickHandle = taskScheduler.scheduleWithFixedDelay(this::tick, properties.tickInterval());
    logger.info("scheduler started tickInterval={}", properties.tickInterval());
  }

  /** tick を止める。実行中のジョブとプールはそのまま残す。 */
  public synchronized void stop() {
    if (tickHandle == null) {
      return;
    }
    tickHandle.cancel(false);
    tickHandle = null;
    logger.info("scheduler stopped");
  }

  public synchronized boolean isRunning() {
    return tickHandle != null;
  }

  /** 例外を外へ投げない。次の tick は通常どおり実行される。 */
  public void tick() {
    final Instant now = Instant.now(clock);
    int dispatched = 0;
    try {
      final List<JobDefinitionRecord> due = definitionRepository.findDue(now);
      for (JobDefinitionRecord definition : due) {
        if (dispatch(definition, now)) {
          dispatched++;
        }
      }
    } catch (RuntimeException ex) {
      logger.error("scheduler tick failed", ex);
    } finally {
      lastTickAt = now;
      lastTickDispatched = dispatched;
    }
  }

  private boolean dispatch(JobDefinitionRecord definition, Instant now) {
    try {
      if (!definitionRepository.tryMarkRunning(definition.id(), now)) {
        // 別の tick か runNow が先に running を取った
        logger.debug("job skipped because it is already running jobId={}", definition.id());
        return false;
      }
      return jobRunner.submit(definition, JobExecutionContext.TRIGGERED_BY_SCHEDULER).isPresent();
    } catch (RuntimeException ex) {
      logger.error(
          "failed to dispatch job jobId={} name={}", definition.id(), definition.name(), ex);
      return false;
    }
  }

  /** next_run_at を無視して即時実行する。実行中なら BUSY を返し、2 回目の実行は積まない。 */
  public RunNowResult runNow(UUID jobId, String actor) {
    final Optional<JobDefinitionRecord> found = definitionRepository.findById(jobId);
    if (found.isEmpty()) {
      return RunNowResult.of(RunNowOutcome.NOT_FOUND);
    }
    final JobDefinitionRecord definition = found.get();
    if (!definition.enabled()) {
      return RunNowResult.of(RunNowOutcome.DISABLED);
    }
    if (!definitionRepository.tryMarkRunning(jobId, Instant.now(clock))) {
      return RunNowResult.of(RunNowOutcome.BUSY);
    }
    final Optional<UUID> executionId =
        jobRunner.submit(definition, JobExecutionContext.triggeredByManual(actor));
    logger.info(
        "job run requested manually jobId={} name={} actor={} accepted={}",
        jobId,
        definition.name(),
        actor,
        executionId.isPresent());
    return executionId.map(RunNowResult::started).orElseGet(() -> RunNowResult.of(RunNowOutcome.BUSY));
  }

  public SchedulerStatus status() {
    return new SchedulerStatus(
        isRunning(),
        properties.tickInterval(),
        lastTickAt,
        lastTickDispatched,
        jobExecutor.getActiveCount(),
        jobExecutor.getQueueSize(),
        properties.poolSize());
  }
}
