/*
 * どこで: Notifier スケジューラ
 * 何を: ジョブ定義の作成/更新/有効化/無効化/削除と実行履歴の参照を行う
 * なぜ: テンプレート・パラメータ・スケジュールを保存前に検証し、next_run_at を常に再計算するため
 */
package com.example.notifier.scheduler;

import com.example.notifier.job.JobTemplateRegistry;
import com.example.notifier.job.JobValidationException;
import com.example.notifier.model.JobDefinitionRecord;
import com.example.notifier.model.JobExecutionRecord;
import com.example.notifier.model.JobRunStatus;
import com.example.notifier.model.JobSchedule;
import com.example.notifier.repository.JobDefinitionRepository;
import com.example.notifier.repository.JobExecutionRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class JobDefinitionService {

  private static final Logger logger = LoggerFactory.getLogger(JobDefinitionService.class);

  private static final int MAX_NAME_LENGTH = 128;
  private static final int MAX_HISTORY_LIMIT = 200;

  private final JobDefinitionRepository definitionRepository;
  private final JobExecutionRepository executionRepository;
  private final JobTemplateRegistry templateRegistry;
  private final JobScheduleCalculator scheduleCalculator;
  private final Clock clock;

  @Transactional
  public JobDefinitionRecord create(JobDefinitionCommand command) {
    final String name = requireName(command.name());
    if (definitionRepository.findByName(name).isPresent()) {
      throw new JobConflictException("job name already exists: " + name);
    }
    final Map<String, Object> parameters =
        command.parameters() == null ? Map.of() : command.parameters();
    templateRegistry.validateParameters(command.templateType(), parameters);
    scheduleCalculator.validate(command.schedule());
    validateTimeout(command.timeoutSeconds());

    final Instant now = Instant.now(clock);
    final boolean enabled = command.enabled() == null || command.enabled();
    final JobDefinitionRecord record =
        new JobDefinitionRecord(
            UUID.randomUUID(),
            name,
            command.templateType(),
            parameters,
            command.schedule(),
            enabled,
            false,
            null,
            null,
            enabled ? scheduleCalculator.nextRunAt(command.schedule(), null, now) : null,
            JobRunStatus.NEVER_RUN,
            null,
            0,
            command.timeoutSeconds(),
            now,
            now);
    definitionRepository.insert(record);
    logger.info(
        "job definition created jobId={} name={} template={} schedule={}",
        record.id(),
        name,
        record.templateType(),
        record.schedule().describe());
    return record;
  }

  @Transactional
  public JobDefinitionRecord update(UUID jobId, JobDefinitionCommand command) {
    final JobDefinitionRecord current = get(jobId);
    final String name = command.name() == null ? current.name() : requireName(command.name());
    if (!name.equals(current.name()) && definitionRepository.findByName(name).isPresent()) {
      throw new JobConflictException("job name already exists: " + name);
    }
    final String templateType =
        command.templateType() == null ? current.templateType() : command.templateType();
    final Map<String, Object> parameters =
        command.parameters() == null ? current.parameters() : command.parameters();
    final JobSchedule schedule = command.schedule() == null ? current.schedule() : command.schedule();
    final boolean enabled = command.enabled() == null ? current.enabled() : command.enabled();
    final Integer timeoutSeconds =
        command.timeoutSeconds() == null ? current.timeoutSeconds() : command.timeoutSeconds();

    templateRegistry.validateParameters(templateType, parameters);
    scheduleCalculator.validate(schedule);
    validateTimeout(timeoutSeconds);

    final Instant now = Instant.now(clock);
    final JobDefinitionRecord updated =
        new JobDefinitionRecord(
            current.id(),
            name,
            templateType,
            parameters,
            schedule,
            enabled,
            current.running(),
            current.runningSince(),
            current.lastRunAt(),
            enabled ? scheduleCalculator.nextRunAt(schedule, current.lastRunAt(), now) : null,
            current.lastStatus(),
            current.lastError(),
            current.consecutiveFailures(),
            timeoutSeconds,
            current.createdAt(),
            now);
    if (definitionRepository.updateDefinition(updated) == 0) {
      throw new JobNotFoundException(jobId);
    }
    logger.info("job definition updated jobId={} name={}", jobId, name);
    return updated;
  }

  @Transactional
  public JobDefinitionRecord enable(UUID jobId) {
    final JobDefinitionRecord current = get(jobId);
    final Instant now = Instant.now(clock);
    final Instant nextRunAt =
        scheduleCalculator.nextRunAt(current.schedule(), current.lastRunAt(), now);
    definitionRepository.updateEnabled(jobId, true, nextRunAt, now);
    logger.info("job enabled jobId={} name={} nextRunAt={}", jobId, current.name(), nextRunAt);
    return get(jobId);
  }

  /** 実行中の回は止めない。次回以降の tick で選ばれなくなる。 */
  @Transactional
  public JobDefinitionRecord disable(UUID jobId) {
    final JobDefinitionRecord current = get(jobId);
    definitionRepository.updateEnabled(jobId, false, null, Instant.now(clock));
    logger.info("job disabled jobId={} name={}", jobId, current.name());
    return get(jobId);
  }

  @Transactional
  public void delete(UUID jobId) {
    final JobDefinitionRecord current = get(jobId);
    if (current.running()) {
      throw new JobConflictException("job is running: " + current.name());
    }
    executionRepository.deleteByJobId(jobId);
    if (definitionRepository.deleteIfIdle(jobId) == 0) {
      throw new JobConflictException("job is running: " + current.name());
    }
    logger.info("job definition deleted jobId={} name={}", jobId, current.name());
  }

  public JobDefinitionRecord get(UUID jobId) {
    return definitionRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }

  public Optional<JobDefinitionRecord> findByName(String name) {
    return definitionRepository.findByName(name);
  }

  public List<JobDefinitionRecord> list() {
    return definitionRepository.findAll();
  }

  public List<JobExecutionRecord> history(UUID jobId, int limit) {
    if (limit <= 0 || limit > MAX_HISTORY_LIMIT) {
      throw new IllegalArgumentException("limit must be between 1 and " + MAX_HISTORY_LIMIT);
    }
    get(jobId);
    return executionRepository.findByJobId(jobId, limit);
  }

  private String requireName(String name) {
    if (name == null || name.isBlank()) {
      throw new JobValidationException("name is required");
    }
    if (name.length() > MAX_NAME_LENGTH) {
      throw new JobValidationException("name must be at most " + MAX_NAME_LENGTH + " characters");
    }
    return name.trim();
  }

  private void validateTimeout(Integer timeoutSeconds) {
    if (timeoutSeconds != null && timeoutSeconds <= 0) {
      throw new JobValidationException("timeout_seconds must be positive");
    }
  }
}
