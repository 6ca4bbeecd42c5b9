/*
 * どこで: Notifier 保守ジョブ
 * 何を: 保持期間を過ぎたジョブ実行履歴と処理済みイベント記録を削除する
 * なぜ: 履歴テーブルの肥大化を防ぐため
 */
package com.example.notifier.job.maintenance;

import com.example.notifier.job.JobExecutionContext;
import com.example.notifier.job.JobParameterSchema;
import com.example.notifier.job.JobParameterSpec;
import com.example.notifier.job.JobResult;
import com.example.notifier.job.JobRiskLevel;
import com.example.notifier.job.JobTemplate;
import com.example.notifier.repository.JobExecutionRepository;
import com.example.notifier.repository.ProcessedEventRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JobHistoryCleanupTemplate implements JobTemplate {

  private static final Logger logger = LoggerFactory.getLogger(JobHistoryCleanupTemplate.class);

  public static final String TEMPLATE_TYPE = "job_history_cleanup";
  static final String PARAM_RETENTION_DAYS = "retentionDays";

  private final JobExecutionRepository jobExecutionRepository;
  private final ProcessedEventRepository processedEventRepository;
  private final Clock clock;

  @Override
  public String templateType() {
    return TEMPLATE_TYPE;
  }

  @Override
  public String name() {
    return "Job history cleanup";
  }

  @Override
  public String description() {
    return "Deletes finished job executions and processed event ids older than retentionDays";
  }

  @Override
  public String category() {
    return "maintenance";
  }

  @Override
  public JobRiskLevel riskLevel() {
    return JobRiskLevel.MEDIUM;
  }

  @Override
  public JobParameterSchema parameterSchema() {
    return JobParameterSchema.of(
        JobParameterSpec.integer(PARAM_RETENTION_DAYS, 1, 3650, 30L, "days of history to keep"));
  }

  @Override
  public JobResult execute(JobExecutionContext context, Map<String, Object> parameters) {
    final int retentionDays = JobParameterSchema.intValue(parameters, PARAM_RETENTION_DAYS);
    final Instant threshold = Instant.now(clock).minus(Duration.ofDays(retentionDays));
    final int executions = jobExecutionRepository.deleteFinishedOlderThan(threshold);
    final int events = processedEventRepository.deleteOlderThan(threshold);
    logger.info(
        "job history cleanup finished threshold={} executionsDeleted={} processedEventsDeleted={}",
        threshold,
        executions,
        events);
    return JobResult.success(
        "executionsDeleted=" + executions + " processedEventsDeleted=" + events,
        executions + events,
        executions + events);
  }
}
