/*
 * どこで: Notifier 保守ジョブ
 * 何を: 後から追加されたトリガーの既定通知設定を既存ユーザーへ補う
 * なぜ: 全ユーザー x 全トリガーの行が揃っている前提を維持するため
 */
package com.example.notifier.job.maintenance;

import com.example.notifier.job.JobExecutionContext;
import com.example.notifier.job.JobParameterSchema;
import com.example.notifier.job.JobParameterSpec;
import com.example.notifier.job.JobResult;
import com.example.notifier.job.JobTemplate;
import com.example.notifier.service.BackfillResult;
import com.example.notifier.service.NotificationPreferenceService;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PreferenceBackfillTemplate implements JobTemplate {

  public static final String TEMPLATE_TYPE = "preference_backfill";
  static final String PARAM_BATCH_SIZE = "batchSize";

  private final NotificationPreferenceService preferenceService;

  @Override
  public String templateType() {
    return TEMPLATE_TYPE;
  }

  @Override
  public String name() {
    return "Preference backfill";
  }

  @Override
  public String description() {
    return "Inserts default preference rows for triggers a user has no row for";
  }

  @Override
  public String category() {
    return "maintenance";
  }

  @Override
  public JobParameterSchema parameterSchema() {
    return JobParameterSchema.of(
        JobParameterSpec.integer(PARAM_BATCH_SIZE, 1, 10_000, 500L, "users processed per run"));
  }

  @Override
  public JobResult execute(JobExecutionContext context, Map<String, Object> parameters) {
    final BackfillResult result =
        preferenceService.backfillMissing(JobParameterSchema.intValue(parameters, PARAM_BATCH_SIZE));
    return JobResult.success(
        "users=" + result.usersScanned()
            + " inserted=" + result.rowsInserted()
            + " remainingMissing=" + result.remainingMissing(),
        result.usersScanned(),
        result.rowsInserted());
  }
}
