/*
 * どこで: Notifier 配信ワーカー
 * 何を: チャネル別配信ジョブの共通処理 (パラメータ宣言と結果変換) を提供する
 * なぜ: email/sms/push の差をチャネルと宛先形式だけに閉じ込めるため
 */
package com.example.notifier.job.delivery;

import com.example.notifier.job.JobExecutionContext;
import com.example.notifier.job.JobParameterSchema;
import com.example.notifier.job.JobParameterSpec;
import com.example.notifier.job.JobParameterType;
import com.example.notifier.job.JobResult;
import com.example.notifier.job.JobTemplate;
import com.example.notifier.model.NotificationChannel;
import com.example.notifier.service.DeliveryBatchResult;
import com.example.notifier.service.DeliveryOptions;
import com.example.notifier.service.NotificationDeliveryService;
import java.util.List;
import java.util.Map;

public abstract class AbstractChannelNotifierTemplate implements JobTemplate {

  static final String PARAM_BATCH_SIZE = "batchSize";
  static final String PARAM_TEST_MODE = "testMode";
  static final String PARAM_TEST_RECIPIENT = "testRecipient";
  static final long DEFAULT_BATCH_SIZE = 50L;
  static final long MAX_BATCH_SIZE = 500L;

  private final NotificationDeliveryService deliveryService;

  protected AbstractChannelNotifierTemplate(NotificationDeliveryService deliveryService) {
    this.deliveryService = deliveryService;
  }

  protected abstract NotificationChannel channel();

  /** testRecipient の型。email は EMAIL、それ以外は STRING。 */
  protected abstract JobParameterType recipientType();

  @Override
  public String category() {
    return "notifications";
  }

  @Override
  public JobParameterSchema parameterSchema() {
    return JobParameterSchema.of(
        JobParameterSpec.integer(
            PARAM_BATCH_SIZE, 1, MAX_BATCH_SIZE, DEFAULT_BATCH_SIZE, "entries claimed per run"),
        JobParameterSpec.bool(
            PARAM_TEST_MODE, false, "send every claimed entry to testRecipient instead"),
        new JobParameterSpec(
            PARAM_TEST_RECIPIENT,
            recipientType(),
            false,
            null,
            null,
            null,
            null,
            "recipient used while testMode is on"));
  }

  @Override
  public List<String> validateParameterCombination(Map<String, Object> parameters) {
    if (JobParameterSchema.booleanValue(parameters, PARAM_TEST_MODE)) {
      final String recipient = JobParameterSchema.stringValue(parameters, PARAM_TEST_RECIPIENT);
      if (recipient == null || recipient.isBlank()) {
        return List.of(PARAM_TEST_RECIPIENT + " is required when testMode is true");
      }
    }
    return List.of();
  }

  @Override
  public JobResult execute(JobExecutionContext context, Map<String, Object> parameters) {
    final DeliveryOptions options =
        new DeliveryOptions(
            JobParameterSchema.intValue(parameters, PARAM_BATCH_SIZE),
            JobParameterSchema.booleanValue(parameters, PARAM_TEST_MODE),
            JobParameterSchema.stringValue(parameters, PARAM_TEST_RECIPIENT));
    final DeliveryBatchResult result = deliveryService.deliverBatch(channel(), options);
    final String message =
        String.format(
            "%s claimed=%d sent=%d retried=%d failed=%d lockLost=%d",
            channel().key(),
            result.claimed(),
            result.sent(),
            result.retried(),
            result.failed(),
            result.lockLost());
    if (result.hasFailures()) {
      return JobResult.partial(message, result.claimed(), result.sent(), result.errors());
    }
    return JobResult.success(message, result.claimed(), result.sent());
  }
}
