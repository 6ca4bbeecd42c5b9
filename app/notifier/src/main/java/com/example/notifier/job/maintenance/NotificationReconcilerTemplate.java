/*
 * どこで: Notifier 保守ジョブ
 * 何を: processing-timeout を過ぎた PROCESSING 通知を PENDING に戻す
 * なぜ: ワーカーの中断やタイムアウトで取り残された通知を再配信対象にするため
 */
package com.example.notifier.job.maintenance;

import com.example.notifier.job.JobExecutionContext;
import com.example.notifier.job.JobParameterSchema;
import com.example.notifier.job.JobResult;
import com.example.notifier.job.JobTemplate;
import com.example.notifier.service.NotificationDeliveryService;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class NotificationReconcilerTemplate implements JobTemplate {

  public static final String TEMPLATE_TYPE = "notification_reconciler";

  private final NotificationDeliveryService deliveryService;

  @Override
  public String templateType() {
    return TEMPLATE_TYPE;
  }

  @Override
  public String name() {
    return "Notification reconciler";
  }

  @Override
  public String description() {
    return "Returns notifications stuck in PROCESSING to PENDING";
  }

  @Override
  public String category() {
    return "maintenance";
  }

  @Override
  public JobParameterSchema parameterSchema() {
    return JobParameterSchema.empty();
  }

  @Override
  public JobResult execute(JobExecutionContext context, Map<String, Object> parameters) {
    final int requeued = deliveryService.requeueStaleProcessing();
    return JobResult.success("requeued=" + requeued, requeued, requeued);
  }
}
