package com.example.notifier.job.delivery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.example.notifier.job.JobExecutionContext;
import com.example.notifier.job.JobResult;
import com.example.notifier.job.JobResultStatus;
import com.example.notifier.model.NotificationChannel;
import com.example.notifier.service.DeliveryBatchResult;
import com.example.notifier.service.DeliveryOptions;
import com.example.notifier.service.NotificationDeliveryService;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PushNotifierTemplateTest {

  @Mock private NotificationDeliveryService deliveryService;

  @Test
  void cleanBatchIsSuccess() {
    when(deliveryService.deliverBatch(NotificationChannel.PUSH, DeliveryOptions.batch(100)))
        .thenReturn(new DeliveryBatchResult(3, 3, 0, 0, 0, List.of()));

    final JobResult result =
        new PushNotifierTemplate(deliveryService)
            .execute(context(), Map.of("batchSize", 100, "testMode", false));

    assertThat(result.status()).isEqualTo(JobResultStatus.SUCCESS);
    assertThat(result.recordsProcessed()).isEqualTo(3);
    assertThat(result.message()).isEqualTo("push claimed=3 sent=3 retried=0 failed=0 lockLost=0");
  }

  @Test
  void retriesMakeTheRunPartial() {
    when(deliveryService.deliverBatch(NotificationChannel.PUSH, DeliveryOptions.batch(10)))
        .thenReturn(new DeliveryBatchResult(2, 1, 1, 0, 0, List.of("id-1: provider down")));

    final JobResult result =
        new PushNotifierTemplate(deliveryService).execute(context(), Map.of("batchSize", 10));

    assertThat(result.status()).isEqualTo(JobResultStatus.PARTIAL);
    assertThat(result.recordsAffected()).isEqualTo(1);
    assertThat(result.errors()).containsExactly("id-1: provider down");
  }

  @Test
  void testModeRedirectsToTestRecipient() {
    final DeliveryOptions options = new DeliveryOptions(5, true, "device-qa");
    when(deliveryService.deliverBatch(NotificationChannel.PUSH, options))
        .thenReturn(new DeliveryBatchResult(0, 0, 0, 0, 0, List.of()));

    final JobResult result =
        new PushNotifierTemplate(deliveryService)
            .execute(
                context(), Map.of("batchSize", 5, "testMode", true, "testRecipient", "device-qa"));

    assertThat(result.status()).isEqualTo(JobResultStatus.SUCCESS);
  }

  private static JobExecutionContext context() {
    return new JobExecutionContext(
        UUID.randomUUID(),
        "push-notifier",
        UUID.randomUUID(),
        JobExecutionContext.TRIGGERED_BY_SCHEDULER,
        Instant.parse("2026-03-04T12:00:00Z"));
  }
}
