/*
 * どこで: Notifier 保守ジョブのユニットテスト
 * 何を: 履歴削除の閾値計算/取り残し回収/設定バックフィルの結果集計を検証する
 * なぜ: 保守ジョブの件数がそのまま実行履歴に残り、運用判断の材料になるため
 */
package com.example.notifier.job.maintenance;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.notifier.job.JobExecutionContext;
import com.example.notifier.job.JobResult;
import com.example.notifier.job.JobResultStatus;
import com.example.notifier.repository.JobExecutionRepository;
import com.example.notifier.repository.ProcessedEventRepository;
import com.example.notifier.service.BackfillResult;
import com.example.notifier.service.NotificationDeliveryService;
import com.example.notifier.service.NotificationPreferenceService;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MaintenanceTemplatesTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-04T03:30:00Z");

  @Mock private JobExecutionRepository jobExecutionRepository;
  @Mock private ProcessedEventRepository processedEventRepository;
  @Mock private NotificationDeliveryService deliveryService;
  @Mock private NotificationPreferenceService preferenceService;

  @Test
  void historyCleanupDeletesOlderThanRetention() {
    final Instant threshold = Instant.parse("2026-02-02T03:30:00Z");
    when(jobExecutionRepository.deleteFinishedOlderThan(threshold)).thenReturn(12);
    when(processedEventRepository.deleteOlderThan(threshold)).thenReturn(30);
    final JobHistoryCleanupTemplate template =
        new JobHistoryCleanupTemplate(
            jobExecutionRepository,
            processedEventRepository,
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));

    final JobResult result = template.execute(context(), Map.of("retentionDays", 30));

    assertThat(result.status()).isEqualTo(JobResultStatus.SUCCESS);
    assertThat(result.recordsAffected()).isEqualTo(42);
    assertThat(result.message()).isEqualTo("executionsDeleted=12 processedEventsDeleted=30");
  }

  @Test
  void historyCleanupRejectsZeroRetention() {
    final JobHistoryCleanupTemplate template =
        new JobHistoryCleanupTemplate(
            jobExecutionRepository,
            processedEventRepository,
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));

    assertThat(template.parameterSchema().validate(Map.of("retentionDays", 0))).isNotEmpty();
  }

  @Test
  void reconcilerReportsRequeuedCount() {
    when(deliveryService.requeueStaleProcessing()).thenReturn(4);

    final JobResult result =
        new NotificationReconcilerTemplate(deliveryService).execute(context(), Map.of());

    assertThat(result.recordsAffected()).isEqualTo(4);
    assertThat(result.message()).isEqualTo("requeued=4");
  }

  @Test
  void backfillPassesBatchSizeAndSummarises() {
    when(preferenceService.backfillMissing(500)).thenReturn(new BackfillResult(3, 7, 0));

    final JobResult result =
        new PreferenceBackfillTemplate(preferenceService).execute(context(), Map.of("batchSize", 500));

    verify(preferenceService).backfillMissing(500);
    assertThat(result.recordsProcessed()).isEqualTo(3);
    assertThat(result.recordsAffected()).isEqualTo(7);
    assertThat(result.message()).isEqualTo("users=3 inserted=7 remainingMissing=0");
  }

  private static JobExecutionContext context() {
    return new JobExecutionContext(
        UUID.randomUUID(),
        "maintenance",
        UUID.randomUUID(),
        JobExecutionContext.TRIGGERED_BY_SCHEDULER,
        FIXED_NOW);
  }
}
