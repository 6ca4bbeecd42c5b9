package com.example.notifier.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.notifier.job.JobParameterValidationException;
import com.example.notifier.job.JobScheduleValidationException;
import com.example.notifier.job.JobTemplateRegistry;
import com.example.notifier.job.JobValidationException;
import com.example.notifier.job.UnknownTemplateTypeException;
import com.example.notifier.job.delivery.EmailNotifierTemplate;
import com.example.notifier.model.JobDefinitionRecord;
import com.example.notifier.model.JobRunStatus;
import com.example.notifier.model.JobSchedule;
import com.example.notifier.repository.JobDefinitionRepository;
import com.example.notifier.repository.JobExecutionRepository;
import com.example.notifier.service.NotificationDeliveryService;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class JobDefinitionServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-04T12:00:00Z");
  private static final UUID JOB_ID = UUID.fromString("2d0b7f4e-8a61-4c39-b8d5-77e0c1a4f902");

  @Mock private JobDefinitionRepository definitionRepository;
  @Mock private JobExecutionRepository executionRepository;
  @Mock private NotificationDeliveryService deliveryService;

  private JobDefinitionService service;

  @BeforeEach
  void setUp() {
    service =
        new JobDefinitionService(
            definitionRepository,
            executionRepository,
            new JobTemplateRegistry(List.of(new EmailNotifierTemplate(deliveryService))),
            new JobScheduleCalculator(ZoneId.of("UTC")),
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void createStoresDefinitionWithFirstRunOneIntervalFromNow() {
    when(definitionRepository.findByName("email-notifier")).thenReturn(Optional.empty());

    final JobDefinitionRecord created =
        service.create(
            new JobDefinitionCommand(
                "email-notifier",
                "email_notifier",
                Map.of("batchSize", 25),
                JobSchedule.interval(60),
                null,
                300));

    assertThat(created.enabled()).isTrue();
    assertThat(created.running()).isFalse();
    assertThat(created.lastStatus()).isEqualTo(JobRunStatus.NEVER_RUN);
    assertThat(created.nextRunAt()).isEqualTo(FIXED_NOW.plusSeconds(60));
    verify(definitionRepository).insert(created);
  }

  @Test
  void createDisabledJobHasNoNextRun() {
    when(definitionRepository.findByName("weekly")).thenReturn(Optional.empty());

    final JobDefinitionRecord created =
        service.create(
            new JobDefinitionCommand(
                "weekly", "email_notifier", null, JobSchedule.cron("0 9 * * MON", "UTC"), false, null));

    assertThat(created.enabled()).isFalse();
    assertThat(created.nextRunAt()).isNull();
  }

  @Test
  void createRejectsDuplicateName() {
    when(definitionRepository.findByName("email-notifier")).thenReturn(Optional.of(existing(false)));

    assertThatThrownBy(
            () ->
                service.create(
                    new JobDefinitionCommand(
                        "email-notifier", "email_notifier", Map.of(), JobSchedule.interval(60), true, null)))
        .isInstanceOf(JobConflictException.class);
    verify(definitionRepository, never()).insert(any());
  }

  @Test
  void createRejectsUnknownTemplateBadParametersAndBadSchedule() {
    when(definitionRepository.findByName(any())).thenReturn(Optional.empty());

    assertThatThrownBy(
            () ->
                service.create(
                    new JobDefinitionCommand("a", "fax_notifier", Map.of(), JobSchedule.interval(60), true, null)))
        .isInstanceOf(UnknownTemplateTypeException.class);
    assertThatThrownBy(
            () ->
                service.create(
                    new JobDefinitionCommand(
                        "b", "email_notifier", Map.of("batchSize", 9999), JobSchedule.interval(60), true, null)))
        .isInstanceOf(JobParameterValidationException.class);
    assertThatThrownBy(
            () ->
                service.create(
                    new JobDefinitionCommand(
                        "c", "email_notifier", Map.of(), JobSchedule.cron("every monday", null), true, null)))
        .isInstanceOf(JobScheduleValidationException.class);
    assertThatThrownBy(
            () ->
                service.create(
                    new JobDefinitionCommand("d", "email_notifier", Map.of(), JobSchedule.interval(60), true, 0)))
        .isInstanceOf(JobValidationException.class)
        .hasMessageContaining("timeout_seconds");
    verify(definitionRepository, never()).insert(any());
  }

  @Test
  void updateKeepsUnspecifiedFieldsAndRecomputesNextRun() {
    when(definitionRepository.findById(JOB_ID)).thenReturn(Optional.of(existing(false)));
    when(definitionRepository.updateDefinition(any())).thenReturn(1);

    final JobDefinitionRecord updated =
        service.update(
            JOB_ID, new JobDefinitionCommand(null, null, null, JobSchedule.interval(600), null, null));

    assertThat(updated.name()).isEqualTo("email-notifier");
    assertThat(updated.parameters()).containsEntry("batchSize", 50);
    // lastRunAt + 600s が未来なのでそれを使う
    assertThat(updated.nextRunAt()).isEqualTo(FIXED_NOW.minusSeconds(60).plusSeconds(600));
    assertThat(updated.updatedAt()).isEqualTo(FIXED_NOW);
  }

  @Test
  void deleteRefusesRunningJob() {
    when(definitionRepository.findById(JOB_ID)).thenReturn(Optional.of(existing(true)));

    assertThatThrownBy(() -> service.delete(JOB_ID)).isInstanceOf(JobConflictException.class);
    verify(executionRepository, never()).deleteByJobId(any());
  }

  @Test
  void deleteRemovesHistoryBeforeDefinition() {
    when(definitionRepository.findById(JOB_ID)).thenReturn(Optional.of(existing(false)));
    when(definitionRepository.deleteIfIdle(JOB_ID)).thenReturn(1);

    service.delete(JOB_ID);

    final InOrder order = inOrder(executionRepository, definitionRepository);
    order.verify(executionRepository).deleteByJobId(JOB_ID);
    order.verify(definitionRepository).deleteIfIdle(JOB_ID);
  }

  @Test
  void enableComputesNextRunAndDisableClearsIt() {
    when(definitionRepository.findById(JOB_ID)).thenReturn(Optional.of(existing(false)));

    service.enable(JOB_ID);
    service.disable(JOB_ID);

    final ArgumentCaptor<Instant> nextRun = ArgumentCaptor.forClass(Instant.class);
    verify(definitionRepository).updateEnabled(eq(JOB_ID), eq(true), nextRun.capture(), any());
    assertThat(nextRun.getValue()).isEqualTo(FIXED_NOW.minusSeconds(60).plusSeconds(120));
    verify(definitionRepository).updateEnabled(JOB_ID, false, null, FIXED_NOW);
  }

  @Test
  void missingJobIsNotFound() {
    when(definitionRepository.findById(JOB_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.history(JOB_ID, 10)).isInstanceOf(JobNotFoundException.class);
    assertThatThrownBy(() -> service.history(JOB_ID, 0)).isInstanceOf(IllegalArgumentException.class);
  }

  private static JobDefinitionRecord existing(boolean running) {
    return new JobDefinitionRecord(
        JOB_ID,
        "email-notifier",
        "email_notifier",
        Map.of("batchSize", 50),
        JobSchedule.interval(120),
        true,
        running,
        running ? FIXED_NOW : null,
        FIXED_NOW.minusSeconds(60),
        FIXED_NOW.plusSeconds(60),
        JobRunStatus.SUCCESS,
        null,
        0,
        null,
        FIXED_NOW.minusSeconds(86400),
        FIXED_NOW.minusSeconds(86400));
  }
}
