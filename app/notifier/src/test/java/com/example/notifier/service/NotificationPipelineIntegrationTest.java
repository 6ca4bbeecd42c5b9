/*
 * どこで: Notifier 統合テスト
 * 何を: ドメインイベント取り込みから enqueue/claim/送信までを Postgres 上で通しで検証する
 * なぜ: 設定行・管理者停止・キュー状態遷移の組み合わせを実際のトランザクション境界で確かめるため
 */
package com.example.notifier.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.common.event.DomainEventPayload;
import com.example.common.event.DomainEventPayload.Participant;
import com.example.notifier.AbstractPostgresContainerTest;
import com.example.notifier.NotifierTables;
import com.example.notifier.event.DispatchReport;
import com.example.notifier.event.DomainEventIngestService;
import com.example.notifier.model.NotificationChannel;
import com.example.notifier.model.NotificationQueueRecord;
import com.example.notifier.model.NotificationStatus;
import com.example.notifier.model.NotificationTrigger;
import com.example.notifier.model.OverrideTarget;
import com.example.notifier.model.QuietHours;
import com.example.notifier.repository.NotificationQueueRepository;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NotificationPipelineIntegrationTest extends AbstractPostgresContainerTest {

  @Autowired private DomainEventIngestService ingestService;
  @Autowired private NotificationPreferenceService preferenceService;
  @Autowired private NotificationDeliveryService deliveryService;
  @Autowired private AdminOverrideService adminOverrideService;
  @Autowired private NotificationQueueRepository queueRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void setUp() {
    NotifierTables.truncateAll(jdbcTemplate);
    ingestService.ingest(
        event(
            "profile_created",
            participant("alice"),
            null,
            Map.of(
                "timezone", "UTC",
                "email", "alice@example.com",
                "pushToken", "push-token-alice")));
    // 実時刻で動くため静音時間帯による繰り延べを外す
    preferenceService.updateSettings("alice", ZoneId.of("UTC"), new QuietHours(false, null, null));
  }

  @Test
  void profileCreationWritesEveryTriggerPreference() {
    assertThat(preferenceService.get("alice").triggers())
        .hasSize(NotificationTrigger.values().length);
    assertThat(preferenceService.countMissingEntries()).isZero();
  }

  @Test
  void backfillRestoresMissingTriggerRow() {
    jdbcTemplate.update(
        "DELETE FROM notification_preferences WHERE username = :username AND trigger_type = :trigger",
        new MapSqlParameterSource()
            .addValue("username", "alice")
            .addValue("trigger", NotificationTrigger.PROFILE_VIEW.name()));
    assertThat(preferenceService.countMissingEntries()).isEqualTo(1);

    final BackfillResult result = preferenceService.backfillMissing(10);

    assertThat(result.rowsInserted()).isEqualTo(1);
    assertThat(result.remainingMissing()).isZero();
    assertThat(preferenceService.get("alice").find(NotificationTrigger.PROFILE_VIEW)).isPresent();
  }

  @Test
  void newMatchIsQueuedPerChannelAndDelivered() {
    final DispatchReport report =
        ingestService.ingest(event("new_match", participant("bob"), participant("alice"), Map.of()));

    assertThat(report.enqueued()).isEqualTo(1);
    final List<NotificationQueueRecord> queued = queueRepository.findByUsername("alice", 10);
    assertThat(queued)
        .extracting(NotificationQueueRecord::channel)
        .containsExactlyInAnyOrder(NotificationChannel.EMAIL, NotificationChannel.PUSH);

    final DeliveryBatchResult email =
        deliveryService.deliverBatch(NotificationChannel.EMAIL, DeliveryOptions.batch(10));
    final DeliveryBatchResult push =
        deliveryService.deliverBatch(NotificationChannel.PUSH, DeliveryOptions.batch(10));

    assertThat(email.sent()).isEqualTo(1);
    assertThat(push.sent()).isEqualTo(1);
    assertThat(queueRepository.findByUsername("alice", 10))
        .extracting(NotificationQueueRecord::status)
        .containsOnly(NotificationStatus.SENT);
  }

  @Test
  void redeliveredEventIsIgnored() {
    final DomainEventPayload favorite =
        event("favorite_added", participant("bob"), participant("alice"), Map.of());

    assertThat(ingestService.ingest(favorite)).isNotNull();
    assertThat(ingestService.ingest(favorite)).isNull();
    assertThat(queueRepository.findByUsername("alice", 10)).hasSize(1);
  }

  @Test
  void disabledSavedSearchSuppressesOnlyThatSearch() {
    adminOverrideService.disable(
        OverrideTarget.savedSearch("alice", "search-1"), "too noisy", false, "admin-1");

    final DispatchReport suppressed =
        ingestService.ingest(
            event(
                "saved_search_match",
                participant("system"),
                participant("alice"),
                Map.of("searchId", "search-1", "matchCount", 3)));
    assertThat(suppressed.enqueued()).isZero();
    assertThat(suppressed.rejected()).isEqualTo(1);
    assertThat(queueRepository.findByUsername("alice", 10)).isEmpty();

    final DispatchReport other =
        ingestService.ingest(
            event(
                "saved_search_match",
                participant("system"),
                participant("alice"),
                Map.of("searchId", "search-2", "matchCount", 1)));
    assertThat(other.enqueued()).isEqualTo(1);
    assertThat(queueRepository.findByUsername("alice", 10))
        .extracting(NotificationQueueRecord::trigger)
        .containsOnly(NotificationTrigger.SAVED_SEARCH_MATCHES);
  }

  @Test
  void reEnablingTriggerRestoresDelivery() {
    final OverrideTarget target = OverrideTarget.trigger("alice", NotificationTrigger.FAVORITED);
    adminOverrideService.disable(target, null, false, "admin-1");
    ingestService.ingest(event("favorite_added", participant("bob"), participant("alice"), Map.of()));
    assertThat(queueRepository.findByUsername("alice", 10)).isEmpty();

    adminOverrideService.enable(target, "admin-1");
    ingestService.ingest(event("favorite_added", participant("carol"), participant("alice"), Map.of()));

    assertThat(queueRepository.findByUsername("alice", 10)).hasSize(1);
    assertThat(adminOverrideService.auditLog(10, 0)).hasSize(2);
  }

  private static DomainEventPayload event(
      String eventType, Participant actor, Participant target, Map<String, Object> context) {
    return new DomainEventPayload(
        UUID.randomUUID().toString(), eventType, null, actor, target, context, null);
  }

  private static Participant participant(String username) {
    return new Participant(username, null, Map.of(), false, false);
  }
}
