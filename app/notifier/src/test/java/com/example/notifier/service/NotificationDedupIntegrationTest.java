/*
 * どこで: Notifier 統合テスト
 * 何を: 同一内容の enqueue が逐次でも並行でも 1 回分の行しか作らないことを検証する
 * なぜ: advisory lock と EXISTS 判定の組み合わせを実際の Postgres で確かめるため
 */
package com.example.notifier.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.common.event.DomainEventPayload;
import com.example.common.event.DomainEventPayload.Participant;
import com.example.notifier.AbstractPostgresContainerTest;
import com.example.notifier.NotifierTables;
import com.example.notifier.event.DomainEventIngestService;
import com.example.notifier.model.NotificationChannel;
import com.example.notifier.model.NotificationPriority;
import com.example.notifier.model.NotificationQueueRecord;
import com.example.notifier.model.NotificationTrigger;
import com.example.notifier.model.QuietHours;
import com.example.notifier.repository.NotificationQueueRepository;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NotificationDedupIntegrationTest extends AbstractPostgresContainerTest {

  @Autowired private NotificationService notificationService;
  @Autowired private DomainEventIngestService ingestService;
  @Autowired private NotificationPreferenceService preferenceService;
  @Autowired private NotificationQueueRepository queueRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void setUp() {
    NotifierTables.truncateAll(jdbcTemplate);
    ingestService.ingest(
        new DomainEventPayload(
            UUID.randomUUID().toString(),
            "profile_created",
            null,
            new Participant("alice", null, Map.of(), false, false),
            null,
            Map.of("timezone", "UTC", "email", "alice@example.com", "pushToken", "push-alice"),
            null));
    preferenceService.updateSettings("alice", ZoneId.of("UTC"), new QuietHours(false, null, null));
  }

  @Test
  void sequentialIdenticalEnqueueIsDuplicate() {
    final EnqueueResult first = notificationService.enqueue(newMatch());
    final EnqueueResult second = notificationService.enqueue(newMatch());

    assertThat(first.enqueued()).isTrue();
    assertThat(second.enqueued()).isFalse();
    assertThat(second.reason()).isEqualTo(RejectionReason.DUPLICATE);
    assertThat(queueRepository.findByUsername("alice", 10))
        .extracting(NotificationQueueRecord::channel)
        .containsExactlyInAnyOrder(NotificationChannel.EMAIL, NotificationChannel.PUSH);
  }

  @Test
  void concurrentIdenticalEnqueueCreatesOneEntryPerChannel() throws Exception {
    final int workers = 2;
    final ExecutorService executor = Executors.newFixedThreadPool(workers);
    final CountDownLatch start = new CountDownLatch(1);
    try {
      final List<Future<EnqueueResult>> futures = new ArrayList<>();
      for (int i = 0; i < workers; i++) {
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  return notificationService.enqueue(newMatch());
                }));
      }
      start.countDown();
      final List<EnqueueResult> results = new ArrayList<>();
      for (Future<EnqueueResult> future : futures) {
        results.add(future.get(30, TimeUnit.SECONDS));
      }

      assertThat(results).filteredOn(EnqueueResult::enqueued).hasSize(1);
      assertThat(results)
          .filteredOn(result -> !result.enqueued())
          .extracting(EnqueueResult::reason)
          .containsExactly(RejectionReason.DUPLICATE);
    } finally {
      executor.shutdownNow();
    }
    assertThat(queueRepository.findByUsername("alice", 10))
        .extracting(NotificationQueueRecord::channel)
        .containsExactlyInAnyOrder(NotificationChannel.EMAIL, NotificationChannel.PUSH);
  }

  private static NotificationRequest newMatch() {
    return NotificationRequest.of(
        "alice",
        NotificationTrigger.NEW_MATCH,
        Map.of("match", Map.of("username", "bob"), "eventType", "new_match"),
        NotificationPriority.MEDIUM);
  }
}
