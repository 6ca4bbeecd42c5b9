/*
 * どこで: Notifier テスト
 * 何を: Postgres での claim の排他/優先順/所有者ガード/取り残し回収を検証する
 * なぜ: FOR UPDATE SKIP LOCKED と条件付き UPDATE の組み合わせは実 DB でしか確かめられないため
 */
package com.example.notifier.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.notifier.AbstractPostgresContainerTest;
import com.example.notifier.NotifierTables;
import com.example.notifier.model.NotificationChannel;
import com.example.notifier.model.NotificationPriority;
import com.example.notifier.model.NotificationQueueRecord;
import com.example.notifier.model.NotificationStatus;
import com.example.notifier.model.NotificationTrigger;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
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
class NotificationQueueRepositoryTest extends AbstractPostgresContainerTest {

  @Autowired private NotificationQueueRepository queueRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    NotifierTables.truncateAll(jdbcTemplate);
  }

  @Test
  void concurrentWorkersNeverClaimTheSameRow() throws Exception {
    final Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    final Set<UUID> inserted = new HashSet<>();
    for (int i = 0; i < 40; i++) {
      inserted.add(
          queueRepository.insert(
              pending("user_" + i, NotificationPriority.MEDIUM, null, now.minusSeconds(40 - i))));
    }

    final int workers = 4;
    final ExecutorService pool = Executors.newFixedThreadPool(workers);
    final CountDownLatch start = new CountDownLatch(1);
    try {
      final List<Future<List<UUID>>> futures = new ArrayList<>();
      for (int w = 0; w < workers; w++) {
        final String lockedBy = "worker-" + w;
        final Callable<List<UUID>> worker =
            () -> {
              start.await();
              final List<UUID> ids = new ArrayList<>();
              while (true) {
                final List<NotificationQueueRecord> batch =
                    queueRepository.claimPending(NotificationChannel.EMAIL, 3, now, lockedBy);
                if (batch.isEmpty()) {
                  return ids;
                }
                batch.forEach(record -> ids.add(record.id()));
              }
            };
        futures.add(pool.submit(worker));
      }
      start.countDown();

      final List<UUID> claimed = new ArrayList<>();
      for (Future<List<UUID>> future : futures) {
        claimed.addAll(future.get(30, TimeUnit.SECONDS));
      }
      assertThat(claimed).doesNotHaveDuplicates();
      assertThat(new HashSet<>(claimed)).isEqualTo(inserted);
      assertThat(queueRepository.countByStatus(NotificationStatus.PROCESSING)).isEqualTo(40);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void claimSkipsFutureRowsAndOrdersByPriority() {
    final Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    final UUID low =
        queueRepository.insert(pending("u_low", NotificationPriority.LOW, null, now.minusSeconds(30)));
    final UUID critical =
        queueRepository.insert(pending("u_critical", NotificationPriority.CRITICAL, null, now));
    final UUID deferred =
        queueRepository.insert(
            pending("u_deferred", NotificationPriority.CRITICAL, now.plus(Duration.ofHours(1)), now));

    // RETURNING の並びは保証されないため 1 件ずつ取り出して順序を見る
    final List<NotificationQueueRecord> first =
        queueRepository.claimPending(NotificationChannel.EMAIL, 1, now, "worker-a");
    final List<NotificationQueueRecord> rest =
        queueRepository.claimPending(NotificationChannel.EMAIL, 10, now, "worker-a");

    assertThat(first).extracting(NotificationQueueRecord::id).containsExactly(critical);
    assertThat(rest).extracting(NotificationQueueRecord::id).containsExactly(low);
    assertThat(rest)
        .allSatisfy(
            record -> {
              assertThat(record.status()).isEqualTo(NotificationStatus.PROCESSING);
              assertThat(record.lockedBy()).isEqualTo("worker-a");
            });
    assertThat(queueRepository.findById(deferred))
        .hasValueSatisfying(record -> assertThat(record.status()).isEqualTo(NotificationStatus.PENDING));
    assertThat(queueRepository.claimPending(NotificationChannel.PUSH, 10, now, "worker-a")).isEmpty();
  }

  @Test
  void markSentRequiresTheClaimingWorker() {
    final Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    final UUID id = queueRepository.insert(pending("u_1", NotificationPriority.HIGH, null, now));
    queueRepository.claimPending(NotificationChannel.EMAIL, 1, now, "worker-a");

    assertThat(queueRepository.markSent(id, now, "worker-b")).isZero();
    assertThat(queueRepository.markSent(id, now, "worker-a")).isEqualTo(1);
    // SENT は終端なので再送信の確定も受け付けない
    assertThat(queueRepository.markSent(id, now, "worker-a")).isZero();

    final NotificationQueueRecord sent = queueRepository.findById(id).orElseThrow();
    assertThat(sent.status()).isEqualTo(NotificationStatus.SENT);
    assertThat(sent.lockedBy()).isNull();
    assertThat(sent.sentAt()).isNotNull();
  }

  @Test
  void retryReturnsRowToPendingUntilNextRetryAt() {
    final Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    final UUID id = queueRepository.insert(pending("u_2", NotificationPriority.HIGH, null, now));
    queueRepository.claimPending(NotificationChannel.EMAIL, 1, now, "worker-a");

    assertThat(queueRepository.markRetry(id, 1, now.plusSeconds(60), "smtp down", false, "worker-a"))
        .isEqualTo(1);

    assertThat(queueRepository.claimPending(NotificationChannel.EMAIL, 1, now, "worker-a")).isEmpty();
    final List<NotificationQueueRecord> later =
        queueRepository.claimPending(NotificationChannel.EMAIL, 1, now.plusSeconds(61), "worker-b");
    assertThat(later).hasSize(1);
    assertThat(later.get(0).attempts()).isEqualTo(1);
    assertThat(later.get(0).lastError()).isEqualTo("smtp down");
  }

  @Test
  void staleProcessingRowsAreRequeuedWithoutConsumingAttempts() {
    final Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    final Instant claimedAt = now.minus(Duration.ofHours(1));
    final UUID stale =
        queueRepository.insert(pending("u_3", NotificationPriority.MEDIUM, null, claimedAt));
    queueRepository.claimPending(NotificationChannel.EMAIL, 1, claimedAt, "crashed-worker");
    final UUID fresh = queueRepository.insert(pending("u_4", NotificationPriority.MEDIUM, null, now));
    queueRepository.claimPending(NotificationChannel.EMAIL, 1, now, "live-worker");

    final int requeued = queueRepository.requeueStaleProcessing(now.minus(Duration.ofMinutes(15)));

    assertThat(requeued).isEqualTo(1);
    final NotificationQueueRecord record = queueRepository.findById(stale).orElseThrow();
    assertThat(record.status()).isEqualTo(NotificationStatus.PENDING);
    assertThat(record.lockedBy()).isNull();
    assertThat(record.attempts()).isZero();
    assertThat(queueRepository.findById(fresh).orElseThrow().status())
        .isEqualTo(NotificationStatus.PROCESSING);
  }

  private static NotificationQueueRecord pending(
      String username, NotificationPriority priority, Instant scheduledFor, Instant createdAt) {
    return NotificationQueueRecord.pending(
        UUID.randomUUID(),
        username,
        NotificationTrigger.NEW_MATCH,
        NotificationChannel.EMAIL,
        "{\"actor\":{\"displayName\":\"Bob\"}}",
        priority,
        scheduledFor,
        "dedup-" + username,
        createdAt);
  }
}
