/*
 * どこで: Notifier 配信層
 * 何を: チャネルごとに PENDING 通知を claim して送信し、リトライ/FAILED を確定する
 * なぜ: 配信ワーカーのジョブテンプレートから通知の最終状態を制御するため
 */
package com.example.notifier.service;

import com.example.notifier.config.NotificationDeliveryProperties;
import com.example.notifier.model.NotificationChannel;
import com.example.notifier.model.NotificationQueueRecord;
import com.example.notifier.model.NotificationStatus;
import com.example.notifier.model.NotificationTrigger;
import com.example.notifier.repository.NotificationQueueRepository;
import com.example.notifier.service.channel.ChannelMetadata;
import com.example.notifier.service.channel.ChannelProviderRegistry;
import com.example.notifier.service.pii.DecryptionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationDeliveryService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDeliveryService.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";
  private static final int MAX_HOSTNAME_LENGTH = 64;
  private static final TypeReference<Map<String, Object>> TEMPLATE_DATA_TYPE =
      new TypeReference<>() {};

  private final NotificationQueueRepository queueRepository;
  private final RecipientResolver recipientResolver;
  private final NotificationMessageRenderer renderer;
  private final ChannelProviderRegistry providerRegistry;
  private final NotifierMetrics metrics;
  private final NotificationDeliveryProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  enum FailureOutcome {
    RETRIED,
    FAILED,
    LOCK_LOST
  }

  public DeliveryBatchResult deliverBatch(NotificationChannel channel, DeliveryOptions options) {
    final Instant now = Instant.now(clock);
    final String lockedBy = newLockToken();
    // claim を単一 SQL で行い、送信 IO を長期トランザクションに載せない
    final List<NotificationQueueRecord> claimed =
        queueRepository.claimPending(channel, options.batchSize(), now, lockedBy);
    int sent = 0;
    int retried = 0;
    int failed = 0;
    int lockLost = 0;
    final List<String> errors = new ArrayList<>();
    for (NotificationQueueRecord entry : claimed) {
      if (Thread.currentThread().isInterrupted()) {
        // タイムアウトで中断された残りは reconciler が PENDING に戻す
        logger.warn("delivery batch interrupted channel={} remaining entries left PROCESSING", channel.key());
        break;
      }
      try {
        final String address =
            options.testMode()
                ? options.testRecipient()
                : recipientResolver.resolveAddress(entry.username(), channel);
        final RenderedMessage message = renderer.render(entry.trigger(), parseTemplateData(entry));
        providerRegistry
            .resolve(channel)
            .send(channel, address, message.subject(), message.body(), metadata(entry, options.testMode()));
        final int updated = queueRepository.markSent(entry.id(), Instant.now(clock), lockedBy);
        if (updated == 0) {
          lockLost++;
          logger.warn(
              "notification sent but lock was lost id={} channel={}", entry.id(), channel.key());
          continue;
        }
        sent++;
        metrics.recordDeliveryResult(channel.key(), "sent");
      } catch (DecryptionException | RuntimeException ex) {
        errors.add(entry.id() + ": " + truncateError(ex.getMessage()));
        switch (handleFailure(entry, ex, Instant.now(clock), lockedBy)) {
          case RETRIED -> retried++;
          case FAILED -> failed++;
          case LOCK_LOST -> lockLost++;
        }
      }
    }
    metrics.updateBacklogCurrent(queueRepository.countByStatus(NotificationStatus.PENDING));
    if (!claimed.isEmpty()) {
      logger.info(
          "delivery batch finished channel={} claimed={} sent={} retried={} failed={} lockLost={}",
          channel.key(),
          claimed.size(),
          sent,
          retried,
          failed,
          lockLost);
    }
    return new DeliveryBatchResult(claimed.size(), sent, retried, failed, lockLost, errors);
  }

  /** キューにもスケジュールにも書き込まずに 1 通だけ送る。 */
  public TestDeliveryResult sendTest(
      NotificationChannel channel,
      String recipientAddress,
      String username,
      NotificationTrigger trigger,
      Map<String, Object> templateData) {
    final RenderedMessage message = renderer.render(trigger, templateData);
    final Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put(ChannelMetadata.USERNAME, username);
    metadata.put(ChannelMetadata.TRIGGER, trigger.name());
    metadata.put(ChannelMetadata.TEST, "true");
    try {
      providerRegistry
          .resolve(channel)
          .send(channel, recipientAddress, message.subject(), message.body(), metadata);
      metrics.recordDeliveryResult(channel.key(), "test_sent");
      return new TestDeliveryResult(
          true, channel, recipientAddress, message.subject(), message.body(), null);
    } catch (RuntimeException ex) {
      logger.warn("test notification failed channel={} username={}", channel.key(), username, ex);
      metrics.recordDeliveryResult(channel.key(), "test_failed");
      return new TestDeliveryResult(
          false, channel, recipientAddress, message.subject(), message.body(), truncateError(ex.getMessage()));
    }
  }

  /** processing-timeout を過ぎた PROCESSING を PENDING へ戻す。 */
  public int requeueStaleProcessing() {
    final Instant threshold = Instant.now(clock).minus(properties.processingTimeout());
    final int requeued = queueRepository.requeueStaleProcessing(threshold);
    if (requeued > 0) {
      logger.warn("stale processing notifications requeued count={} threshold={}", requeued, threshold);
    }
    return requeued;
  }

  @VisibleForTesting
  FailureOutcome handleFailure(
      NotificationQueueRecord entry, Exception ex, Instant now, String lockedBy) {
    final int nextAttempt = entry.attempts() + 1;
    final String lastError = truncateError(ex.getMessage());
    if (nextAttempt >= properties.maxAttempts()) {
      final int updated =
          queueRepository.markRetry(entry.id(), nextAttempt, null, lastError, true, lockedBy);
      if (updated == 0) {
        logger.warn(
            "notification fail skipped because lock was lost id={} attempt={}",
            entry.id(),
            nextAttempt);
        return FailureOutcome.LOCK_LOST;
      }
      metrics.recordDeliveryResult(entry.channel().key(), "failed");
      logger.error(
          "notification delivery failed permanently id={} username={} channel={} attempts={}",
          entry.id(),
          entry.username(),
          entry.channel().key(),
          nextAttempt,
          ex);
      return FailureOutcome.FAILED;
    }
    final Duration backoff = computeBackoffDuration(nextAttempt);
    final Instant nextRetryAt = now.plus(backoff);
    final int updated =
        queueRepository.markRetry(entry.id(), nextAttempt, nextRetryAt, lastError, false, lockedBy);
    if (updated == 0) {
      logger.warn(
          "notification retry skipped because lock was lost id={} attempt={}",
          entry.id(),
          nextAttempt);
      return FailureOutcome.LOCK_LOST;
    }
    metrics.recordDeliveryResult(entry.channel().key(), "retried");
    logger.warn(
        "notification retry scheduled id={} attempt={} nextRetryAt={}",
        entry.id(),
        nextAttempt,
        nextRetryAt,
        ex);
    return FailureOutcome.RETRIED;
  }

  @VisibleForTesting
  Duration computeBackoffDuration(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp = baseMillis * Math.pow(properties.backoffExponentBase(), (attempt - 1));
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    final double jitterMin = properties.backoffJitterMin();
    final double jitterMax = properties.backoffJitterMax();
    final double jitter =
        jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    final long backoffMillis = (long) Math.ceil(capped * jitter);
    final long minMillis = properties.backoffMin().toMillis();
    return Duration.ofMillis(Math.max(minMillis, backoffMillis));
  }

  private Map<String, Object> parseTemplateData(NotificationQueueRecord entry) {
    if (entry.templateDataJson() == null) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(entry.templateDataJson(), TEMPLATE_DATA_TYPE);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("template_data is not valid JSON id=" + entry.id(), ex);
    }
  }

  private Map<String, String> metadata(NotificationQueueRecord entry, boolean testMode) {
    final Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put(ChannelMetadata.NOTIFICATION_ID, entry.id().toString());
    metadata.put(ChannelMetadata.USERNAME, entry.username());
    metadata.put(ChannelMetadata.TRIGGER, entry.trigger().name());
    metadata.put(ChannelMetadata.PRIORITY, entry.priority().name());
    if (testMode) {
      metadata.put(ChannelMetadata.TEST, "true");
    }
    return metadata;
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  /** バッチごとの所有者トークン。再 claim 後に元のバッチの更新が一致しないようホスト名に UUID を付ける。 */
  @VisibleForTesting
  String newLockToken() {
    final String hostname = resolveHostname();
    // locked_by は VARCHAR(128)
    final String host =
        hostname.length() > MAX_HOSTNAME_LENGTH ? hostname.substring(0, MAX_HOSTNAME_LENGTH) : hostname;
    return host + ":" + UUID.randomUUID();
  }

  private String resolveHostname() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}
