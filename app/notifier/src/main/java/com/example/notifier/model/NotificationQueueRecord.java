/*
 * どこで: Notifier ドメインモデル
 * 何を: notification_queue の 1 行を表す
 * なぜ: enqueue/claim/配信結果更新で同一の形を受け渡すため
 */
package com.example.notifier.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationQueueRecord(
    UUID id,
    String username,
    NotificationTrigger trigger,
    NotificationChannel channel,
    String templateDataJson,
    NotificationPriority priority,
    NotificationStatus status,
    Instant scheduledFor,
    String dedupKey,
    String lockedBy,
    Instant lockedAt,
    int attempts,
    Instant nextRetryAt,
    String lastError,
    Instant createdAt,
    Instant sentAt) {

  public static NotificationQueueRecord pending(
      UUID id,
      String username,
      NotificationTrigger trigger,
      NotificationChannel channel,
      String templateDataJson,
      NotificationPriority priority,
      Instant scheduledFor,
      String dedupKey,
      Instant createdAt) {
    return new NotificationQueueRecord(
        id,
        username,
        trigger,
        channel,
        templateDataJson,
        priority,
        NotificationStatus.PENDING,
        scheduledFor,
        dedupKey,
        null,
        null,
        0,
        null,
        null,
        createdAt,
        null);
  }
}
