package com.example.notifier.api.response;

import com.example.notifier.model.NotificationPriority;
import com.example.notifier.model.NotificationQueueRecord;
import com.example.notifier.model.NotificationStatus;
import com.example.notifier.model.NotificationTrigger;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QueueEntryResponse(
    UUID id,
    String username,
    NotificationTrigger trigger,
    String channel,
    NotificationPriority priority,
    NotificationStatus status,
    Instant scheduledFor,
    int attempts,
    Instant nextRetryAt,
    String lastError,
    Instant createdAt,
    Instant sentAt,
    JsonNode templateData) {

  public static QueueEntryResponse from(NotificationQueueRecord record, JsonNode templateData) {
    return new QueueEntryResponse(
        record.id(),
        record.username(),
        record.trigger(),
        record.channel().key(),
        record.priority(),
        record.status(),
        record.scheduledFor(),
        record.attempts(),
        record.nextRetryAt(),
        record.lastError(),
        record.createdAt(),
        record.sentAt(),
        templateData);
  }
}
