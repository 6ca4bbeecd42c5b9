package com.example.notifier.api.response;

import com.example.notifier.model.AdminAuditAction;
import com.example.notifier.model.AdminAuditLogRecord;
import com.example.notifier.model.OverrideTargetType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuditLogEntryResponse(
    UUID id,
    String actor,
    AdminAuditAction action,
    OverrideTargetType targetType,
    String username,
    String targetKey,
    String reason,
    JsonNode details,
    Instant createdAt) {

  public static AuditLogEntryResponse from(AdminAuditLogRecord record, JsonNode details) {
    return new AuditLogEntryResponse(
        record.id(),
        record.actor(),
        record.action(),
        record.targetType(),
        record.username(),
        record.targetKey(),
        record.reason(),
        details,
        record.createdAt());
  }
}
