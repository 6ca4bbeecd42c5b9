package com.example.notifier.model;

import java.time.Instant;
import java.util.UUID;

public record AdminAuditLogRecord(
    UUID id,
    String actor,
    AdminAuditAction action,
    OverrideTargetType targetType,
    String username,
    String targetKey,
    String reason,
    String detailsJson,
    Instant createdAt) {}
