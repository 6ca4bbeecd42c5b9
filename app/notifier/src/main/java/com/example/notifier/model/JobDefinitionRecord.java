/*
 * どこで: Notifier ドメインモデル
 * 何を: job_definitions の 1 行を表す
 * なぜ: スケジューラ/管理 API で同一の定義を受け渡すため
 */
package com.example.notifier.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

public record JobDefinitionRecord(
    UUID id,
    String name,
    String templateType,
    Map<String, Object> parameters,
    JobSchedule schedule,
    boolean enabled,
    boolean running,
    Instant runningSince,
    Instant lastRunAt,
    Instant nextRunAt,
    JobRunStatus lastStatus,
    String lastError,
    int consecutiveFailures,
    Integer timeoutSeconds,
    Instant createdAt,
    Instant updatedAt) {

  public JobDefinitionRecord {
    parameters =
        parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
  }
}
