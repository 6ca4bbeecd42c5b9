/*
 * どこで: Notifier ドメインモデル
 * 何を: job_executions の 1 行 (1 回の実行履歴) を表す
 * なぜ: 管理画面でジョブ履歴と失敗理由を確認できるようにするため
 */
package com.example.notifier.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record JobExecutionRecord(
    UUID executionId,
    UUID jobId,
    String jobName,
    String templateType,
    String triggeredBy,
    JobExecutionStatus status,
    Instant startedAt,
    Instant finishedAt,
    Long durationMillis,
    String message,
    int recordsProcessed,
    int recordsAffected,
    List<String> errors) {

  public JobExecutionRecord {
    errors = errors == null ? List.of() : List.copyOf(errors);
  }
}
