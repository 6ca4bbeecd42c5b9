/*
 * どこで: Notifier ジョブ基盤
 * 何を: 1 回のジョブ実行の識別情報を保持する
 * なぜ: テンプレートがログ/結果に実行 ID と起動元を残せるようにするため
 */
package com.example.notifier.job;

import java.time.Instant;
import java.util.UUID;

public record JobExecutionContext(
    UUID jobId, String jobName, UUID executionId, String triggeredBy, Instant startedAt) {

  public static final String TRIGGERED_BY_SCHEDULER = "scheduler";

  public static String triggeredByManual(String actor) {
    return "manual:" + actor;
  }
}
