/*
 * どこで: Notifier ジョブ基盤
 * 何を: ジョブ 1 回分の結果 (状態/件数/エラー) を表す
 * なぜ: スケジューラと実行履歴が同じ形で結果を記録するため
 */
package com.example.notifier.job;

import java.util.List;

public record JobResult(
    JobResultStatus status,
    String message,
    int recordsProcessed,
    int recordsAffected,
    List<String> errors) {

  public JobResult {
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  public static JobResult success(String message, int recordsProcessed, int recordsAffected) {
    return new JobResult(JobResultStatus.SUCCESS, message, recordsProcessed, recordsAffected, List.of());
  }

  public static JobResult partial(
      String message, int recordsProcessed, int recordsAffected, List<String> errors) {
    return new JobResult(JobResultStatus.PARTIAL, message, recordsProcessed, recordsAffected, errors);
  }

  public static JobResult failed(String message, List<String> errors) {
    return new JobResult(JobResultStatus.FAILED, message, 0, 0, errors);
  }

  public static JobResult timeout(String message) {
    return new JobResult(JobResultStatus.TIMEOUT, message, 0, 0, List.of(message));
  }
}
