/*
 * どこで: Notifier ジョブ基盤
 * 何を: ジョブ定義の入力不備 (テンプレート/パラメータ/スケジュール) を表す基底例外
 * なぜ: 管理 API でまとめて 400 に変換するため
 */
package com.example.notifier.job;

import java.util.List;

public class JobValidationException extends RuntimeException {

  private final List<String> violations;

  public JobValidationException(String message) {
    this(message, List.of(message));
  }

  public JobValidationException(String message, List<String> violations) {
    super(message);
    this.violations = List.copyOf(violations);
  }

  public JobValidationException(String message, Throwable cause) {
    super(message, cause);
    this.violations = List.of(message);
  }

  public List<String> violations() {
    return violations;
  }
}
