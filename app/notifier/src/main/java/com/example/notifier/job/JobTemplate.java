/*
 * どこで: Notifier ジョブ基盤
 * 何を: スケジューラから実行されるジョブテンプレートの契約を定義する
 * なぜ: templateType 文字列の解決を起動時の 1 回に閉じ込め、実行は型で扱うため
 */
package com.example.notifier.job;

import java.util.List;
import java.util.Map;

public interface JobTemplate {

  /** レジストリのキー。起動後は変わらない。 */
  String templateType();

  String name();

  String description();

  default String category() {
    return "general";
  }

  default JobRiskLevel riskLevel() {
    return JobRiskLevel.LOW;
  }

  JobParameterSchema parameterSchema();

  /** 単一パラメータでは表せない組み合わせ制約。既定値適用後の値で呼ばれる。 */
  default List<String> validateParameterCombination(Map<String, Object> parameters) {
    return List.of();
  }

  /**
   * パラメータは検証済み (既定値適用後) の値が渡される。
   * 割り込みを受けた場合は速やかに戻ること。
   */
  JobResult execute(JobExecutionContext context, Map<String, Object> parameters);
}
