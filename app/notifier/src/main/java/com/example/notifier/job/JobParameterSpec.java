/*
 * どこで: Notifier ジョブ基盤
 * 何を: テンプレートの 1 パラメータ分の型/必須/範囲/既定値を宣言する
 * なぜ: 管理 API とスケジューラの両方で同じ規則で検証するため
 */
package com.example.notifier.job;

import java.util.Set;

public record JobParameterSpec(
    String name,
    JobParameterType type,
    boolean required,
    Long min,
    Long max,
    Object defaultValue,
    Set<String> allowedValues,
    String description) {

  public JobParameterSpec {
    allowedValues = allowedValues == null ? Set.of() : Set.copyOf(allowedValues);
  }

  public static JobParameterSpec integer(
      String name, long min, long max, Long defaultValue, String description) {
    return new JobParameterSpec(
        name, JobParameterType.INTEGER, defaultValue == null, min, max, defaultValue, null, description);
  }

  public static JobParameterSpec bool(String name, boolean defaultValue, String description) {
    return new JobParameterSpec(
        name, JobParameterType.BOOLEAN, false, null, null, defaultValue, null, description);
  }

  public static JobParameterSpec optionalEmail(String name, String description) {
    return new JobParameterSpec(
        name, JobParameterType.EMAIL, false, null, null, null, null, description);
  }

  public static JobParameterSpec optionalString(String name, String description) {
    return new JobParameterSpec(
        name, JobParameterType.STRING, false, null, null, null, null, description);
  }
}
