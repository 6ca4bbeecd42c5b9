/*
 * どこで: Notifier 管理 API の出力
 * 何を: 登録済みジョブテンプレートとパラメータ宣言を返す
 * なぜ: 管理画面がテンプレートごとの入力フォームを組み立てられるようにするため
 */
package com.example.notifier.api.response;

import com.example.notifier.job.JobParameterSpec;
import com.example.notifier.job.JobParameterType;
import com.example.notifier.job.JobRiskLevel;
import com.example.notifier.job.JobTemplate;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Set;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobTemplateResponse(
    String templateType,
    String name,
    String description,
    String category,
    JobRiskLevel riskLevel,
    List<Parameter> parameters) {

  public static JobTemplateResponse from(JobTemplate template) {
    return new JobTemplateResponse(
        template.templateType(),
        template.name(),
        template.description(),
        template.category(),
        template.riskLevel(),
        template.parameterSchema().parameters().stream().map(Parameter::from).toList());
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Parameter(
      String name,
      JobParameterType type,
      boolean required,
      Long min,
      Long max,
      Object defaultValue,
      Set<String> allowedValues,
      String description) {

    static Parameter from(JobParameterSpec spec) {
      return new Parameter(
          spec.name(),
          spec.type(),
          spec.required(),
          spec.min(),
          spec.max(),
          spec.defaultValue(),
          spec.allowedValues(),
          spec.description());
    }
  }
}
