/*
 * どこで: Notifier 管理 API の入力
 * 何を: ジョブ定義の作成/更新リクエスト
 * なぜ: 更新時は省略した項目を既存値のまま残せるよう、全項目を null 許容で受けるため
 */
package com.example.notifier.api.request;

import com.example.notifier.scheduler.JobDefinitionCommand;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobDefinitionRequest(
    String name,
    String templateType,
    Map<String, Object> parameters,
    @Valid JobScheduleRequest schedule,
    Boolean enabled,
    Integer timeoutSeconds) {

  public JobDefinitionCommand toCommand() {
    return new JobDefinitionCommand(
        name,
        templateType,
        parameters,
        schedule == null ? null : schedule.toSchedule(),
        enabled,
        timeoutSeconds);
  }
}
