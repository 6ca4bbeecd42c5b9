package com.example.notifier.scheduler;

import com.example.notifier.model.JobSchedule;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** 作成/更新の入力。更新では null の項目は既存値を維持する。 */
public record JobDefinitionCommand(
    String name,
    String templateType,
    Map<String, Object> parameters,
    JobSchedule schedule,
    Boolean enabled,
    Integer timeoutSeconds) {

  public JobDefinitionCommand {
    parameters =
        parameters == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
  }
}
