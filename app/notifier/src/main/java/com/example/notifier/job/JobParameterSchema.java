/*
 * どこで: Notifier ジョブ基盤
 * 何を: テンプレートのパラメータ宣言と検証/既定値適用を行う
 * なぜ: 古いジョブ定義を黙って型変換せず、実行前に明示的に失敗させるため
 */
package com.example.notifier.job;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

public record JobParameterSchema(List<JobParameterSpec> parameters) {

  private static final Pattern EMAIL_PATTERN =
      Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

  public JobParameterSchema {
    parameters = parameters == null ? List.of() : List.copyOf(parameters);
  }

  public static JobParameterSchema of(JobParameterSpec... specs) {
    return new JobParameterSchema(List.of(specs));
  }

  public static JobParameterSchema empty() {
    return new JobParameterSchema(List.of());
  }

  /** 違反をすべて列挙して返す。空なら妥当。 */
  public List<String> validate(Map<String, Object> values) {
    final Map<String, Object> input = values == null ? Map.of() : values;
    final List<String> violations = new ArrayList<>();
    for (String key : input.keySet()) {
      if (parameters.stream().noneMatch(spec -> spec.name().equals(key))) {
        violations.add("unknown parameter: " + key);
      }
    }
    for (JobParameterSpec spec : parameters) {
      final Object value = input.get(spec.name());
      if (value == null) {
        if (spec.required()) {
          violations.add(spec.name() + " is required");
        }
        continue;
      }
      validateValue(spec, value, violations);
    }
    return violations;
  }

  /** 検証済みの値に既定値を補った不変 Map を返す。 */
  public Map<String, Object> resolve(Map<String, Object> values) {
    final Map<String, Object> resolved = new LinkedHashMap<>();
    for (JobParameterSpec spec : parameters) {
      final Object value = values == null ? null : values.get(spec.name());
      if (value != null) {
        resolved.put(spec.name(), value);
      } else if (spec.defaultValue() != null) {
        resolved.put(spec.name(), spec.defaultValue());
      }
    }
    return Collections.unmodifiableMap(resolved);
  }

  private void validateValue(JobParameterSpec spec, Object value, List<String> violations) {
    switch (spec.type()) {
      case INTEGER -> {
        if (!isIntegral(value)) {
          violations.add(spec.name() + " must be an integer");
          return;
        }
        final long number = ((Number) value).longValue();
        if (spec.min() != null && number < spec.min()) {
          violations.add(spec.name() + " must be >= " + spec.min());
        }
        if (spec.max() != null && number > spec.max()) {
          violations.add(spec.name() + " must be <= " + spec.max());
        }
      }
      case BOOLEAN -> {
        if (!(value instanceof Boolean)) {
          violations.add(spec.name() + " must be a boolean");
        }
      }
      case STRING -> {
        if (!(value instanceof String text)) {
          violations.add(spec.name() + " must be a string");
          return;
        }
        if (!spec.allowedValues().isEmpty() && !spec.allowedValues().contains(text)) {
          violations.add(spec.name() + " must be one of " + spec.allowedValues());
        }
      }
      case EMAIL -> {
        if (!(value instanceof String text) || !EMAIL_PATTERN.matcher(text).matches()) {
          violations.add(spec.name() + " must be a valid email address");
        }
      }
    }
  }

  private boolean isIntegral(Object value) {
    // 文字列や小数は暗黙に変換しない
    return value instanceof Integer || value instanceof Long || value instanceof Short;
  }

  public static int intValue(Map<String, Object> parameters, String name) {
    final Object value = parameters.get(name);
    if (!(value instanceof Number number)) {
      throw new IllegalStateException("parameter is not resolved: " + name);
    }
    return number.intValue();
  }

  public static boolean booleanValue(Map<String, Object> parameters, String name) {
    return Boolean.TRUE.equals(parameters.get(name));
  }

  public static String stringValue(Map<String, Object> parameters, String name) {
    final Object value = parameters.get(name);
    return value == null ? null : value.toString();
  }
}
