/*
 * どこで: Notifier ジョブ基盤
 * 何を: templateType -> JobTemplate の型付きカタログを保持し、パラメータ検証を提供する
 * なぜ: 未知のテンプレートや古いパラメータを定義保存時と実行直前の両方で弾くため
 */
package com.example.notifier.job;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class JobTemplateRegistry {

  private static final Logger logger = LoggerFactory.getLogger(JobTemplateRegistry.class);

  private final Map<String, JobTemplate> templates = new ConcurrentHashMap<>();

  public JobTemplateRegistry(List<JobTemplate> templates) {
    templates.forEach(this::register);
    logger.info("job templates registered count={} types={}", this.templates.size(), types());
  }

  public void register(JobTemplate template) {
    final String type = template.templateType();
    if (type == null || type.isBlank()) {
      throw new JobValidationException("template type is required");
    }
    if (templates.putIfAbsent(type, template) != null) {
      throw new DuplicateTemplateTypeException(type);
    }
  }

  public JobTemplate resolve(String templateType) {
    final JobTemplate template = templateType == null ? null : templates.get(templateType);
    if (template == null) {
      throw new UnknownTemplateTypeException(templateType);
    }
    return template;
  }

  public boolean exists(String templateType) {
    return templateType != null && templates.containsKey(templateType);
  }

  public List<JobTemplate> list() {
    final List<JobTemplate> result = new ArrayList<>(templates.values());
    result.sort(Comparator.comparing(JobTemplate::templateType));
    return result;
  }

  public List<JobTemplate> listByCategory(String category) {
    return list().stream().filter(template -> template.category().equals(category)).toList();
  }

  /**
   * 検証に通れば既定値適用後のパラメータを返す。
   *
   * @throws UnknownTemplateTypeException テンプレートが未登録
   * @throws JobParameterValidationException 違反が 1 件以上ある (全件を保持する)
   */
  public Map<String, Object> validateParameters(String templateType, Map<String, Object> parameters) {
    final JobTemplate template = resolve(templateType);
    final JobParameterSchema schema = template.parameterSchema();
    final List<String> violations = new ArrayList<>(schema.validate(parameters));
    if (!violations.isEmpty()) {
      throw new JobParameterValidationException(templateType, violations);
    }
    final Map<String, Object> resolved = schema.resolve(parameters);
    violations.addAll(template.validateParameterCombination(resolved));
    if (!violations.isEmpty()) {
      throw new JobParameterValidationException(templateType, violations);
    }
    return resolved;
  }

  private List<String> types() {
    return list().stream().map(JobTemplate::templateType).toList();
  }
}
