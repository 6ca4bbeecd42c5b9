/*
 * どこで: Notifier スケジューラ
 * 何を: application.yml の seed-jobs のうち未登録の名前だけをジョブ定義として登録する
 * なぜ: 配信ワーカー等の組み込みジョブを初回起動で用意し、運用中の変更は上書きしないため
 */
package com.example.notifier.scheduler;

import com.example.notifier.config.SchedulerProperties;
import com.example.notifier.config.SchedulerProperties.SeedJob;
import com.example.notifier.job.JobParameterSpec;
import com.example.notifier.job.JobTemplateRegistry;
import com.example.notifier.job.JobValidationException;
import com.example.notifier.model.JobSchedule;
import com.example.notifier.model.ScheduleType;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JobBootstrapSeeder {

  private static final Logger logger = LoggerFactory.getLogger(JobBootstrapSeeder.class);

  static final int ORDER = 0;

  private final SchedulerProperties properties;
  private final JobDefinitionService definitionService;
  private final JobTemplateRegistry templateRegistry;

  @EventListener(ApplicationReadyEvent.class)
  @Order(ORDER)
  public void onApplicationReady() {
    seed();
  }

  /** 登録した件数を返す。 */
  public int seed() {
    int created = 0;
    for (SeedJob seed : properties.seedJobs()) {
      if (definitionService.findByName(seed.name()).isPresent()) {
        continue;
      }
      try {
        definitionService.create(
            new JobDefinitionCommand(
                seed.name(),
                seed.templateType(),
                fromConfiguration(seed.templateType(), seed.parameters()),
                toSchedule(seed),
                seed.enabledOrDefault(),
                seed.timeoutSeconds()));
        created++;
      } catch (JobValidationException ex) {
        // 1 件の不備で他の組み込みジョブの登録を止めない
        logger.error("seed job rejected name={} violations={}", seed.name(), ex.violations(), ex);
      }
    }
    if (created > 0) {
      logger.info("seed jobs registered count={}", created);
    }
    return created;
  }

  /**
   * プロパティ経由の値は文字列で届く場合があるため、宣言された型に合わせて読み替える。
   * 読み替えられない値はそのまま渡し、検証で弾かせる。
   */
  Map<String, Object> fromConfiguration(String templateType, Map<String, Object> raw) {
    if (!templateRegistry.exists(templateType)) {
      return raw;
    }
    final Map<String, Object> converted = new LinkedHashMap<>(raw);
    for (JobParameterSpec spec : templateRegistry.resolve(templateType).parameterSchema().parameters()) {
      if (!(converted.get(spec.name()) instanceof String text)) {
        continue;
      }
      switch (spec.type()) {
        case INTEGER -> {
          if (text.trim().matches("-?\\d+")) {
            converted.put(spec.name(), Long.parseLong(text.trim()));
          }
        }
        case BOOLEAN -> {
          if ("true".equalsIgnoreCase(text.trim()) || "false".equalsIgnoreCase(text.trim())) {
            converted.put(spec.name(), Boolean.parseBoolean(text.trim()));
          }
        }
        default -> {
          // 文字列型はそのまま
        }
      }
    }
    return converted;
  }

  private JobSchedule toSchedule(SeedJob seed) {
    if (seed.scheduleType() == ScheduleType.INTERVAL) {
      return new JobSchedule(ScheduleType.INTERVAL, seed.intervalSeconds(), null, seed.timezone());
    }
    return JobSchedule.cron(seed.cron(), seed.timezone());
  }
}
