/*
 * どこで: Notifier アプリの設定バインド
 * 何を: スケジューラの tick 間隔/ワーカープール/既定タイムアウト/初期ジョブを保持する
 * なぜ: 運用パラメータと組み込みジョブの定義を外部化するため
 */
package com.example.notifier.config;

import com.example.notifier.model.ScheduleType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "scheduler")
@Validated
public record SchedulerProperties(
    boolean enabled,
    @NotNull Duration tickInterval,
    @Positive int poolSize,
    @Positive int queueCapacity,
    @NotNull Duration defaultTimeout,
    @Positive int errorMessageMaxLength,
    @Valid List<SeedJob> seedJobs) {

  public SchedulerProperties {
    seedJobs = seedJobs == null ? List.of() : List.copyOf(seedJobs);
  }

  @AssertTrue(message = "scheduler.tick-interval must be positive")
  public boolean isTickIntervalPositive() {
    return isPositiveDuration(tickInterval);
  }

  @AssertTrue(message = "scheduler.default-timeout must be positive")
  public boolean isDefaultTimeoutPositive() {
    return isPositiveDuration(defaultTimeout);
  }

  private boolean isPositiveDuration(Duration duration) {
    // null は @NotNull で検出する前提。
    return duration != null && !duration.isZero() && !duration.isNegative();
  }

  /** 起動時に存在しなければ登録する組み込みジョブ。 */
  public record SeedJob(
      @NotBlank String name,
      @NotBlank String templateType,
      @NotNull ScheduleType scheduleType,
      Long intervalSeconds,
      String cron,
      String timezone,
      Integer timeoutSeconds,
      Boolean enabled,
      Map<String, Object> parameters) {

    public SeedJob {
      parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    public boolean enabledOrDefault() {
      return enabled == null || enabled;
    }
  }
}
