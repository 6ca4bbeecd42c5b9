/*
 * どこで: Notifier スケジューラ
 * 何を: INTERVAL/CRON スケジュールの検証と次回実行時刻の計算を行う
 * なぜ: 定義の保存時と実行完了時で同じ規則で next_run_at を求めるため
 */
package com.example.notifier.scheduler;

import com.example.notifier.job.JobScheduleValidationException;
import com.example.notifier.model.JobSchedule;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

@Component
public class JobScheduleCalculator {

  private static final int CRON_FIELD_COUNT = 5;

  private final ZoneId defaultZone;

  public JobScheduleCalculator(ZoneId defaultZoneId) {
    this.defaultZone = defaultZoneId;
  }

  public void validate(JobSchedule schedule) {
    if (schedule == null || schedule.type() == null) {
      throw new JobScheduleValidationException("schedule type is required");
    }
    switch (schedule.type()) {
      case INTERVAL -> {
        if (schedule.intervalSeconds() == null || schedule.intervalSeconds() <= 0) {
          throw new JobScheduleValidationException("interval_seconds must be positive");
        }
      }
      case CRON -> {
        parseCron(schedule.cronExpression());
        resolveZone(schedule.timezone());
      }
    }
  }

  /**
   * INTERVAL は lastRunAt + interval。それが now 以前なら now + interval。
   * CRON は now より後の最初の発火時刻をジョブのゾーンで求める。
   */
  public Instant nextRunAt(JobSchedule schedule, Instant lastRunAt, Instant now) {
    validate(schedule);
    return switch (schedule.type()) {
      case INTERVAL -> nextInterval(Duration.ofSeconds(schedule.intervalSeconds()), lastRunAt, now);
      case CRON -> nextCron(schedule, now);
    };
  }

  private Instant nextInterval(Duration interval, Instant lastRunAt, Instant now) {
    if (lastRunAt != null) {
      final Instant candidate = lastRunAt.plus(interval);
      if (candidate.isAfter(now)) {
        return candidate;
      }
    }
    return now.plus(interval);
  }

  private Instant nextCron(JobSchedule schedule, Instant now) {
    final CronExpression cron = parseCron(schedule.cronExpression());
    final ZonedDateTime next = cron.next(now.atZone(resolveZone(schedule.timezone())));
    if (next == null) {
      throw new JobScheduleValidationException(
          "cron expression never fires: " + schedule.cronExpression());
    }
    return next.toInstant();
  }

  private CronExpression parseCron(String expression) {
    if (expression == null || expression.isBlank()) {
      throw new JobScheduleValidationException("cron_expression is required");
    }
    final String trimmed = expression.trim();
    if (trimmed.split("\\s+").length != CRON_FIELD_COUNT) {
      throw new JobScheduleValidationException(
          "cron_expression must have 5 fields (minute hour day-of-month month day-of-week): "
              + expression);
    }
    try {
      // 秒フィールドは 0 に固定する
      return CronExpression.parse("0 " + trimmed);
    } catch (IllegalArgumentException ex) {
      throw new JobScheduleValidationException("invalid cron_expression: " + expression, ex);
    }
  }

  private ZoneId resolveZone(String timezone) {
    if (timezone == null || timezone.isBlank()) {
      return defaultZone;
    }
    try {
      return ZoneId.of(timezone);
    } catch (DateTimeException ex) {
      throw new JobScheduleValidationException("invalid timezone: " + timezone, ex);
    }
  }
}
