/*
 * どこで: Notifier ドメインモデル
 * 何を: ジョブのスケジュール (固定間隔 or 5 フィールド cron + ゾーン) を表す
 * なぜ: nextRunAt の計算に必要な値を 1 つにまとめるため
 */
package com.example.notifier.model;

public record JobSchedule(
    ScheduleType type, Long intervalSeconds, String cronExpression, String timezone) {

  public static JobSchedule interval(long seconds) {
    return new JobSchedule(ScheduleType.INTERVAL, seconds, null, null);
  }

  public static JobSchedule cron(String expression, String timezone) {
    return new JobSchedule(ScheduleType.CRON, null, expression, timezone);
  }

  public String describe() {
    if (type == ScheduleType.INTERVAL) {
      return "every " + intervalSeconds + "s";
    }
    return timezone == null ? cronExpression : cronExpression + " (" + timezone + ")";
  }
}
