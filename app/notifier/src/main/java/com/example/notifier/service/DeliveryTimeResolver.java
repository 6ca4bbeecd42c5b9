/*
 * どこで: Notifier enqueue 処理
 * 何を: 頻度/送信時刻/曜日/静音時間から scheduled_for を決める
 * なぜ: ユーザーのタイムゾーンで「次の送信時刻」を計算し、夜間の即時通知を抑えるため
 */
package com.example.notifier.service;

import com.example.notifier.config.NotificationEnqueueProperties;
import com.example.notifier.model.NotificationPriority;
import com.example.notifier.model.QuietHours;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DeliveryTimeResolver {

  private final NotificationEnqueueProperties properties;

  /**
   * @return 即時送信なら null
   */
  public Instant resolve(
      EffectiveSchedule schedule,
      ZoneId zone,
      QuietHours quietHours,
      NotificationPriority priority,
      Instant now) {
    final ZonedDateTime localNow = now.atZone(zone);
    return switch (schedule.frequency()) {
      case INSTANT -> deferForQuietHours(localNow, quietHours, priority);
      case HOURLY -> localNow.truncatedTo(ChronoUnit.HOURS).plusHours(1).toInstant();
      case DAILY -> nextDaily(localNow, sendTime(schedule)).toInstant();
      case WEEKLY -> nextWeekly(localNow, sendTime(schedule), dayOfWeek(schedule)).toInstant();
    };
  }

  private Instant deferForQuietHours(
      ZonedDateTime localNow, QuietHours quietHours, NotificationPriority priority) {
    if (priority == NotificationPriority.CRITICAL
        || quietHours == null
        || !quietHours.contains(localNow.toLocalTime())) {
      return null;
    }
    // 静音時間の終了時刻まで遅らせる
    return nextDaily(localNow, quietHours.end()).toInstant();
  }

  private ZonedDateTime nextDaily(ZonedDateTime localNow, LocalTime time) {
    final ZonedDateTime candidate = ZonedDateTime.of(localNow.toLocalDate(), time, localNow.getZone());
    return candidate.isAfter(localNow) ? candidate : candidate.plusDays(1);
  }

  private ZonedDateTime nextWeekly(ZonedDateTime localNow, LocalTime time, DayOfWeek dayOfWeek) {
    final ZonedDateTime candidate =
        ZonedDateTime.of(
            localNow.toLocalDate().with(TemporalAdjusters.nextOrSame(dayOfWeek)),
            time,
            localNow.getZone());
    return candidate.isAfter(localNow) ? candidate : candidate.plusWeeks(1);
  }

  private LocalTime sendTime(EffectiveSchedule schedule) {
    return schedule.sendTime() == null ? properties.defaultSendTime() : schedule.sendTime();
  }

  private DayOfWeek dayOfWeek(EffectiveSchedule schedule) {
    return schedule.dayOfWeek() == null ? properties.defaultDayOfWeek() : schedule.dayOfWeek();
  }
}
