package com.example.notifier.service;

import com.example.notifier.model.AdminOverrideRecord;
import com.example.notifier.model.NotificationFrequency;
import com.example.notifier.model.TriggerPreference;
import java.time.DayOfWeek;
import java.time.LocalTime;

/** 設定値に管理者上書きを重ねた配信スケジュール。 */
public record EffectiveSchedule(
    NotificationFrequency frequency, LocalTime sendTime, DayOfWeek dayOfWeek) {

  public static EffectiveSchedule from(TriggerPreference preference) {
    return new EffectiveSchedule(
        preference.frequency(), preference.sendTime(), preference.dayOfWeek());
  }

  /** null でない上書き項目だけが現在の値を置き換える。 */
  public EffectiveSchedule withOverride(AdminOverrideRecord override) {
    if (override == null) {
      return this;
    }
    return new EffectiveSchedule(
        override.overrideFrequency() != null ? override.overrideFrequency() : frequency,
        override.overrideTime() != null ? override.overrideTime() : sendTime,
        override.overrideDayOfWeek() != null ? override.overrideDayOfWeek() : dayOfWeek);
  }
}
