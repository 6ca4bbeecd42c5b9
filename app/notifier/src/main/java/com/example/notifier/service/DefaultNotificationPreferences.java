/*
 * どこで: Notifier 設定解決
 * 何を: 全トリガー分の既定通知設定を生成する
 * なぜ: ユーザー作成時とバックフィルで同じ既定値を書き込み、行の欠落を作らないため
 */
package com.example.notifier.service;

import com.example.notifier.config.NotificationEnqueueProperties;
import com.example.notifier.model.NotificationChannel;
import com.example.notifier.model.NotificationFrequency;
import com.example.notifier.model.NotificationTrigger;
import com.example.notifier.model.TriggerPreference;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DefaultNotificationPreferences {

  private final NotificationEnqueueProperties properties;

  public List<TriggerPreference> all() {
    final List<TriggerPreference> defaults = new ArrayList<>();
    for (NotificationTrigger trigger : NotificationTrigger.values()) {
      defaults.add(forTrigger(trigger));
    }
    return defaults;
  }

  public List<String> knownTriggerNames() {
    return EnumSet.allOf(NotificationTrigger.class).stream().map(Enum::name).toList();
  }

  public TriggerPreference forTrigger(NotificationTrigger trigger) {
    return switch (trigger) {
      case NEW_MATCH, PII_REQUEST -> instant(trigger, channels(trigger));
      case NEW_MESSAGE -> scheduled(trigger, channels(trigger), NotificationFrequency.HOURLY);
      case PROFILE_VIEW -> scheduled(trigger, channels(trigger), NotificationFrequency.DAILY);
      case WEEKLY_DIGEST -> scheduled(trigger, channels(trigger), NotificationFrequency.WEEKLY);
      default -> instant(trigger, channels(trigger));
    };
  }

  private Set<NotificationChannel> channels(NotificationTrigger trigger) {
    return switch (trigger) {
      case NEW_MATCH -> EnumSet.of(NotificationChannel.EMAIL, NotificationChannel.PUSH);
      case NEW_MESSAGE -> EnumSet.of(NotificationChannel.SMS, NotificationChannel.PUSH);
      case PII_REQUEST -> EnumSet.of(NotificationChannel.EMAIL, NotificationChannel.SMS);
      case SUSPICIOUS_LOGIN -> EnumSet.allOf(NotificationChannel.class);
      case PROFILE_VIEW,
          FAVORITED,
          SHORTLIST_ADDED,
          MESSAGE_READ,
          PROFILE_VISIBILITY_SPIKE,
          SEARCH_APPEARANCE,
          CONVERSATION_COLD,
          PROFILE_INCOMPLETE,
          UPLOAD_PHOTOS -> EnumSet.of(NotificationChannel.PUSH);
      // 月次ダイジェストは明示的に購読したユーザーだけに送る
      case MONTHLY_DIGEST -> EnumSet.noneOf(NotificationChannel.class);
      default -> EnumSet.of(NotificationChannel.EMAIL, NotificationChannel.PUSH);
    };
  }

  private TriggerPreference instant(NotificationTrigger trigger, Set<NotificationChannel> channels) {
    return new TriggerPreference(trigger, channels, NotificationFrequency.INSTANT, null, null);
  }

  private TriggerPreference scheduled(
      NotificationTrigger trigger, Set<NotificationChannel> channels, NotificationFrequency frequency) {
    return new TriggerPreference(
        trigger,
        channels,
        frequency,
        frequency == NotificationFrequency.HOURLY ? null : properties.defaultSendTime(),
        frequency == NotificationFrequency.WEEKLY ? properties.defaultDayOfWeek() : null);
  }
}
