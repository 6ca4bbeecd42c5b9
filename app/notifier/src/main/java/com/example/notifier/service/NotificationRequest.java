package com.example.notifier.service;

import com.example.notifier.model.NotificationChannel;
import com.example.notifier.model.NotificationPriority;
import com.example.notifier.model.NotificationTrigger;
import com.example.notifier.model.OverrideTarget;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * enqueue の入力。
 *
 * <p>requestedChannels が null の場合は全チャネルを要求したものとして扱う。relatedTarget は保存検索など
 * トリガー以外の管理者停止対象。
 */
public record NotificationRequest(
    String username,
    NotificationTrigger trigger,
    Set<NotificationChannel> requestedChannels,
    Map<String, Object> templateData,
    NotificationPriority priority,
    String dedupKey,
    OverrideTarget relatedTarget) {

  public NotificationRequest {
    if (username == null || username.isBlank()) {
      throw new IllegalArgumentException("username is required");
    }
    if (trigger == null) {
      throw new IllegalArgumentException("trigger is required");
    }
    requestedChannels =
        requestedChannels == null
            ? Collections.unmodifiableSet(EnumSet.allOf(NotificationChannel.class))
            : requestedChannels.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(requestedChannels));
    templateData =
        templateData == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(templateData));
    priority = priority == null ? NotificationPriority.MEDIUM : priority;
  }

  public static NotificationRequest of(
      String username,
      NotificationTrigger trigger,
      Map<String, Object> templateData,
      NotificationPriority priority) {
    return new NotificationRequest(username, trigger, null, templateData, priority, null, null);
  }
}
