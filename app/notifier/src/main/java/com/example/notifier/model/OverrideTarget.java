/*
 * どこで: Notifier ドメインモデル
 * 何を: オーバーライド対象 (種別/ユーザー/キー) を識別する
 * なぜ: admin_overrides の主キーと enqueue 時の照合キーを一致させるため
 */
package com.example.notifier.model;

public record OverrideTarget(OverrideTargetType type, String username, String targetKey) {

  public OverrideTarget {
    if (type == null) {
      throw new IllegalArgumentException("target_type is required");
    }
    if (username == null || username.isBlank()) {
      throw new IllegalArgumentException("username is required");
    }
    if (targetKey == null || targetKey.isBlank()) {
      throw new IllegalArgumentException("target_key is required");
    }
    if (type == OverrideTargetType.TRIGGER) {
      // トリガー名は列挙に存在するものだけ受け付ける
      targetKey = parseTrigger(targetKey).name();
    }
  }

  private static NotificationTrigger parseTrigger(String value) {
    try {
      return NotificationTrigger.valueOf(value.trim());
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown trigger: " + value, ex);
    }
  }

  public static OverrideTarget trigger(String username, NotificationTrigger trigger) {
    return new OverrideTarget(OverrideTargetType.TRIGGER, username, trigger.name());
  }

  public static OverrideTarget savedSearch(String username, String searchId) {
    return new OverrideTarget(OverrideTargetType.SAVED_SEARCH, username, searchId);
  }
}
