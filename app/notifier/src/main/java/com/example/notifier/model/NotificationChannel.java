/*
 * どこで: Notifier ドメインモデル
 * 何を: 配信チャネル (email/sms/push) を定義する
 * なぜ: 設定/キュー/プロバイダで同一のキーを使うため
 */
package com.example.notifier.model;

import java.util.Locale;

public enum NotificationChannel {
  EMAIL,
  SMS,
  PUSH;

  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static NotificationChannel fromKey(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("channel is required");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown channel: " + value, ex);
    }
  }
}
