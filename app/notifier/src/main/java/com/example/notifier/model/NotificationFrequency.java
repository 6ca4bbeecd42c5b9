/*
 * どこで: Notifier ドメインモデル
 * 何を: トリガーごとの送信頻度を定義する
 * なぜ: scheduledFor の算出ルールを頻度で切り替えるため
 */
package com.example.notifier.model;

public enum NotificationFrequency {
  INSTANT,
  HOURLY,
  DAILY,
  WEEKLY
}
