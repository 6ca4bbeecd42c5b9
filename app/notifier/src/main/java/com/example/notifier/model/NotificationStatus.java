/*
 * どこで: Notifier ドメインモデル
 * 何を: 通知キューの状態を定義する
 * なぜ: PENDING -> PROCESSING -> SENT/FAILED の遷移をコード上で固定するため
 */
package com.example.notifier.model;

public enum NotificationStatus {
  PENDING,
  PROCESSING,
  SENT,
  FAILED;

  public boolean isTerminal() {
    return this == SENT || this == FAILED;
  }
}
