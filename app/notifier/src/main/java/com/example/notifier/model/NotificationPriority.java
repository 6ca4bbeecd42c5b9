/*
 * どこで: Notifier ドメインモデル
 * 何を: 通知の優先度を定義する
 * なぜ: claim 順序と静音時間のバイパス判定に使うため
 */
package com.example.notifier.model;

public enum NotificationPriority {
  CRITICAL(0),
  HIGH(1),
  MEDIUM(2),
  LOW(3);

  private final int rank;

  NotificationPriority(int rank) {
    this.rank = rank;
  }

  /** 小さいほど先に claim される。 */
  public int rank() {
    return rank;
  }
}
