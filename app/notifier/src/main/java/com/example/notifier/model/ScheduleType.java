/*
 * どこで: Notifier ドメインモデル
 * 何を: ジョブのスケジュール種別を定義する
 * なぜ: 固定間隔と cron の次回実行計算を切り替えるため
 */
package com.example.notifier.model;

public enum ScheduleType {
  INTERVAL,
  CRON
}
