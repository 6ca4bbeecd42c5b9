/*
 * どこで: Notifier ドメインモデル
 * 何を: 監査ログに残す管理操作を定義する
 * なぜ: 操作種別ごとに履歴を検索できるようにするため
 */
package com.example.notifier.model;

public enum AdminAuditAction {
  OVERRIDE_NOTIFICATION,
  DISABLE_NOTIFICATION,
  ENABLE_NOTIFICATION,
  TEST_NOTIFICATION
}
