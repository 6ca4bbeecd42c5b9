/*
 * どこで: Notifier ドメインモデル
 * 何を: 管理者オーバーライドの対象種別を定義する
 * なぜ: トリガー設定と保存検索を同じ仕組みで上書きできるようにするため
 */
package com.example.notifier.model;

import java.util.Locale;

public enum OverrideTargetType {
  TRIGGER,
  SAVED_SEARCH;

  public static OverrideTargetType fromPath(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("target_type is required");
    }
    final String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    try {
      return valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown target_type: " + value, ex);
    }
  }
}
