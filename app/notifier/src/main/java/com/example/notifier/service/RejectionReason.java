package com.example.notifier.service;

import java.util.Locale;

public enum RejectionReason {
  ADMIN_DISABLED,
  NO_PREFERENCE_CONFIGURED,
  NO_CHANNELS_ENABLED,
  RATE_LIMITED,
  DUPLICATE;

  /** メトリクスタグと API 応答で使う小文字の識別子。 */
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
