/*
 * どこで: Notifier ドメインモデル
 * 何を: 配信先の連絡先 (暗号化済みの可能性あり) を表す
 * なぜ: チャネルごとの宛先解決を 1 か所にまとめるため
 */
package com.example.notifier.model;

public record RecipientContact(String username, String email, String phone, String pushToken) {

  /** 暗号化されている可能性のある生の値を返す。 */
  public String rawAddressFor(NotificationChannel channel) {
    return switch (channel) {
      case EMAIL -> email;
      case SMS -> phone;
      case PUSH -> pushToken;
    };
  }
}
