/*
 * どこで: Notifier 配信層
 * 何を: 保存時暗号化された連絡先を復号するインターフェース
 * なぜ: 暗号化方式を配信処理から切り離すため
 */
package com.example.notifier.service.pii;

public interface PiiDecryptor {

  /** 平文を渡した場合はそのまま返すこと (冪等)。 */
  String decrypt(String field) throws DecryptionException;
}
