/*
 * どこで: Notifier 配信層
 * 何を: 鍵を持たない既定の PiiDecryptor
 * なぜ: 平文の連絡先だけで動作させ、暗号化値は送信せずに失敗させるため
 */
package com.example.notifier.service.pii;

import org.springframework.stereotype.Component;

@Component
public class PlaintextOnlyPiiDecryptor implements PiiDecryptor {

  static final String ENCRYPTED_PREFIX = "enc:";

  @Override
  public String decrypt(String field) throws DecryptionException {
    if (field == null) {
      return null;
    }
    if (field.startsWith(ENCRYPTED_PREFIX)) {
      throw new DecryptionException("no decryption key configured for encrypted field");
    }
    return field;
  }
}
