/*
 * どこで: Notifier 配信層
 * 何を: ユーザー名とチャネルから復号済みの宛先を解決する
 * なぜ: 連絡先の複製テーブルと復号処理を配信ロジックから分離するため
 */
package com.example.notifier.service;

import com.example.notifier.model.NotificationChannel;
import com.example.notifier.repository.RecipientContactRepository;
import com.example.notifier.service.pii.DecryptionException;
import com.example.notifier.service.pii.PiiDecryptor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RecipientResolver {

  private final RecipientContactRepository recipientContactRepository;
  private final PiiDecryptor piiDecryptor;

  /**
   * @throws RecipientNotFoundException 連絡先行が無い、またはチャネルの宛先が空
   * @throws DecryptionException 復号できない
   */
  public String resolveAddress(String username, NotificationChannel channel)
      throws DecryptionException {
    final String raw =
        recipientContactRepository
            .findByUsername(username)
            .map(contact -> contact.rawAddressFor(channel))
            .orElse(null);
    if (raw == null || raw.isBlank()) {
      throw new RecipientNotFoundException(username, channel);
    }
    final String address = piiDecryptor.decrypt(raw);
    if (address == null || address.isBlank()) {
      throw new RecipientNotFoundException(username, channel);
    }
    return address;
  }
}
