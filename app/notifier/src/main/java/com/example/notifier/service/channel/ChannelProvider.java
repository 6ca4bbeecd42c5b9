/*
 * どこで: Notifier 配信層
 * 何を: チャネル別の送信抽象化インターフェース
 * なぜ: 実送信/テスト差し替えを容易にするため
 */
package com.example.notifier.service.channel;

import com.example.notifier.model.NotificationChannel;
import java.util.Map;

public interface ChannelProvider {

  boolean supports(NotificationChannel channel);

  /**
   * @throws ChannelProviderException 送信できなかった場合。呼び出し側でリトライ判定する
   */
  void send(
      NotificationChannel channel,
      String recipientAddress,
      String subject,
      String body,
      Map<String, String> metadata);
}
