/*
 * どこで: Notifier 配信層の設定
 * 何を: 既定のチャネル実装 (ログ出力のみ) を channel ごとに登録する
 * なぜ: 実送信プロバイダ未接続の環境でも配信ワーカーを動かすため
 */
package com.example.notifier.service.channel;

import com.example.notifier.model.NotificationChannel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ChannelProviderConfig {

  @Bean
  public LocalChannelProvider emailChannelProvider() {
    return new LocalChannelProvider(NotificationChannel.EMAIL);
  }

  @Bean
  public LocalChannelProvider smsChannelProvider() {
    return new LocalChannelProvider(NotificationChannel.SMS);
  }

  @Bean
  public LocalChannelProvider pushChannelProvider() {
    return new LocalChannelProvider(NotificationChannel.PUSH);
  }
}
