/*
 * どこで: Notifier 配信層
 * 何を: 送信を模擬してログに残すだけのチャネル実装
 * なぜ: 外部送信を伴わずにキューの状態遷移を確認するため
 */
package com.example.notifier.service.channel;

import com.example.notifier.model.NotificationChannel;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LocalChannelProvider implements ChannelProvider {

  private static final Logger logger = LoggerFactory.getLogger(LocalChannelProvider.class);

  private final NotificationChannel channel;

  public LocalChannelProvider(NotificationChannel channel) {
    this.channel = channel;
  }

  @Override
  public boolean supports(NotificationChannel channel) {
    return this.channel == channel;
  }

  @Override
  public void send(
      NotificationChannel channel,
      String recipientAddress,
      String subject,
      String body,
      Map<String, String> metadata) {
    // 宛先はログに出さない
    logger.info(
        "notification simulated send channel={} notificationId={} trigger={} subjectLength={}",
        channel.key(),
        metadata.get(ChannelMetadata.NOTIFICATION_ID),
        metadata.get(ChannelMetadata.TRIGGER),
        subject == null ? 0 : subject.length());
  }
}
