/*
 * どこで: Notifier データアクセス補助
 * 何を: チャネル集合をカンマ区切り文字列と相互変換する
 * なぜ: 空集合 (明示的な無効) と NULL (未設定) を列上で区別するため
 */
package com.example.notifier.repository;

import com.example.notifier.model.NotificationChannel;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

final class ChannelSetCodec {

  private ChannelSetCodec() {}

  static String encode(Set<NotificationChannel> channels) {
    if (channels == null) {
      return null;
    }
    return EnumSet.copyOf(channels.isEmpty() ? EnumSet.noneOf(NotificationChannel.class) : channels)
        .stream()
        .map(NotificationChannel::name)
        .collect(Collectors.joining(","));
  }

  static Set<NotificationChannel> decode(String value) {
    if (value == null) {
      return null;
    }
    final EnumSet<NotificationChannel> channels = EnumSet.noneOf(NotificationChannel.class);
    Arrays.stream(value.split(","))
        .map(String::trim)
        .filter(token -> !token.isEmpty())
        .map(NotificationChannel::valueOf)
        .forEach(channels::add);
    return channels;
  }
}
