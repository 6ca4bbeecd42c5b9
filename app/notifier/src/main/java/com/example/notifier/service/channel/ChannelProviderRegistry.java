/*
 * どこで: Notifier 配信層
 * 何を: チャネルに対応するプロバイダを @Order 順に解決する
 * なぜ: テスト用プロバイダを既定実装より優先させるため
 */
package com.example.notifier.service.channel;

import com.example.notifier.model.NotificationChannel;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "プロバイダ一覧は Spring 管理の共有 Bean で防御的コピーが不要なため")
public class ChannelProviderRegistry {

  private final List<ChannelProvider> providers;

  public ChannelProviderRegistry(List<ChannelProvider> providers) {
    this.providers = providers;
  }

  public ChannelProvider resolve(NotificationChannel channel) {
    return providers.stream()
        .filter(provider -> provider.supports(channel))
        .findFirst()
        .orElseThrow(
            () -> new ChannelProviderException("no provider for channel " + channel.key()));
  }
}
