/*
 * どこで: Notifier 配信層
 * 何を: CI/Test 専用で送信失敗を注入するプロバイダ
 * なぜ: 実コード経路を汚さずに E2E で retry -> FAILED を再現するため
 */
package com.example.notifier.service.channel;

import com.example.notifier.model.NotificationChannel;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Profile;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "notification.delivery.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingChannelProvider implements ChannelProvider {

  private final List<LocalChannelProvider> delegates;

  @Value("${notification.delivery.failure-injection.username-prefix:}")
  private String usernamePrefix;

  @Override
  public boolean supports(NotificationChannel channel) {
    return delegates.stream().anyMatch(delegate -> delegate.supports(channel));
  }

  @Override
  public void send(
      NotificationChannel channel,
      String recipientAddress,
      String subject,
      String body,
      Map<String, String> metadata) {
    final String username = metadata.get(ChannelMetadata.USERNAME);
    if (shouldInjectFailure(username)) {
      throw new ChannelProviderException(
          "notification delivery failure injection matched username=" + username);
    }
    delegates.stream()
        .filter(delegate -> delegate.supports(channel))
        .findFirst()
        .orElseThrow(() -> new ChannelProviderException("no provider for channel " + channel.key()))
        .send(channel, recipientAddress, subject, body, metadata);
  }

  private boolean shouldInjectFailure(String username) {
    if (usernamePrefix == null || usernamePrefix.isBlank() || username == null) {
      return false;
    }
    return username.startsWith(usernamePrefix);
  }
}
