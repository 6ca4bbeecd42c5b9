/*
 * どこで: Notifier アプリのインフラ設定
 * 何を: ドメインイベント購読用の NATS Connection を Spring 管理下に置く
 * なぜ: 接続状態の変化をログに残し、購読停止の原因を追えるようにするため
 */
package com.example.notifier.config;

import io.nats.client.Connection;
import io.nats.client.ConnectionListener;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsConfig {

  private static final Logger logger = LoggerFactory.getLogger(NatsConfig.class);

  @Bean(destroyMethod = "close")
  public Connection natsConnection(NatsProperties properties)
      throws IOException, InterruptedException {
    final ConnectionListener listener =
        (connection, event) ->
            logger.info("nats connection event event={} url={}", event, connection.getConnectedUrl());
    final Options.Builder builder =
        new Options.Builder()
            .server(properties.url())
            .connectionTimeout(Duration.ofSeconds(properties.connectionTimeout()))
            .connectionListener(listener);
    if (properties.maxReconnects() != null) {
      builder.maxReconnects(properties.maxReconnects());
    }
    if (properties.connectionName() != null && !properties.connectionName().isBlank()) {
      builder.connectionName(properties.connectionName());
    }
    return Nats.connect(builder.build());
  }
}
