/*
 * どこで: Notifier NATS 購読
 * 何を: ドメインイベント (JSON) を JetStream から購読し取り込みサービスへ渡す
 * なぜ: 他サービスの操作を通知振り分けに繋ぎ、失敗種別ごとに再配信を制御するため
 */
package com.example.notifier.nats;

import com.example.common.event.DomainEventPayload;
import com.example.notifier.config.DomainEventNatsProperties;
import com.example.notifier.event.DispatchReport;
import com.example.notifier.event.DomainEventIngestService;
import com.example.notifier.event.DomainEventPermanentException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class DomainEventSubscriber {

  private static final Logger logger = LoggerFactory.getLogger(DomainEventSubscriber.class);
  private static final int STREAM_NOT_FOUND_ERROR = 404;
  private static final int STREAM_NOT_FOUND_API_ERROR = 10059;
  private static final List<String> EVENT_MDC_KEYS = List.of("event_id", "event_type", "trace_id");

  private final Connection connection;
  private final DomainEventIngestService ingestService;
  private final DomainEventNatsProperties properties;
  private final ObjectMapper objectMapper;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private Dispatcher dispatcher;
  private JetStreamSubscription subscription;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Connection and ObjectMapper are shared Spring beans")
  public DomainEventSubscriber(
      Connection connection,
      DomainEventIngestService ingestService,
      DomainEventNatsProperties properties,
      ObjectMapper objectMapper) {
    this.connection = connection;
    this.ingestService = ingestService;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @PostConstruct
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    try {
      ensureStream();
      final JetStream jetStream = connection.jetStream();
      dispatcher = connection.createDispatcher();
      subscription =
          jetStream.subscribe(
              properties.subject(),
              dispatcher,
              this::handleMessage,
              false,
              buildPushSubscribeOptions());
      logger.info(
          "domain event subscriber started subject={} stream={} durable={}",
          properties.subject(),
          properties.stream(),
          properties.durable());
    } catch (IOException | JetStreamApiException ex) {
      started.set(false);
      throw new IllegalStateException("failed to start JetStream subscription", ex);
    }
  }

  @PreDestroy
  public void stop() {
    if (subscription != null) {
      subscription.unsubscribe();
      subscription = null;
    }
    if (dispatcher != null) {
      connection.closeDispatcher(dispatcher);
      dispatcher = null;
    }
  }

  @VisibleForTesting
  void handleMessage(Message message) {
    final DomainEventPayload payload;
    try {
      payload = objectMapper.readValue(message.getData(), DomainEventPayload.class);
    } catch (IOException ex) {
      // payload 破損は再配信で回復しないため恒久的に TERM する
      logger.warn("failed to parse domain event payload", ex);
      termSilently(message);
      return;
    }
    putEventMdc(payload);
    try {
      final DispatchReport report = ingestService.ingest(payload);
      message.ack();
      if (report != null && (report.rejected() > 0 || report.failed() > 0)) {
        logger.info(
            "domain event handled with rejections eventType={} requests={} enqueued={} rejected={} failed={}",
            report.eventType(),
            report.requestsBuilt(),
            report.enqueued(),
            report.rejected(),
            report.failed());
      }
    } catch (DomainEventPermanentException ex) {
      logger.warn("permanent failure while handling domain event", ex);
      termSilently(message);
    } catch (DataAccessException ex) {
      // DB の一時障害は ack-wait 経過後の再配信で回復させる
      logger.warn("temporary failure while handling domain event", ex);
      nakSilently(message);
    } catch (RuntimeException ex) {
      // 分類できない失敗は max-deliver に達するまで再配信させる
      logger.warn("failed to handle domain event", ex);
      nakSilently(message);
    } finally {
      EVENT_MDC_KEYS.forEach(MDC::remove);
    }
  }

  private void putEventMdc(DomainEventPayload payload) {
    putIfPresent("event_id", payload.eventId());
    putIfPresent("event_type", payload.eventType());
    putIfPresent("trace_id", payload.traceId());
  }

  private void putIfPresent(String key, String value) {
    if (value != null && !value.isBlank()) {
      MDC.put(key, value);
    }
  }

  private void ensureStream() throws IOException, JetStreamApiException {
    // Nats-Msg-Id による重複排除を有効化するため stream を必ず作成する
    final StreamConfiguration streamConfiguration =
        StreamConfiguration.builder()
            .name(properties.stream())
            .subjects(properties.subject())
            .duplicateWindow(properties.duplicateWindow())
            .build();
    final JetStreamManagement jetStreamManagement = connection.jetStreamManagement();
    try {
      jetStreamManagement.updateStream(streamConfiguration);
    } catch (JetStreamApiException ex) {
      if (ex.getApiErrorCode() != STREAM_NOT_FOUND_API_ERROR
          && ex.getErrorCode() != STREAM_NOT_FOUND_ERROR) {
        throw ex;
      }
      jetStreamManagement.addStream(streamConfiguration);
    }
    logger.info(
        "domain event stream ensured stream={} subject={} duplicateWindow={}",
        properties.stream(),
        properties.subject(),
        properties.duplicateWindow());
  }

  private PushSubscribeOptions buildPushSubscribeOptions() {
    final ConsumerConfiguration consumerConfiguration =
        ConsumerConfiguration.builder()
            .ackPolicy(AckPolicy.Explicit)
            .ackWait(properties.ackWait())
            .maxDeliver(properties.maxDeliver())
            .build();
    return PushSubscribeOptions.builder()
        .stream(properties.stream())
        .durable(properties.durable())
        .configuration(consumerConfiguration)
        .build();
  }

  private void nakSilently(Message message) {
    try {
      message.nak();
    } catch (IllegalStateException ex) {
      logger.warn("failed to nack nats message", ex);
    }
  }

  private void termSilently(Message message) {
    try {
      message.term();
    } catch (IllegalStateException ex) {
      logger.warn("failed to term nats message", ex);
    }
  }
}
