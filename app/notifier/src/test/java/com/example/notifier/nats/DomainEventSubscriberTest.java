/*
 * どこで: Notifier NATS JetStream 購読テスト
 * 何を: start() で handleMessage が配線されることと ack/nak/term の振り分けを検証する
 * なぜ: 一時的失敗は再配信し、恒久的失敗は捨てる契約を保証するため
 */
package com.example.notifier.nats;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.common.event.DomainEventPayload;
import com.example.notifier.config.DomainEventNatsProperties;
import com.example.notifier.event.DomainEventIngestService;
import com.example.notifier.event.DomainEventPermanentException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.MessageHandler;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.Error;
import io.nats.client.api.StreamConfiguration;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class DomainEventSubscriberTest {

  private static final String SUBJECT = "profile.events";
  private static final String STREAM = "profile-events";
  private static final String DURABLE = "notifier-domain-event-consumer";
  private static final Duration DUPLICATE_WINDOW = Duration.ofMinutes(2);
  private static final Duration ACK_WAIT = Duration.ofSeconds(30);
  private static final int MAX_DELIVER = 10;
  private static final String EVENT_JSON =
      """
      {
        "event_id": "11111111-1111-1111-1111-111111111111",
        "event_type": "favorite_added",
        "occurred_at": "2026-03-04T12:00:00Z",
        "actor": {"username": "bob", "display_name": "Bob", "hide_favorites": false},
        "target": {"username": "alice"},
        "context": {"source": "web"},
        "trace_id": "trace-1"
      }
      """;

  @Mock private Connection connection;
  @Mock private JetStream jetStream;
  @Mock private JetStreamManagement jetStreamManagement;
  @Mock private Dispatcher dispatcher;
  @Mock private JetStreamSubscription subscription;
  @Mock private DomainEventIngestService ingestService;

  @Captor private ArgumentCaptor<MessageHandler> handlerCaptor;
  @Captor private ArgumentCaptor<PushSubscribeOptions> optionsCaptor;

  private DomainEventSubscriber subscriber;

  @BeforeEach
  void setUp() {
    final DomainEventNatsProperties properties =
        new DomainEventNatsProperties(SUBJECT, STREAM, DURABLE, DUPLICATE_WINDOW, ACK_WAIT, MAX_DELIVER);
    subscriber = new DomainEventSubscriber(connection, ingestService, properties, new ObjectMapper());
  }

  @Test
  void ackWhenIngestedSuccessfully() throws Exception {
    final Message message = startAndReceive(EVENT_JSON.getBytes(StandardCharsets.UTF_8));

    final ArgumentCaptor<DomainEventPayload> payloadCaptor = ArgumentCaptor.forClass(DomainEventPayload.class);
    verify(ingestService).ingest(payloadCaptor.capture());
    final DomainEventPayload payload = payloadCaptor.getValue();
    assertThat(payload.eventType()).isEqualTo("favorite_added");
    assertThat(payload.actor().displayName()).isEqualTo("Bob");
    assertThat(payload.target().username()).isEqualTo("alice");
    assertThat(payload.context()).containsEntry("source", "web");
    verify(message).ack();
    verify(message, never()).nak();
  }

  @Test
  void eventKeysAreOnMdcOnlyWhileHandling() throws Exception {
    final String[] seen = new String[2];
    when(ingestService.ingest(any()))
        .thenAnswer(
            invocation -> {
              seen[0] = MDC.get("event_id");
              seen[1] = MDC.get("trace_id");
              return null;
            });

    startAndReceive(EVENT_JSON.getBytes(StandardCharsets.UTF_8));

    assertThat(seen).containsExactly("11111111-1111-1111-1111-111111111111", "trace-1");
    assertThat(MDC.get("event_id")).isNull();
    assertThat(MDC.get("trace_id")).isNull();
  }

  @Test
  void nakWhenIngestFailsTemporarily() throws Exception {
    doThrow(new DataAccessResourceFailureException("boom")).when(ingestService).ingest(any());

    final Message message = startAndReceive(EVENT_JSON.getBytes(StandardCharsets.UTF_8));

    verify(message, never()).ack();
    verify(message).nak();
  }

  @Test
  void nakWhenIngestFailsUnexpectedly() throws Exception {
    doThrow(new IllegalStateException("boom")).when(ingestService).ingest(any());

    final Message message = startAndReceive(EVENT_JSON.getBytes(StandardCharsets.UTF_8));

    verify(message).nak();
    verify(message, never()).term();
  }

  @Test
  void termWhenIngestFailsPermanently() throws Exception {
    doThrow(new DomainEventPermanentException("invalid domain event event_id"))
        .when(ingestService)
        .ingest(any());

    final Message message = startAndReceive(EVENT_JSON.getBytes(StandardCharsets.UTF_8));

    verify(message).term();
    verify(message, never()).ack();
    verify(message, never()).nak();
  }

  @Test
  void termWhenPayloadParseFails() throws Exception {
    final Message message = startAndReceive("{not json".getBytes(StandardCharsets.UTF_8));

    verify(message).term();
    verify(message, never()).ack();
    verifyNoInteractions(ingestService);
  }

  @Test
  void swallowExceptionWhenNakFails() throws Exception {
    doThrow(new DataAccessResourceFailureException("boom")).when(ingestService).ingest(any());
    final Message message = mock(Message.class);
    when(message.getData()).thenReturn(EVENT_JSON.getBytes(StandardCharsets.UTF_8));
    doThrow(new IllegalStateException("nak-failed")).when(message).nak();
    startSubscriber();

    assertThatCode(() -> handlerCaptor.getValue().onMessage(message)).doesNotThrowAnyException();
    verify(message).nak();
  }

  @Test
  void startCreatesStreamWhenMissing() throws Exception {
    when(jetStreamManagement.updateStream(any(StreamConfiguration.class))).thenThrow(new StreamNotFoundException());
    startSubscriber();

    final ArgumentCaptor<StreamConfiguration> streamCaptor = ArgumentCaptor.forClass(StreamConfiguration.class);
    verify(jetStreamManagement).addStream(streamCaptor.capture());
    assertThat(streamCaptor.getValue().getName()).isEqualTo(STREAM);
    assertThat(streamCaptor.getValue().getDuplicateWindow()).isEqualTo(DUPLICATE_WINDOW);
  }

  @Test
  void startUsesAckWaitAndMaxDeliver() throws Exception {
    stubConnection();
    when(jetStream.subscribe(
            eq(SUBJECT), eq(dispatcher), any(MessageHandler.class), eq(false), optionsCaptor.capture()))
        .thenReturn(subscription);

    subscriber.start();

    final PushSubscribeOptions options = optionsCaptor.getValue();
    assertThat(options.getConsumerConfiguration().getAckWait()).isEqualTo(ACK_WAIT);
    assertThat(options.getConsumerConfiguration().getMaxDeliver()).isEqualTo(MAX_DELIVER);
    assertThat(options.getDurable()).isEqualTo(DURABLE);
  }

  @Test
  void stopIsIdempotent() throws Exception {
    startSubscriber();

    assertThatCode(subscriber::stop).doesNotThrowAnyException();
    assertThatCode(subscriber::stop).doesNotThrowAnyException();

    verify(subscription, times(1)).unsubscribe();
    verify(connection, times(1)).closeDispatcher(dispatcher);
  }

  private Message startAndReceive(byte[] data) throws Exception {
    final Message message = mock(Message.class);
    when(message.getData()).thenReturn(data);
    startSubscriber();
    handlerCaptor.getValue().onMessage(message);
    return message;
  }

  private void startSubscriber() throws Exception {
    stubConnection();
    when(jetStream.subscribe(
            eq(SUBJECT), eq(dispatcher), handlerCaptor.capture(), eq(false), any(PushSubscribeOptions.class)))
        .thenReturn(subscription);
    subscriber.start();
  }

  private void stubConnection() throws IOException {
    when(connection.jetStream()).thenReturn(jetStream);
    when(connection.jetStreamManagement()).thenReturn(jetStreamManagement);
    when(connection.createDispatcher()).thenReturn(dispatcher);
  }

  private static final class StreamNotFoundException extends JetStreamApiException {
    private StreamNotFoundException() {
      super(Error.JsBadRequestErr);
    }

    @Override
    public int getApiErrorCode() {
      return 10059;
    }

    @Override
    public int getErrorCode() {
      return 404;
    }
  }
}
