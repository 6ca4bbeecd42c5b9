/*
 * どこで: Notifier イベント取り込み
 * 何を: NATS で受けたドメインイベントを冪等に処理し、通知振り分けへ渡す
 * なぜ: at-least-once 配信で同じイベントから二重に通知を作らないため
 */
package com.example.notifier.event;

import com.example.common.event.DomainEventPayload;
import com.example.common.event.DomainEventPayload.Participant;
import com.example.notifier.model.RecipientContact;
import com.example.notifier.repository.ProcessedEventRepository;
import com.example.notifier.repository.RecipientContactRepository;
import com.example.notifier.service.NotificationPreferenceService;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class DomainEventIngestService {

  private static final Logger logger = LoggerFactory.getLogger(DomainEventIngestService.class);

  static final String PROFILE_CREATED = "profile_created";
  static final String RECIPIENT_CONTACT_UPDATED = "recipient_contact_updated";

  private final ProcessedEventRepository processedEventRepository;
  private final RecipientContactRepository recipientContactRepository;
  private final NotificationPreferenceService preferenceService;
  private final EventDispatcher dispatcher;
  private final Clock clock;

  /** 既に処理済みのイベントなら何もせず null を返す。 */
  @Transactional
  public DispatchReport ingest(DomainEventPayload payload) {
    final UUID eventId = parseEventId(payload);
    if (payload.eventType() == null || payload.eventType().isBlank()) {
      throw new DomainEventPermanentException("domain event event_type is required");
    }
    final Instant now = Instant.now(clock);
    // processed_events に先行登録して重複処理を抑止する
    if (!processedEventRepository.insertIfAbsent(eventId, now)) {
      logger.info(
          "duplicate domain event skipped eventId={} eventType={}", eventId, payload.eventType());
      return null;
    }
    return switch (payload.eventType()) {
      case PROFILE_CREATED -> {
        initializeProfile(payload, now);
        yield new DispatchReport(payload.eventType(), true, 0, 0, 0, 0);
      }
      case RECIPIENT_CONTACT_UPDATED -> {
        recipientContactRepository.upsert(contactOf(requireActor(payload), payload.context()), now);
        yield new DispatchReport(payload.eventType(), true, 0, 0, 0, 0);
      }
      default -> dispatcher.dispatch(
          payload.eventType(), payload.actor(), payload.target(), payload.context());
    };
  }

  private void initializeProfile(DomainEventPayload payload, Instant now) {
    final Participant actor = requireActor(payload);
    final int inserted = preferenceService.initializeUser(actor.username(), parseZone(payload));
    if (hasContact(payload.context())) {
      recipientContactRepository.upsert(contactOf(actor, payload.context()), now);
    }
    logger.info(
        "profile initialized username={} preferencesInserted={}", actor.username(), inserted);
  }

  private Participant requireActor(DomainEventPayload payload) {
    final Participant actor = payload.actor();
    if (actor == null || actor.username() == null || actor.username().isBlank()) {
      throw new DomainEventPermanentException(payload.eventType() + " requires actor.username");
    }
    return actor;
  }

  private ZoneId parseZone(DomainEventPayload payload) {
    final Object value = payload.context().get("timezone");
    if (value == null) {
      return null;
    }
    try {
      return ZoneId.of(value.toString());
    } catch (DateTimeException ex) {
      throw new DomainEventPermanentException("invalid timezone: " + value, ex);
    }
  }

  private boolean hasContact(Map<String, Object> context) {
    return context.get("email") != null
        || context.get("phone") != null
        || context.get("pushToken") != null;
  }

  private RecipientContact contactOf(Participant actor, Map<String, Object> context) {
    return new RecipientContact(
        actor.username(),
        stringOrNull(context.get("email")),
        stringOrNull(context.get("phone")),
        stringOrNull(context.get("pushToken")));
  }

  private String stringOrNull(Object value) {
    return value == null ? null : value.toString();
  }

  private UUID parseEventId(DomainEventPayload payload) {
    try {
      return UUID.fromString(payload.eventId());
    } catch (RuntimeException ex) {
      // event_id 不正は再配信しても回復しないため恒久的に扱う
      throw new DomainEventPermanentException("invalid domain event event_id", ex);
    }
  }
}
