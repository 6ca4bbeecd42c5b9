/*
 * どこで: Notifier イベント振り分け
 * 何を: ドメイン操作を担当ハンドラへ渡し、組み立てた通知要求を enqueue する
 * なぜ: 通知の失敗で呼び出し元の操作 (お気に入り登録等) を失敗させないため
 */
package com.example.notifier.event;

import com.example.common.event.DomainEventPayload.Participant;
import com.example.notifier.service.EnqueueResult;
import com.example.notifier.service.NotificationRequest;
import com.example.notifier.service.NotificationService;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class EventDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(EventDispatcher.class);

  private final Map<String, DomainEventHandler> handlers = new HashMap<>();
  private final NotificationService notificationService;

  public EventDispatcher(List<DomainEventHandler> handlers, NotificationService notificationService) {
    this.notificationService = notificationService;
    for (DomainEventHandler handler : handlers) {
      for (String eventType : handler.eventTypes()) {
        final DomainEventHandler previous = this.handlers.putIfAbsent(eventType, handler);
        if (previous != null) {
          throw new IllegalStateException(
              "event type registered twice: "
                  + eventType
                  + " by "
                  + previous.getClass().getSimpleName()
                  + " and "
                  + handler.getClass().getSimpleName());
        }
      }
    }
  }

  public boolean supports(String eventType) {
    return handlers.containsKey(eventType);
  }

  /** 例外を呼び出し元へ投げない。結果は DispatchReport で返す。 */
  public DispatchReport dispatch(
      String eventType, Participant actor, Participant target, Map<String, Object> context) {
    final DomainEventHandler handler = eventType == null ? null : handlers.get(eventType);
    if (handler == null) {
      logger.info("no handler for event type eventType={}", eventType);
      return DispatchReport.unhandled(eventType);
    }
    final List<NotificationRequest> requests;
    try {
      requests = handler.buildRequests(new DomainEvent(eventType, actor, target, context));
    } catch (RuntimeException ex) {
      logger.error("failed to build notification requests eventType={}", eventType, ex);
      return new DispatchReport(eventType, true, 0, 0, 0, 1);
    }
    int enqueued = 0;
    int rejected = 0;
    int failed = 0;
    for (NotificationRequest request : requests) {
      try {
        final EnqueueResult result = notificationService.enqueue(request);
        if (result.enqueued()) {
          enqueued++;
        } else {
          rejected++;
          logger.debug(
              "notification rejected eventType={} username={} trigger={} reason={}",
              eventType,
              request.username(),
              request.trigger(),
              result.reason().code());
        }
      } catch (RuntimeException ex) {
        failed++;
        logger.error(
            "failed to enqueue notification eventType={} username={} trigger={}",
            eventType,
            request.username(),
            request.trigger(),
            ex);
      }
    }
    return new DispatchReport(eventType, true, requests.size(), enqueued, rejected, failed);
  }
}
