package com.example.notifier.event.handler;

import com.example.notifier.event.DomainEvent;
import com.example.notifier.event.DomainEventHandler;
import com.example.notifier.model.NotificationPriority;
import com.example.notifier.model.NotificationTrigger;
import com.example.notifier.service.NotificationRequest;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class MessageEventHandler implements DomainEventHandler {

  static final String MESSAGE_SENT = "message_sent";
  static final String MESSAGE_READ = "message_read";
  static final String CONTEXT_CONVERSATION_ID = "conversationId";
  static final String CONTEXT_MESSAGE_ID = "messageId";

  @Override
  public Set<String> eventTypes() {
    return Set.of(MESSAGE_SENT, MESSAGE_READ);
  }

  @Override
  public List<NotificationRequest> buildRequests(DomainEvent event) {
    if (!NotificationRequests.hasUsername(event.actor())
        || !NotificationRequests.hasUsername(event.target())
        || event.isSelfAction()) {
      return List.of();
    }
    if (MESSAGE_SENT.equals(event.eventType())) {
      return List.of(
          NotificationRequests.to(
              event.target(),
              event.actor(),
              event,
              NotificationTrigger.NEW_MESSAGE,
              NotificationPriority.HIGH,
              messageDedupKey(event),
              null));
    }
    return List.of(
        NotificationRequests.to(
            event.target(),
            event.actor(),
            event,
            NotificationTrigger.MESSAGE_READ,
            NotificationPriority.LOW));
  }

  // 同じメッセージの再送イベントを 1 通にまとめる
  private String messageDedupKey(DomainEvent event) {
    final String conversationId = event.contextString(CONTEXT_CONVERSATION_ID);
    final String messageId = event.contextString(CONTEXT_MESSAGE_ID);
    if (conversationId == null || messageId == null) {
      return null;
    }
    return conversationId + ":" + messageId;
  }
}
