package com.example.notifier.event.handler;

import com.example.notifier.event.DomainEvent;
import com.example.notifier.event.DomainEventHandler;
import com.example.notifier.model.NotificationPriority;
import com.example.notifier.model.NotificationTrigger;
import com.example.notifier.service.NotificationRequest;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/** 連絡先開示の依頼/承認/拒否。宛先は常に target。 */
@Component
public class PiiEventHandler implements DomainEventHandler {

  static final String PII_REQUESTED = "pii_requested";
  static final String PII_GRANTED = "pii_granted";
  static final String PII_REJECTED = "pii_rejected";

  @Override
  public Set<String> eventTypes() {
    return Set.of(PII_REQUESTED, PII_GRANTED, PII_REJECTED);
  }

  @Override
  public List<NotificationRequest> buildRequests(DomainEvent event) {
    if (!NotificationRequests.hasUsername(event.actor())
        || !NotificationRequests.hasUsername(event.target())
        || event.isSelfAction()) {
      return List.of();
    }
    final NotificationTrigger trigger;
    final NotificationPriority priority;
    switch (event.eventType()) {
      case PII_REQUESTED -> {
        trigger = NotificationTrigger.PII_REQUEST;
        priority = NotificationPriority.HIGH;
      }
      case PII_GRANTED -> {
        trigger = NotificationTrigger.PII_GRANTED;
        priority = NotificationPriority.HIGH;
      }
      case PII_REJECTED -> {
        trigger = NotificationTrigger.PII_DENIED;
        priority = NotificationPriority.MEDIUM;
      }
      default -> {
        return List.of();
      }
    }
    return List.of(NotificationRequests.to(event.target(), event.actor(), event, trigger, priority));
  }
}
