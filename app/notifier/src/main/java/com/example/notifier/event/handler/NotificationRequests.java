package com.example.notifier.event.handler;

import com.example.common.event.DomainEventPayload.Participant;
import com.example.notifier.event.DomainEvent;
import com.example.notifier.event.TemplateDataBuilder;
import com.example.notifier.model.NotificationPriority;
import com.example.notifier.model.NotificationTrigger;
import com.example.notifier.model.OverrideTarget;
import com.example.notifier.service.NotificationRequest;

final class NotificationRequests {

  private NotificationRequests() {}

  static NotificationRequest to(
      Participant addressee,
      Participant match,
      DomainEvent event,
      NotificationTrigger trigger,
      NotificationPriority priority,
      String dedupKey,
      OverrideTarget relatedTarget) {
    return new NotificationRequest(
        addressee.username(),
        trigger,
        null,
        TemplateDataBuilder.build(event.eventType(), match, addressee, event.context()),
        priority,
        dedupKey,
        relatedTarget);
  }

  static NotificationRequest to(
      Participant addressee,
      Participant match,
      DomainEvent event,
      NotificationTrigger trigger,
      NotificationPriority priority) {
    return to(addressee, match, event, trigger, priority, null, null);
  }

  static boolean hasUsername(Participant participant) {
    return participant != null && participant.username() != null && !participant.username().isBlank();
  }
}
