package com.example.notifier.event.handler;

import com.example.notifier.event.DomainEvent;
import com.example.notifier.event.DomainEventHandler;
import com.example.notifier.model.NotificationPriority;
import com.example.notifier.model.NotificationTrigger;
import com.example.notifier.service.NotificationRequest;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/** 不審なログインはアカウント本人 (actor) に CRITICAL で送る。静音時間でも遅延しない。 */
@Component
public class SecurityEventHandler implements DomainEventHandler {

  static final String SUSPICIOUS_LOGIN = "suspicious_login";

  @Override
  public Set<String> eventTypes() {
    return Set.of(SUSPICIOUS_LOGIN);
  }

  @Override
  public List<NotificationRequest> buildRequests(DomainEvent event) {
    if (!NotificationRequests.hasUsername(event.actor())) {
      return List.of();
    }
    return List.of(
        NotificationRequests.to(
            event.actor(),
            null,
            event,
            NotificationTrigger.SUSPICIOUS_LOGIN,
            NotificationPriority.CRITICAL));
  }
}
