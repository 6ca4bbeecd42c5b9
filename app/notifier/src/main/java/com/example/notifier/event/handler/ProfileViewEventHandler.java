package com.example.notifier.event.handler;

import com.example.notifier.event.DomainEvent;
import com.example.notifier.event.DomainEventHandler;
import com.example.notifier.model.NotificationPriority;
import com.example.notifier.model.NotificationTrigger;
import com.example.notifier.service.NotificationRequest;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/** 閲覧履歴を隠しているユーザーと自分自身の閲覧は通知しない。 */
@Component
public class ProfileViewEventHandler implements DomainEventHandler {

  static final String PROFILE_VIEWED = "profile_viewed";

  @Override
  public Set<String> eventTypes() {
    return Set.of(PROFILE_VIEWED);
  }

  @Override
  public List<NotificationRequest> buildRequests(DomainEvent event) {
    if (!NotificationRequests.hasUsername(event.actor())
        || !NotificationRequests.hasUsername(event.target())
        || event.isSelfAction()
        || event.actor().hideProfileViews()) {
      return List.of();
    }
    return List.of(
        NotificationRequests.to(
            event.target(),
            event.actor(),
            event,
            NotificationTrigger.PROFILE_VIEW,
            NotificationPriority.LOW));
  }
}
