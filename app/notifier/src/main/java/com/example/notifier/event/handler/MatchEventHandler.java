package com.example.notifier.event.handler;

import com.example.notifier.event.DomainEvent;
import com.example.notifier.event.DomainEventHandler;
import com.example.notifier.model.NotificationPriority;
import com.example.notifier.model.NotificationTrigger;
import com.example.notifier.model.OverrideTarget;
import com.example.notifier.service.NotificationRequest;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * マッチングと保存検索の結果通知。
 *
 * <p>保存検索は検索 ID 単位で管理者停止できるため、関連対象として (SAVED_SEARCH, user, searchId) を付ける。
 */
@Component
public class MatchEventHandler implements DomainEventHandler {

  static final String NEW_MATCH = "new_match";
  static final String SAVED_SEARCH_MATCH = "saved_search_match";
  static final String CONTEXT_SEARCH_ID = "searchId";

  @Override
  public Set<String> eventTypes() {
    return Set.of(NEW_MATCH, SAVED_SEARCH_MATCH);
  }

  @Override
  public List<NotificationRequest> buildRequests(DomainEvent event) {
    if (!NotificationRequests.hasUsername(event.target()) || event.isSelfAction()) {
      return List.of();
    }
    if (NEW_MATCH.equals(event.eventType())) {
      if (!NotificationRequests.hasUsername(event.actor())) {
        return List.of();
      }
      return List.of(
          NotificationRequests.to(
              event.target(),
              event.actor(),
              event,
              NotificationTrigger.NEW_MATCH,
              NotificationPriority.MEDIUM));
    }
    final String searchId = event.contextString(CONTEXT_SEARCH_ID);
    if (searchId == null || searchId.isBlank()) {
      throw new IllegalArgumentException("saved_search_match requires context.searchId");
    }
    return List.of(
        NotificationRequests.to(
            event.target(),
            event.actor(),
            event,
            NotificationTrigger.SAVED_SEARCH_MATCHES,
            NotificationPriority.MEDIUM,
            null,
            OverrideTarget.savedSearch(event.target().username(), searchId)));
  }
}
