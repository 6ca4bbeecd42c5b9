/*
 * どこで: Notifier イベント振り分け
 * 何を: お気に入り/相互お気に入り/ショートリストの操作を通知要求に変換する
 * なぜ: お気に入りを非公開にしているユーザーの操作を相手に知らせないため
 */
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
public class FavoriteEventHandler implements DomainEventHandler {

  static final String FAVORITE_ADDED = "favorite_added";
  static final String MUTUAL_FAVORITE = "mutual_favorite";
  static final String SHORTLIST_ADDED = "shortlist_added";

  @Override
  public Set<String> eventTypes() {
    return Set.of(FAVORITE_ADDED, MUTUAL_FAVORITE, SHORTLIST_ADDED);
  }

  @Override
  public List<NotificationRequest> buildRequests(DomainEvent event) {
    if (!NotificationRequests.hasUsername(event.actor())
        || !NotificationRequests.hasUsername(event.target())
        || event.isSelfAction()) {
      return List.of();
    }
    return switch (event.eventType()) {
      case FAVORITE_ADDED -> {
        if (event.actor().hideFavorites()) {
          yield List.of();
        }
        yield List.of(
            NotificationRequests.to(
                event.target(),
                event.actor(),
                event,
                NotificationTrigger.FAVORITED,
                NotificationPriority.MEDIUM));
      }
      // 双方に相手を match として通知する
      case MUTUAL_FAVORITE -> List.of(
          NotificationRequests.to(
              event.target(),
              event.actor(),
              event,
              NotificationTrigger.MUTUAL_FAVORITE,
              NotificationPriority.HIGH),
          NotificationRequests.to(
              event.actor(),
              event.target(),
              event,
              NotificationTrigger.MUTUAL_FAVORITE,
              NotificationPriority.HIGH));
      case SHORTLIST_ADDED -> List.of(
          NotificationRequests.to(
              event.target(),
              event.actor(),
              event,
              NotificationTrigger.SHORTLIST_ADDED,
              NotificationPriority.MEDIUM));
      default -> List.of();
    };
  }
}
