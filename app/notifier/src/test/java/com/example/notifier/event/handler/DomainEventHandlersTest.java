/*
 * どこで: Notifier イベントハンドラのユニットテスト
 * 何を: 操作ごとの宛先/トリガー/優先度と抑止条件を検証する
 * なぜ: 非公開設定や自分自身への操作で通知が漏れないことを保証するため
 */
package com.example.notifier.event.handler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.common.event.DomainEventPayload.Participant;
import com.example.notifier.event.DomainEvent;
import com.example.notifier.model.NotificationChannel;
import com.example.notifier.model.NotificationPriority;
import com.example.notifier.model.NotificationTrigger;
import com.example.notifier.model.OverrideTarget;
import com.example.notifier.service.NotificationRequest;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DomainEventHandlersTest {

  private static final Participant ALICE =
      new Participant("alice", "Alice", Map.of("city", "Osaka"), false, false);
  private static final Participant BOB = new Participant("bob", null, Map.of(), false, false);
  private static final Participant SHY_BOB = new Participant("bob", "Bob", Map.of(), true, true);

  @Test
  void favoriteAddedNotifiesTargetWithActorAsMatch() {
    final List<NotificationRequest> requests =
        new FavoriteEventHandler().buildRequests(event("favorite_added", BOB, ALICE, Map.of()));

    assertThat(requests).hasSize(1);
    final NotificationRequest request = requests.get(0);
    assertThat(request.username()).isEqualTo("alice");
    assertThat(request.trigger()).isEqualTo(NotificationTrigger.FAVORITED);
    assertThat(request.priority()).isEqualTo(NotificationPriority.MEDIUM);
    assertThat(request.requestedChannels()).containsExactlyInAnyOrder(NotificationChannel.values());
    @SuppressWarnings("unchecked")
    final Map<String, Object> match = (Map<String, Object>) request.templateData().get("match");
    // displayName が無ければ username を使う
    assertThat(match).containsEntry("username", "bob").containsEntry("displayName", "bob");
    assertThat(request.templateData()).containsEntry("eventType", "favorite_added");
  }

  @Test
  void favoriteAddedIsSuppressedWhenActorHidesFavorites() {
    assertThat(new FavoriteEventHandler().buildRequests(event("favorite_added", SHY_BOB, ALICE, Map.of())))
        .isEmpty();
  }

  @Test
  void mutualFavoriteNotifiesBothSides() {
    final List<NotificationRequest> requests =
        new FavoriteEventHandler().buildRequests(event("mutual_favorite", BOB, ALICE, Map.of()));

    assertThat(requests)
        .extracting(NotificationRequest::username)
        .containsExactlyInAnyOrder("alice", "bob");
    assertThat(requests).allSatisfy(r -> assertThat(r.priority()).isEqualTo(NotificationPriority.HIGH));
  }

  @Test
  void selfActionsAreIgnored() {
    assertThat(new FavoriteEventHandler().buildRequests(event("shortlist_added", ALICE, ALICE, Map.of())))
        .isEmpty();
    assertThat(new ProfileViewEventHandler().buildRequests(event("profile_viewed", ALICE, ALICE, Map.of())))
        .isEmpty();
  }

  @Test
  void profileViewIsSuppressedWhenViewerHidesViews() {
    assertThat(new ProfileViewEventHandler().buildRequests(event("profile_viewed", SHY_BOB, ALICE, Map.of())))
        .isEmpty();

    final List<NotificationRequest> visible =
        new ProfileViewEventHandler().buildRequests(event("profile_viewed", BOB, ALICE, Map.of()));
    assertThat(visible).hasSize(1);
    assertThat(visible.get(0).trigger()).isEqualTo(NotificationTrigger.PROFILE_VIEW);
    assertThat(visible.get(0).priority()).isEqualTo(NotificationPriority.LOW);
  }

  @Test
  void messageSentUsesConversationAndMessageAsDedupKey() {
    final List<NotificationRequest> requests =
        new MessageEventHandler()
            .buildRequests(
                event("message_sent", BOB, ALICE, Map.of("conversationId", "c-1", "messageId", "m-9")));

    assertThat(requests).hasSize(1);
    assertThat(requests.get(0).trigger()).isEqualTo(NotificationTrigger.NEW_MESSAGE);
    assertThat(requests.get(0).priority()).isEqualTo(NotificationPriority.HIGH);
    assertThat(requests.get(0).dedupKey()).isEqualTo("c-1:m-9");
  }

  @Test
  void messageReadHasNoDedupKey() {
    final List<NotificationRequest> requests =
        new MessageEventHandler().buildRequests(event("message_read", BOB, ALICE, Map.of()));

    assertThat(requests.get(0).trigger()).isEqualTo(NotificationTrigger.MESSAGE_READ);
    assertThat(requests.get(0).dedupKey()).isNull();
  }

  @Test
  void piiEventsMapToTriggersAndPriorities() {
    final PiiEventHandler handler = new PiiEventHandler();

    assertThat(handler.buildRequests(event("pii_requested", BOB, ALICE, Map.of("field", "phone"))))
        .singleElement()
        .satisfies(
            r -> {
              assertThat(r.trigger()).isEqualTo(NotificationTrigger.PII_REQUEST);
              assertThat(r.priority()).isEqualTo(NotificationPriority.HIGH);
            });
    assertThat(handler.buildRequests(event("pii_granted", BOB, ALICE, Map.of())))
        .singleElement()
        .satisfies(r -> assertThat(r.trigger()).isEqualTo(NotificationTrigger.PII_GRANTED));
    assertThat(handler.buildRequests(event("pii_rejected", BOB, ALICE, Map.of())))
        .singleElement()
        .satisfies(
            r -> {
              assertThat(r.trigger()).isEqualTo(NotificationTrigger.PII_DENIED);
              assertThat(r.priority()).isEqualTo(NotificationPriority.MEDIUM);
            });
  }

  @Test
  void suspiciousLoginGoesToActorAsCritical() {
    final List<NotificationRequest> requests =
        new SecurityEventHandler()
            .buildRequests(event("suspicious_login", ALICE, null, Map.of("location", "Lisbon")));

    assertThat(requests).hasSize(1);
    assertThat(requests.get(0).username()).isEqualTo("alice");
    assertThat(requests.get(0).priority()).isEqualTo(NotificationPriority.CRITICAL);
    assertThat(requests.get(0).templateData()).doesNotContainKey("match");
  }

  @Test
  void savedSearchMatchCarriesSavedSearchTarget() {
    final List<NotificationRequest> requests =
        new MatchEventHandler()
            .buildRequests(event("saved_search_match", null, ALICE, Map.of("searchId", "s-7", "count", 4)));

    assertThat(requests).hasSize(1);
    assertThat(requests.get(0).trigger()).isEqualTo(NotificationTrigger.SAVED_SEARCH_MATCHES);
    assertThat(requests.get(0).relatedTarget()).isEqualTo(OverrideTarget.savedSearch("alice", "s-7"));
  }

  @Test
  void savedSearchMatchWithoutSearchIdIsRejected() {
    final DomainEvent event = event("saved_search_match", null, ALICE, Map.of());

    assertThatThrownBy(() -> new MatchEventHandler().buildRequests(event))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void newMatchNotifiesTarget() {
    final List<NotificationRequest> requests =
        new MatchEventHandler().buildRequests(event("new_match", BOB, ALICE, Map.of()));

    assertThat(requests).hasSize(1);
    assertThat(requests.get(0).trigger()).isEqualTo(NotificationTrigger.NEW_MATCH);
    assertThat(requests.get(0).relatedTarget()).isNull();
  }

  private static DomainEvent event(
      String type, Participant actor, Participant target, Map<String, Object> context) {
    return new DomainEvent(type, actor, target, context);
  }
}
