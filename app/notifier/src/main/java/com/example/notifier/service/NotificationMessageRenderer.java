/*
 * どこで: Notifier 配信層
 * 何を: トリガーごとの件名/本文テンプレートに templateData を差し込む
 * なぜ: 送信時点で文面を確定させ、キューには素材データだけを保存するため
 */
package com.example.notifier.service;

import com.example.notifier.model.NotificationTrigger;
import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class NotificationMessageRenderer {

  // {key} または {a.b} 形式
  private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_]+(?:\\.[A-Za-z0-9_]+)*)}");

  private static final RenderedMessage FALLBACK =
      new RenderedMessage("You have a new notification", "Open the app to see what's new.");

  private final Map<NotificationTrigger, RenderedMessage> templates = defaultTemplates();

  public RenderedMessage render(NotificationTrigger trigger, Map<String, Object> templateData) {
    final RenderedMessage template = templates.getOrDefault(trigger, FALLBACK);
    final Map<String, Object> data = templateData == null ? Map.of() : templateData;
    return new RenderedMessage(fill(template.subject(), data), fill(template.body(), data));
  }

  String fill(String template, Map<String, Object> data) {
    final Matcher matcher = PLACEHOLDER.matcher(template);
    final StringBuilder result = new StringBuilder();
    while (matcher.find()) {
      final Object value = lookup(data, matcher.group(1));
      // 値が無いプレースホルダは空文字に置き換える
      matcher.appendReplacement(result, Matcher.quoteReplacement(value == null ? "" : value.toString()));
    }
    matcher.appendTail(result);
    return result.toString();
  }

  private Object lookup(Map<String, Object> data, String path) {
    Object current = data;
    for (String segment : path.split("\\.")) {
      if (!(current instanceof Map<?, ?> map)) {
        return null;
      }
      current = map.get(segment);
    }
    return current;
  }

  private static Map<NotificationTrigger, RenderedMessage> defaultTemplates() {
    final Map<NotificationTrigger, RenderedMessage> map = new EnumMap<>(NotificationTrigger.class);
    map.put(
        NotificationTrigger.NEW_PROFILE_CREATED,
        new RenderedMessage("Welcome aboard", "Hi {recipient.displayName}, your profile is live."));
    map.put(
        NotificationTrigger.NEW_MATCH,
        new RenderedMessage(
            "New match: {match.displayName}",
            "{match.displayName} matches what you are looking for. Take a look at their profile."));
    map.put(
        NotificationTrigger.MUTUAL_FAVORITE,
        new RenderedMessage(
            "It's mutual with {match.displayName}",
            "You and {match.displayName} have added each other to favorites."));
    map.put(
        NotificationTrigger.SHORTLIST_ADDED,
        new RenderedMessage(
            "{match.displayName} shortlisted you",
            "{match.displayName} added you to their shortlist."));
    map.put(
        NotificationTrigger.MATCH_MILESTONE,
        new RenderedMessage("A new milestone", "You reached {event.milestone} matches."));
    map.put(
        NotificationTrigger.PROFILE_VIEW,
        new RenderedMessage(
            "{match.displayName} viewed your profile",
            "{match.displayName} recently viewed your profile."));
    map.put(
        NotificationTrigger.FAVORITED,
        new RenderedMessage(
            "{match.displayName} added you to favorites",
            "{match.displayName} added you to their favorites. Have a look at their profile."));
    map.put(
        NotificationTrigger.PROFILE_VISIBILITY_SPIKE,
        new RenderedMessage("Your profile is getting attention", "Your profile views went up this week."));
    map.put(
        NotificationTrigger.SEARCH_APPEARANCE,
        new RenderedMessage("You appeared in searches", "Your profile appeared in {event.count} searches."));
    map.put(
        NotificationTrigger.NEW_MESSAGE,
        new RenderedMessage(
            "New message from {match.displayName}",
            "{match.displayName} sent you a message."));
    map.put(
        NotificationTrigger.MESSAGE_READ,
        new RenderedMessage(
            "{match.displayName} read your message",
            "{match.displayName} has read your message."));
    map.put(
        NotificationTrigger.CONVERSATION_COLD,
        new RenderedMessage(
            "Pick up where you left off",
            "Your conversation with {match.displayName} has gone quiet."));
    map.put(
        NotificationTrigger.PII_REQUEST,
        new RenderedMessage(
            "{match.displayName} requested your contact details",
            "{match.displayName} asked to see your {event.field}. Review the request in the app."));
    map.put(
        NotificationTrigger.PII_GRANTED,
        new RenderedMessage(
            "{match.displayName} shared their details",
            "{match.displayName} approved your request for {event.field}."));
    map.put(
        NotificationTrigger.PII_DENIED,
        new RenderedMessage(
            "Request declined",
            "{match.displayName} declined your request for {event.field}."));
    map.put(
        NotificationTrigger.PII_EXPIRING,
        new RenderedMessage("Shared details expiring", "Access to {event.field} expires soon."));
    map.put(
        NotificationTrigger.SUSPICIOUS_LOGIN,
        new RenderedMessage(
            "Suspicious sign-in detected",
            "We noticed a sign-in from {event.location} at {event.time}. If this wasn't you, reset your password."));
    map.put(
        NotificationTrigger.UNREAD_MESSAGES,
        new RenderedMessage("Unread messages", "You have {event.count} unread messages."));
    map.put(
        NotificationTrigger.NEW_USERS_MATCHING,
        new RenderedMessage("New people match your preferences", "{event.count} new profiles match you."));
    map.put(
        NotificationTrigger.PROFILE_INCOMPLETE,
        new RenderedMessage("Complete your profile", "Profiles with more details get more matches."));
    map.put(
        NotificationTrigger.UPLOAD_PHOTOS,
        new RenderedMessage("Add some photos", "Profiles with photos get noticed more."));
    map.put(
        NotificationTrigger.WEEKLY_DIGEST,
        new RenderedMessage("Your week in review", "Here is what happened this week."));
    map.put(
        NotificationTrigger.MONTHLY_DIGEST,
        new RenderedMessage("Your month in review", "Here is what happened this month."));
    map.put(
        NotificationTrigger.SAVED_SEARCH_MATCHES,
        new RenderedMessage(
            "New results for {event.searchName}",
            "Your saved search {event.searchName} has {event.count} new results."));
    map.put(
        NotificationTrigger.ADMIN_NOTICE,
        new RenderedMessage(
            "Notification settings changed",
            "An administrator turned off {event.target}. Reason: {event.reason}"));
    return map;
  }
}
