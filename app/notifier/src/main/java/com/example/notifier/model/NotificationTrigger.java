/*
 * どこで: Notifier ドメインモデル
 * 何を: 通知を生むドメインイベント種別の閉じた列挙
 * なぜ: 追加時に全ユーザーの既定 preference を揃える対象を明確にするため
 */
package com.example.notifier.model;

public enum NotificationTrigger {
  NEW_PROFILE_CREATED,
  NEW_MATCH,
  MUTUAL_FAVORITE,
  SHORTLIST_ADDED,
  MATCH_MILESTONE,
  PROFILE_VIEW,
  FAVORITED,
  PROFILE_VISIBILITY_SPIKE,
  SEARCH_APPEARANCE,
  NEW_MESSAGE,
  MESSAGE_READ,
  CONVERSATION_COLD,
  PII_REQUEST,
  PII_GRANTED,
  PII_DENIED,
  PII_EXPIRING,
  SUSPICIOUS_LOGIN,
  UNREAD_MESSAGES,
  NEW_USERS_MATCHING,
  PROFILE_INCOMPLETE,
  UPLOAD_PHOTOS,
  WEEKLY_DIGEST,
  MONTHLY_DIGEST,
  SAVED_SEARCH_MATCHES,
  ADMIN_NOTICE
}
