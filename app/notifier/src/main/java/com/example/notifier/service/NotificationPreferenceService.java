/*
 * どこで: Notifier サービス層
 * 何を: ユーザーの通知設定 (トリガー別チャネル/頻度、タイムゾーン、静音時間) を管理する
 * なぜ: 全トリガー分の行が常に揃っている状態を作成時とバックフィルで保つため
 */
package com.example.notifier.service;

import com.example.notifier.model.NotificationPreferences;
import com.example.notifier.model.NotificationTrigger;
import com.example.notifier.model.QuietHours;
import com.example.notifier.model.TriggerPreference;
import com.example.notifier.repository.NotificationPreferenceRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class NotificationPreferenceService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationPreferenceService.class);

  private final NotificationPreferenceRepository preferenceRepository;
  private final DefaultNotificationPreferences defaults;
  private final Clock clock;

  /** 既存ユーザーでも欠けているトリガー行だけを補う。追加した行数を返す。 */
  @Transactional
  public int initializeUser(String username, ZoneId timezone) {
    requireUsername(username);
    final Instant now = Instant.now(clock);
    preferenceRepository.insertUserSettings(
        username, timezone == null ? ZoneId.of("UTC") : timezone, QuietHours.defaults(), now);
    final int inserted = preferenceRepository.insertMissing(username, defaults.all(), now);
    if (inserted > 0) {
      logger.info("notification preferences initialized username={} inserted={}", username, inserted);
    }
    return inserted;
  }

  public Optional<NotificationPreferences> find(String username) {
    return preferenceRepository.findByUsername(username);
  }

  public NotificationPreferences get(String username) {
    return find(username).orElseThrow(() -> new PreferencesNotFoundException(username));
  }

  @Transactional
  public NotificationPreferences updateTrigger(String username, TriggerPreference preference) {
    if (!preferenceRepository.existsUser(username)) {
      throw new PreferencesNotFoundException(username);
    }
    preferenceRepository.upsertTrigger(username, preference, Instant.now(clock));
    return get(username);
  }

  @Transactional
  public NotificationPreferences updateSettings(
      String username, ZoneId timezone, QuietHours quietHours) {
    final int updated =
        preferenceRepository.updateUserSettings(username, timezone, quietHours, Instant.now(clock));
    if (updated == 0) {
      throw new PreferencesNotFoundException(username);
    }
    return get(username);
  }

  /** 後から追加されたトリガーの既定行を batchSize 人分まで補う。 */
  public BackfillResult backfillMissing(int batchSize) {
    final List<TriggerPreference> all = defaults.all();
    final List<String> usernames =
        preferenceRepository.findUsernamesWithMissingTriggers(all.size(), batchSize);
    final Instant now = Instant.now(clock);
    int inserted = 0;
    for (String username : usernames) {
      inserted += preferenceRepository.insertMissing(username, all, now);
    }
    final int remaining = countMissingEntries();
    logger.info(
        "notification preference backfill users={} inserted={} remainingMissing={}",
        usernames.size(),
        inserted,
        remaining);
    return new BackfillResult(usernames.size(), inserted, remaining);
  }

  public int countMissingEntries() {
    return Math.max(preferenceRepository.countMissingEntries(defaults.knownTriggerNames()), 0);
  }

  public TriggerPreference defaultFor(NotificationTrigger trigger) {
    return defaults.forTrigger(trigger);
  }

  private void requireUsername(String username) {
    if (username == null || username.isBlank()) {
      throw new IllegalArgumentException("username is required");
    }
  }
}
