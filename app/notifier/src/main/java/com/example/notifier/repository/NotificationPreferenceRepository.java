/*
 * どこで: Notifier データアクセス
 * 何を: notification_user_settings / notification_preferences の読み書きを担う
 * なぜ: 全トリガー分の行が揃っていることを DB 上で確認・補完できるようにするため
 */
package com.example.notifier.repository;

import static com.example.common.JdbcTimestampUtils.toLocalTime;
import static com.example.common.JdbcTimestampUtils.toSqlTime;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.notifier.model.NotificationFrequency;
import com.example.notifier.model.NotificationPreferences;
import com.example.notifier.model.NotificationTrigger;
import com.example.notifier.model.QuietHours;
import com.example.notifier.model.TriggerPreference;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationPreferenceRepository {

  private static final Logger logger =
      LoggerFactory.getLogger(NotificationPreferenceRepository.class);

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<NotificationPreferences> findByUsername(String username) {
    final String settingsSql =
        """
        SELECT username, timezone, quiet_hours_enabled, quiet_hours_start, quiet_hours_end
        FROM notification_user_settings
        WHERE username = :username
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("username", username);
    final List<UserSettingsRow> settings =
        jdbcTemplate.query(settingsSql, params, this::mapSettingsRow);
    if (settings.isEmpty()) {
      return Optional.empty();
    }
    final String triggersSql =
        """
        SELECT trigger_type, channels, frequency, send_time, day_of_week
        FROM notification_preferences
        WHERE username = :username
        """;
    final Map<NotificationTrigger, TriggerPreference> triggers =
        new EnumMap<>(NotificationTrigger.class);
    jdbcTemplate.query(
        triggersSql,
        params,
        (RowCallbackHandler)
            rs -> {
              final TriggerPreference preference = mapTriggerRow(rs);
              if (preference != null) {
                triggers.put(preference.trigger(), preference);
              }
            });
    final UserSettingsRow row = settings.get(0);
    return Optional.of(
        new NotificationPreferences(username, row.timezone(), row.quietHours(), triggers));
  }

  public boolean existsUser(String username) {
    final String sql =
        "SELECT COUNT(*) FROM notification_user_settings WHERE username = :username";
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("username", username), Integer.class);
    return count != null && count > 0;
  }

  public void insertUserSettings(
      String username, ZoneId timezone, QuietHours quietHours, Instant now) {
    final String sql =
        """
        INSERT INTO notification_user_settings (
          username, timezone, quiet_hours_enabled, quiet_hours_start, quiet_hours_end,
          created_at, updated_at
        ) VALUES (
          :username, :timezone, :quietEnabled, :quietStart, :quietEnd, :now, :now
        )
        ON CONFLICT (username) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("username", username)
            .addValue("timezone", timezone.getId())
            .addValue("quietEnabled", quietHours.enabled())
            .addValue("quietStart", toSqlTime(quietHours.start()))
            .addValue("quietEnd", toSqlTime(quietHours.end()))
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }

  public int updateUserSettings(
      String username, ZoneId timezone, QuietHours quietHours, Instant now) {
    final String sql =
        """
        UPDATE notification_user_settings
        SET timezone = :timezone,
            quiet_hours_enabled = :quietEnabled,
            quiet_hours_start = :quietStart,
            quiet_hours_end = :quietEnd,
            updated_at = :now
        WHERE username = :username
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("username", username)
            .addValue("timezone", timezone.getId())
            .addValue("quietEnabled", quietHours.enabled())
            .addValue("quietStart", toSqlTime(quietHours.start()))
            .addValue("quietEnd", toSqlTime(quietHours.end()))
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  /** 既存行は保持したまま、欠けているトリガー行だけを追加する。追加件数を返す。 */
  public int insertMissing(String username, List<TriggerPreference> defaults, Instant now) {
    final String sql =
        """
        INSERT INTO notification_preferences (
          username, trigger_type, channels, frequency, send_time, day_of_week, updated_at
        ) VALUES (
          :username, :trigger, :channels, :frequency, :sendTime, :dayOfWeek, :now
        )
        ON CONFLICT (username, trigger_type) DO NOTHING
        """;
    final List<SqlParameterSource> batch = new ArrayList<>(defaults.size());
    for (TriggerPreference preference : defaults) {
      batch.add(triggerParams(username, preference, now));
    }
    final int[] counts = jdbcTemplate.batchUpdate(sql, batch.toArray(new SqlParameterSource[0]));
    int inserted = 0;
    for (int count : counts) {
      // ドライバによっては SUCCESS_NO_INFO(-2) を返すため正の値だけ数える
      if (count > 0) {
        inserted += count;
      }
    }
    return inserted;
  }

  public void upsertTrigger(String username, TriggerPreference preference, Instant now) {
    final String sql =
        """
        INSERT INTO notification_preferences (
          username, trigger_type, channels, frequency, send_time, day_of_week, updated_at
        ) VALUES (
          :username, :trigger, :channels, :frequency, :sendTime, :dayOfWeek, :now
        )
        ON CONFLICT (username, trigger_type) DO UPDATE
        SET channels = EXCLUDED.channels,
            frequency = EXCLUDED.frequency,
            send_time = EXCLUDED.send_time,
            day_of_week = EXCLUDED.day_of_week,
            updated_at = EXCLUDED.updated_at
        """;
    jdbcTemplate.update(sql, triggerParams(username, preference, now));
  }

  /** 全トリガー分の行が揃っていないユーザーを返す。 */
  public List<String> findUsernamesWithMissingTriggers(int expectedTriggerCount, int limit) {
    final String sql =
        """
        SELECT s.username
        FROM notification_user_settings s
        LEFT JOIN notification_preferences p ON p.username = s.username
        GROUP BY s.username
        HAVING COUNT(p.trigger_type) < :expected
        ORDER BY s.username
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("expected", expectedTriggerCount)
            .addValue("limit", limit);
    return jdbcTemplate.queryForList(sql, params, String.class);
  }

  public int countMissingEntries(List<String> knownTriggers) {
    final String sql =
        """
        SELECT (SELECT COUNT(*) FROM notification_user_settings) * :expected
             - (SELECT COUNT(*)
                FROM notification_preferences
                WHERE trigger_type IN (:triggers))
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("expected", knownTriggers.size())
            .addValue("triggers", knownTriggers);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private MapSqlParameterSource triggerParams(
      String username, TriggerPreference preference, Instant now) {
    return new MapSqlParameterSource()
        .addValue("username", username)
        .addValue("trigger", preference.trigger().name())
        .addValue("channels", ChannelSetCodec.encode(preference.channels()))
        .addValue("frequency", preference.frequency().name())
        .addValue("sendTime", toSqlTime(preference.sendTime()))
        .addValue(
            "dayOfWeek", preference.dayOfWeek() == null ? null : preference.dayOfWeek().name())
        .addValue("now", toTimestamp(now));
  }

  private TriggerPreference mapTriggerRow(ResultSet rs) throws SQLException {
    final String rawTrigger = rs.getString("trigger_type");
    final NotificationTrigger trigger;
    try {
      trigger = NotificationTrigger.valueOf(rawTrigger);
    } catch (IllegalArgumentException ex) {
      // 列挙から削除されたトリガーの行は判定に使わない
      logger.warn("ignoring preference row with unknown trigger={}", rawTrigger);
      return null;
    }
    final String dayOfWeek = rs.getString("day_of_week");
    return new TriggerPreference(
        trigger,
        ChannelSetCodec.decode(rs.getString("channels")),
        NotificationFrequency.valueOf(rs.getString("frequency")),
        toLocalTime(rs.getTime("send_time")),
        dayOfWeek == null ? null : DayOfWeek.valueOf(dayOfWeek));
  }

  private UserSettingsRow mapSettingsRow(ResultSet rs, int rowNum) throws SQLException {
    return new UserSettingsRow(
        ZoneId.of(rs.getString("timezone")),
        new QuietHours(
            rs.getBoolean("quiet_hours_enabled"),
            toLocalTime(rs.getTime("quiet_hours_start")),
            toLocalTime(rs.getTime("quiet_hours_end"))));
  }

  private record UserSettingsRow(ZoneId timezone, QuietHours quietHours) {}
}
