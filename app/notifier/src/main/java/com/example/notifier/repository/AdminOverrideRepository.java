/*
 * どこで: Notifier データアクセス
 * 何を: admin_overrides の取得/upsert/削除を担う
 * なぜ: ユーザー設定とは別テーブルに保持し、元の設定を書き換えずに上書きするため
 */
package com.example.notifier.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toLocalTime;
import static com.example.common.JdbcTimestampUtils.toSqlTime;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.notifier.model.AdminOverrideRecord;
import com.example.notifier.model.NotificationFrequency;
import com.example.notifier.model.OverrideTarget;
import com.example.notifier.model.OverrideTargetType;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.DayOfWeek;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AdminOverrideRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT target_type, username, target_key, disabled,
             override_time, override_frequency, override_day_of_week, override_channels,
             reason, notify_user, overridden_by, overridden_at
      FROM admin_overrides
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<AdminOverrideRecord> find(OverrideTarget target) {
    final String sql =
        SELECT_COLUMNS
            + """
             WHERE target_type = :targetType
               AND username = :username
               AND target_key = :targetKey
            """;
    return jdbcTemplate.query(sql, targetParams(target), this::mapRow).stream().findFirst();
  }

  public List<AdminOverrideRecord> findByUsername(String username) {
    final String sql =
        SELECT_COLUMNS + " WHERE username = :username ORDER BY target_type, target_key";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("username", username);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public void upsert(AdminOverrideRecord record) {
    final String sql =
        """
        INSERT INTO admin_overrides (
          target_type, username, target_key, disabled,
          override_time, override_frequency, override_day_of_week, override_channels,
          reason, notify_user, overridden_by, overridden_at
        ) VALUES (
          :targetType, :username, :targetKey, :disabled,
          :overrideTime, :overrideFrequency, :overrideDayOfWeek, :overrideChannels,
          :reason, :notifyUser, :overriddenBy, :overriddenAt
        )
        ON CONFLICT (target_type, username, target_key) DO UPDATE
        SET disabled = EXCLUDED.disabled,
            override_time = EXCLUDED.override_time,
            override_frequency = EXCLUDED.override_frequency,
            override_day_of_week = EXCLUDED.override_day_of_week,
            override_channels = EXCLUDED.override_channels,
            reason = EXCLUDED.reason,
            notify_user = EXCLUDED.notify_user,
            overridden_by = EXCLUDED.overridden_by,
            overridden_at = EXCLUDED.overridden_at
        """;
    final MapSqlParameterSource params =
        targetParams(record.target())
            .addValue("disabled", record.disabled())
            .addValue("overrideTime", toSqlTime(record.overrideTime()))
            .addValue(
                "overrideFrequency",
                record.overrideFrequency() == null ? null : record.overrideFrequency().name())
            .addValue(
                "overrideDayOfWeek",
                record.overrideDayOfWeek() == null ? null : record.overrideDayOfWeek().name())
            .addValue("overrideChannels", ChannelSetCodec.encode(record.overrideChannels()))
            .addValue("reason", record.reason())
            .addValue("notifyUser", record.notifyUser())
            .addValue("overriddenBy", record.overriddenBy())
            .addValue("overriddenAt", toTimestamp(record.overriddenAt()));
    jdbcTemplate.update(sql, params);
  }

  public int delete(OverrideTarget target) {
    final String sql =
        """
        DELETE FROM admin_overrides
        WHERE target_type = :targetType
          AND username = :username
          AND target_key = :targetKey
        """;
    return jdbcTemplate.update(sql, targetParams(target));
  }

  private MapSqlParameterSource targetParams(OverrideTarget target) {
    return new MapSqlParameterSource()
        .addValue("targetType", target.type().name())
        .addValue("username", target.username())
        .addValue("targetKey", target.targetKey());
  }

  private AdminOverrideRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String frequency = rs.getString("override_frequency");
    final String dayOfWeek = rs.getString("override_day_of_week");
    return new AdminOverrideRecord(
        new OverrideTarget(
            OverrideTargetType.valueOf(rs.getString("target_type")),
            rs.getString("username"),
            rs.getString("target_key")),
        rs.getBoolean("disabled"),
        toLocalTime(rs.getTime("override_time")),
        frequency == null ? null : NotificationFrequency.valueOf(frequency),
        dayOfWeek == null ? null : DayOfWeek.valueOf(dayOfWeek),
        ChannelSetCodec.decode(rs.getString("override_channels")),
        rs.getString("reason"),
        rs.getBoolean("notify_user"),
        rs.getString("overridden_by"),
        toInstant(rs.getTimestamp("overridden_at")));
  }
}
