/*
 * どこで: Notifier データアクセス
 * 何を: processed_events の登録/期限切れ削除を行う
 * なぜ: NATS の at-least-once 再配信で同一ドメインイベントを二重に dispatch しないため
 */
package com.example.notifier.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ProcessedEventRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** 初回登録なら true。ON CONFLICT で外側のトランザクションを中断させない。 */
  public boolean insertIfAbsent(UUID eventId, Instant processedAt) {
    final String sql =
        """
        INSERT INTO processed_events (event_id, processed_at)
        VALUES (:eventId, :processedAt)
        ON CONFLICT (event_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("processedAt", toTimestamp(processedAt));
    return jdbcTemplate.update(sql, params) > 0;
  }

  public int deleteOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM processed_events
        WHERE processed_at < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }
}
