/*
 * どこで: Notifier データアクセス
 * 何を: notification_queue の登録/重複判定/claim/配信結果更新を担う
 * なぜ: 状態遷移を条件付き UPDATE に限定し、二重 claim と逆行を DB で防ぐため
 */
package com.example.notifier.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.notifier.model.NotificationChannel;
import com.example.notifier.model.NotificationPriority;
import com.example.notifier.model.NotificationQueueRecord;
import com.example.notifier.model.NotificationStatus;
import com.example.notifier.model.NotificationTrigger;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class NotificationQueueRepository {

  private static final String RETURNING_COLUMNS =
      """
      id, username, trigger_type, channel, template_data::text AS template_data_text,
      priority, status, scheduled_for, dedup_key, locked_by, locked_at,
      attempts, next_retry_at, last_error, created_at, sent_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(NotificationQueueRecord record) {
    final String sql =
        """
        INSERT INTO notification_queue (
          id,
          username,
          trigger_type,
          channel,
          template_data,
          priority,
          priority_rank,
          status,
          scheduled_for,
          dedup_key,
          locked_by,
          locked_at,
          attempts,
          next_retry_at,
          last_error,
          created_at,
          sent_at
        ) VALUES (
          :id,
          :username,
          :trigger,
          :channel,
          :templateData::jsonb,
          :priority,
          :priorityRank,
          :status,
          :scheduledFor,
          :dedupKey,
          :lockedBy,
          :lockedAt,
          :attempts,
          :nextRetryAt,
          :lastError,
          :createdAt,
          :sentAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", record.id())
            .addValue("username", record.username())
            .addValue("trigger", record.trigger().name())
            .addValue("channel", record.channel().name())
            .addValue("templateData", record.templateDataJson())
            .addValue("priority", record.priority().name())
            .addValue("priorityRank", record.priority().rank())
            .addValue("status", record.status().name())
            .addValue("scheduledFor", toTimestamp(record.scheduledFor()))
            .addValue("dedupKey", record.dedupKey())
            .addValue("lockedBy", record.lockedBy())
            .addValue("lockedAt", toTimestamp(record.lockedAt()))
            .addValue("attempts", record.attempts())
            .addValue("nextRetryAt", toTimestamp(record.nextRetryAt()))
            .addValue("lastError", record.lastError())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("sentAt", toTimestamp(record.sentAt()));
    jdbcTemplate.update(sql, params);
    return record.id();
  }

  public Optional<NotificationQueueRecord> findById(UUID id) {
    final String sql =
        "SELECT " + RETURNING_COLUMNS + " FROM notification_queue WHERE id = :id";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("id", id), this::mapRow)
        .stream()
        .findFirst();
  }

  public List<NotificationQueueRecord> findByUsername(String username, int limit) {
    final String sql =
        "SELECT "
            + RETURNING_COLUMNS
            + """
             FROM notification_queue
             WHERE username = :username
             ORDER BY created_at DESC
             LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("username", username).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public void lockDedupKey(long lockKey) {
    // トランザクション終了で自動解放される 64-bit advisory lock で同一キーの enqueue を直列化する
    final String sql = "SELECT pg_advisory_xact_lock(:lockKey)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("lockKey", lockKey);
    jdbcTemplate.query(sql, params, rs -> null);
  }

  public boolean existsActiveDuplicate(
      String username, NotificationTrigger trigger, String dedupKey, Instant since) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1
          FROM notification_queue
          WHERE username = :username
            AND trigger_type = :trigger
            AND dedup_key = :dedupKey
            AND status IN ('PENDING', 'PROCESSING')
            AND created_at >= :since
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("username", username)
            .addValue("trigger", trigger.name())
            .addValue("dedupKey", dedupKey)
            .addValue("since", toTimestamp(since));
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  /** レート制限用。FAILED は送られていないので数えない。 */
  public int countRecentForChannel(String username, NotificationChannel channel, Instant since) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notification_queue
        WHERE username = :username
          AND channel = :channel
          AND status <> 'FAILED'
          AND created_at >= :since
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("username", username)
            .addValue("channel", channel.name())
            .addValue("since", toTimestamp(since));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  public List<NotificationQueueRecord> claimPending(
      NotificationChannel channel, int limit, Instant now, String lockedBy) {
    // SKIP LOCKED で並行 claim を避け、status 条件付き UPDATE で PENDING -> PROCESSING を確定させる
    final String sql =
        """
        WITH cte AS (
          SELECT id
          FROM notification_queue
          WHERE status = 'PENDING'
            AND channel = :channel
            AND (scheduled_for IS NULL OR scheduled_for <= :now)
            AND (next_retry_at IS NULL OR next_retry_at <= :now)
          ORDER BY priority_rank, created_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE notification_queue q
        SET status = 'PROCESSING',
            locked_by = :lockedBy,
            locked_at = :now
        FROM cte
        WHERE q.id = cte.id
          AND q.status = 'PENDING'
        RETURNING q.id, q.username, q.trigger_type, q.channel,
                  q.template_data::text AS template_data_text,
                  q.priority, q.status, q.scheduled_for, q.dedup_key, q.locked_by, q.locked_at,
                  q.attempts, q.next_retry_at, q.last_error, q.created_at, q.sent_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("channel", channel.name())
            .addValue("now", toTimestamp(now))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markSent(UUID id, Instant sentAt, String lockedBy) {
    final String sql =
        """
        UPDATE notification_queue
        SET status = 'SENT',
            sent_at = :sentAt,
            next_retry_at = NULL,
            locked_by = NULL,
            locked_at = NULL
        WHERE id = :id
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("id", id)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markRetry(
      UUID id,
      int attempts,
      Instant nextRetryAt,
      String lastError,
      boolean failed,
      String lockedBy) {
    final String sql =
        """
        UPDATE notification_queue
        SET status = :status,
            attempts = :attempts,
            next_retry_at = :nextRetryAt,
            last_error = :lastError,
            locked_by = NULL,
            locked_at = NULL
        WHERE id = :id
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", failed ? "FAILED" : "PENDING")
            .addValue("attempts", attempts)
            .addValue("nextRetryAt", failed ? null : toTimestamp(nextRetryAt))
            .addValue("lastError", lastError)
            .addValue("id", id)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  /** ワーカー停止で取り残された PROCESSING を PENDING へ戻す。attempts は変えない。 */
  public int requeueStaleProcessing(Instant threshold) {
    final String sql =
        """
        UPDATE notification_queue
        SET status = 'PENDING',
            locked_by = NULL,
            locked_at = NULL,
            last_error = COALESCE(last_error, 'requeued after processing timeout')
        WHERE status = 'PROCESSING'
          AND locked_at < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  public int countByStatus(NotificationStatus status) {
    final String sql = "SELECT COUNT(*) FROM notification_queue WHERE status = :status";
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("status", status.name()), Integer.class);
    return count == null ? 0 : count;
  }

  private NotificationQueueRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationQueueRecord(
        UUID.fromString(rs.getString("id")),
        rs.getString("username"),
        NotificationTrigger.valueOf(rs.getString("trigger_type")),
        NotificationChannel.valueOf(rs.getString("channel")),
        rs.getString("template_data_text"),
        NotificationPriority.valueOf(rs.getString("priority")),
        NotificationStatus.valueOf(rs.getString("status")),
        toInstant(rs.getTimestamp("scheduled_for")),
        rs.getString("dedup_key"),
        rs.getString("locked_by"),
        toInstant(rs.getTimestamp("locked_at")),
        rs.getInt("attempts"),
        toInstant(rs.getTimestamp("next_retry_at")),
        rs.getString("last_error"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("sent_at")));
  }
}
