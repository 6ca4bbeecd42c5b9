/*
 * どこで: Notifier データアクセス
 * 何を: job_definitions の登録/取得/running フラグの CAS/実行結果の反映を担う
 * なぜ: 同一ジョブの多重実行を DB の条件付き更新だけで防ぐため
 */
package com.example.notifier.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.notifier.model.JobDefinitionRecord;
import com.example.notifier.model.JobRunStatus;
import com.example.notifier.model.JobSchedule;
import com.example.notifier.model.ScheduleType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JobDefinitionRepository {

  private static final TypeReference<Map<String, Object>> PARAMETERS_TYPE =
      new TypeReference<>() {};

  private static final String SELECT_COLUMNS =
      """
      SELECT id, name, template_type, parameters::text AS parameters_text,
             schedule_type, interval_seconds, cron_expression, timezone,
             enabled, running, running_since, last_run_at, next_run_at,
             last_status, last_error, consecutive_failures, timeout_seconds,
             created_at, updated_at
      FROM job_definitions
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public void insert(JobDefinitionRecord record) {
    final String sql =
        """
        INSERT INTO job_definitions (
          id, name, template_type, parameters,
          schedule_type, interval_seconds, cron_expression, timezone,
          enabled, running, running_since, last_run_at, next_run_at,
          last_status, last_error, consecutive_failures, timeout_seconds,
          created_at, updated_at
        ) VALUES (
          :id, :name, :templateType, CAST(:parameters AS jsonb),
          :scheduleType, :intervalSeconds, :cronExpression, :timezone,
          :enabled, FALSE, NULL, :lastRunAt, :nextRunAt,
          :lastStatus, :lastError, :consecutiveFailures, :timeoutSeconds,
          :createdAt, :updatedAt
        )
        """;
    final MapSqlParameterSource params =
        definitionParams(record)
            .addValue("lastRunAt", toTimestamp(record.lastRunAt()))
            .addValue("lastStatus", record.lastStatus().name())
            .addValue("lastError", record.lastError())
            .addValue("consecutiveFailures", record.consecutiveFailures())
            .addValue("createdAt", toTimestamp(record.createdAt()));
    jdbcTemplate.update(sql, params);
  }

  /** 定義部分 (名前/テンプレート/パラメータ/スケジュール/有効フラグ) のみ更新する。 */
  public int updateDefinition(JobDefinitionRecord record) {
    final String sql =
        """
        UPDATE job_definitions
        SET name = :name,
            template_type = :templateType,
            parameters = CAST(:parameters AS jsonb),
            schedule_type = :scheduleType,
            interval_seconds = :intervalSeconds,
            cron_expression = :cronExpression,
            timezone = :timezone,
            enabled = :enabled,
            next_run_at = :nextRunAt,
            timeout_seconds = :timeoutSeconds,
            updated_at = :updatedAt
        WHERE id = :id
        """;
    return jdbcTemplate.update(sql, definitionParams(record));
  }

  /** 実行中の定義は削除しない。 */
  public int deleteIfIdle(UUID id) {
    final String sql = "DELETE FROM job_definitions WHERE id = :id AND running = FALSE";
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("id", id));
  }

  public Optional<JobDefinitionRecord> findById(UUID id) {
    final String sql = SELECT_COLUMNS + " WHERE id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<JobDefinitionRecord> findByName(String name) {
    final String sql = SELECT_COLUMNS + " WHERE name = :name";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("name", name);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<JobDefinitionRecord> findAll() {
    final String sql = SELECT_COLUMNS + " ORDER BY name";
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public List<JobDefinitionRecord> findDue(Instant now) {
    final String sql =
        SELECT_COLUMNS
            + """
             WHERE enabled = TRUE
               AND running = FALSE
               AND next_run_at IS NOT NULL
               AND next_run_at <= :now
             ORDER BY next_run_at
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /**
   * idle -> running の CAS。勝った呼び出しだけが true を得る。
   */
  public boolean tryMarkRunning(UUID id, Instant now) {
    final String sql =
        """
        UPDATE job_definitions
        SET running = TRUE,
            running_since = :now
        WHERE id = :id
          AND running = FALSE
          AND enabled = TRUE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("id", id).addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params) == 1;
  }

  public int completeRun(
      UUID id, Instant lastRunAt, JobRunStatus status, Instant nextRunAt, String lastError) {
    // 失敗時のみ連続失敗数を加算し、成功で 0 に戻す
    final String sql =
        """
        UPDATE job_definitions
        SET running = FALSE,
            running_since = NULL,
            last_run_at = :lastRunAt,
            last_status = :status,
            next_run_at = :nextRunAt,
            last_error = :lastError,
            consecutive_failures = CASE
              WHEN :status = 'FAILURE' THEN consecutive_failures + 1
              ELSE 0
            END,
            updated_at = :lastRunAt
        WHERE id = :id
          AND running = TRUE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("lastRunAt", toTimestamp(lastRunAt))
            .addValue("status", status.name())
            .addValue("nextRunAt", toTimestamp(nextRunAt))
            .addValue("lastError", lastError);
    return jdbcTemplate.update(sql, params);
  }

  /** 実行を開始できなかった場合に running だけを戻す。次回実行時刻は変えない。 */
  public int releaseRunning(UUID id) {
    final String sql =
        """
        UPDATE job_definitions
        SET running = FALSE,
            running_since = NULL
        WHERE id = :id
          AND running = TRUE
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("id", id));
  }

  /** 単一プロセス前提: 起動時に前回プロセスが残した running を解除する。 */
  public int clearAllRunning() {
    final String sql =
        """
        UPDATE job_definitions
        SET running = FALSE,
            running_since = NULL
        WHERE running = TRUE
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource());
  }

  public int updateEnabled(UUID id, boolean enabled, Instant nextRunAt, Instant now) {
    final String sql =
        """
        UPDATE job_definitions
        SET enabled = :enabled,
            next_run_at = :nextRunAt,
            updated_at = :now
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("enabled", enabled)
            .addValue("nextRunAt", toTimestamp(nextRunAt))
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  private MapSqlParameterSource definitionParams(JobDefinitionRecord record) {
    final JobSchedule schedule = record.schedule();
    return new MapSqlParameterSource()
        .addValue("id", record.id())
        .addValue("name", record.name())
        .addValue("templateType", record.templateType())
        .addValue("parameters", writeParameters(record.parameters()))
        .addValue("scheduleType", schedule.type().name())
        .addValue("intervalSeconds", schedule.intervalSeconds())
        .addValue("cronExpression", schedule.cronExpression())
        .addValue("timezone", schedule.timezone())
        .addValue("enabled", record.enabled())
        .addValue("nextRunAt", toTimestamp(record.nextRunAt()))
        .addValue("timeoutSeconds", record.timeoutSeconds())
        .addValue("updatedAt", toTimestamp(record.updatedAt()));
  }

  private String writeParameters(Map<String, Object> parameters) {
    try {
      return objectMapper.writeValueAsString(parameters);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("job parameters are not serializable", ex);
    }
  }

  private Map<String, Object> readParameters(String json) {
    try {
      return objectMapper.readValue(json, PARAMETERS_TYPE);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("job parameters column is not valid JSON", ex);
    }
  }

  private JobDefinitionRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final ScheduleType scheduleType = ScheduleType.valueOf(rs.getString("schedule_type"));
    final long intervalSeconds = rs.getLong("interval_seconds");
    final JobSchedule schedule =
        new JobSchedule(
            scheduleType,
            rs.wasNull() ? null : intervalSeconds,
            rs.getString("cron_expression"),
            rs.getString("timezone"));
    final int timeoutSeconds = rs.getInt("timeout_seconds");
    final boolean timeoutNull = rs.wasNull();
    return new JobDefinitionRecord(
        UUID.fromString(rs.getString("id")),
        rs.getString("name"),
        rs.getString("template_type"),
        readParameters(rs.getString("parameters_text")),
        schedule,
        rs.getBoolean("enabled"),
        rs.getBoolean("running"),
        toInstant(rs.getTimestamp("running_since")),
        toInstant(rs.getTimestamp("last_run_at")),
        toInstant(rs.getTimestamp("next_run_at")),
        JobRunStatus.valueOf(rs.getString("last_status")),
        rs.getString("last_error"),
        rs.getInt("consecutive_failures"),
        timeoutNull ? null : timeoutSeconds,
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
