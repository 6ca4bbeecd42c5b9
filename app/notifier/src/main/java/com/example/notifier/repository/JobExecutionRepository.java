/*
 * どこで: Notifier データアクセス
 * 何を: job_executions (ジョブ実行履歴) の登録/完了/参照/削除を担う
 * なぜ: 実行ごとの結果とエラーを管理 API から追跡できるようにするため
 */
package com.example.notifier.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.notifier.model.JobExecutionRecord;
import com.example.notifier.model.JobExecutionStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JobExecutionRepository {

  private static final TypeReference<List<String>> ERRORS_TYPE = new TypeReference<>() {};

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public void insertStarted(
      UUID executionId,
      UUID jobId,
      String jobName,
      String templateType,
      String triggeredBy,
      Instant startedAt) {
    final String sql =
        """
        INSERT INTO job_executions (
          execution_id, job_id, job_name, template_type, triggered_by, status, started_at
        ) VALUES (
          :executionId, :jobId, :jobName, :templateType, :triggeredBy, 'RUNNING', :startedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("executionId", executionId)
            .addValue("jobId", jobId)
            .addValue("jobName", jobName)
            .addValue("templateType", templateType)
            .addValue("triggeredBy", triggeredBy)
            .addValue("startedAt", toTimestamp(startedAt));
    jdbcTemplate.update(sql, params);
  }

  public int complete(
      UUID executionId,
      JobExecutionStatus status,
      Instant finishedAt,
      String message,
      int recordsProcessed,
      int recordsAffected,
      List<String> errors) {
    // RUNNING の行だけを確定させ、タイムアウト後に遅れて届いた結果で上書きしない
    final String sql =
        """
        UPDATE job_executions
        SET status = :status,
            finished_at = :finishedAt,
            duration_millis = (EXTRACT(EPOCH FROM (CAST(:finishedAt AS timestamptz) - started_at)) * 1000)::bigint,
            message = :message,
            records_processed = :recordsProcessed,
            records_affected = :recordsAffected,
            errors = CAST(:errors AS jsonb)
        WHERE execution_id = :executionId
          AND status = 'RUNNING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("executionId", executionId)
            .addValue("status", status.name())
            .addValue("finishedAt", toTimestamp(finishedAt))
            .addValue("message", message)
            .addValue("recordsProcessed", recordsProcessed)
            .addValue("recordsAffected", recordsAffected)
            .addValue("errors", writeErrors(errors));
    return jdbcTemplate.update(sql, params);
  }

  public List<JobExecutionRecord> findByJobId(UUID jobId, int limit) {
    final String sql =
        """
        SELECT execution_id, job_id, job_name, template_type, triggered_by, status,
               started_at, finished_at, duration_millis, message,
               records_processed, records_affected, errors::text AS errors_text
        FROM job_executions
        WHERE job_id = :jobId
        ORDER BY started_at DESC
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("jobId", jobId).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int deleteByJobId(UUID jobId) {
    final String sql = "DELETE FROM job_executions WHERE job_id = :jobId";
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("jobId", jobId));
  }

  public int deleteFinishedOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM job_executions
        WHERE started_at < :threshold
          AND status <> 'RUNNING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  private String writeErrors(List<String> errors) {
    try {
      return objectMapper.writeValueAsString(errors == null ? List.of() : errors);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize job execution errors", ex);
    }
  }

  private List<String> readErrors(String json) {
    try {
      return objectMapper.readValue(json, ERRORS_TYPE);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("job execution errors column is not valid JSON", ex);
    }
  }

  private JobExecutionRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final long durationMillis = rs.getLong("duration_millis");
    final boolean durationNull = rs.wasNull();
    return new JobExecutionRecord(
        UUID.fromString(rs.getString("execution_id")),
        UUID.fromString(rs.getString("job_id")),
        rs.getString("job_name"),
        rs.getString("template_type"),
        rs.getString("triggered_by"),
        JobExecutionStatus.valueOf(rs.getString("status")),
        toInstant(rs.getTimestamp("started_at")),
        toInstant(rs.getTimestamp("finished_at")),
        durationNull ? null : durationMillis,
        rs.getString("message"),
        rs.getInt("records_processed"),
        rs.getInt("records_affected"),
        readErrors(rs.getString("errors_text")));
  }
}
