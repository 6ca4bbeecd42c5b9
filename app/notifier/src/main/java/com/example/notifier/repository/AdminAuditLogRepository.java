package com.example.notifier.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.notifier.model.AdminAuditAction;
import com.example.notifier.model.AdminAuditLogRecord;
import com.example.notifier.model.OverrideTargetType;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AdminAuditLogRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(AdminAuditLogRecord auditLogRecord) {
    final String sql =
        """
        INSERT INTO notification_admin_audit_log (
          id, actor, action, target_type, username, target_key, reason, details, created_at
        ) VALUES (
          :id, :actor, :action, :targetType, :username, :targetKey, :reason,
          CAST(:details AS jsonb), :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", auditLogRecord.id())
            .addValue("actor", auditLogRecord.actor())
            .addValue("action", auditLogRecord.action().name())
            .addValue("targetType", auditLogRecord.targetType().name())
            .addValue("username", auditLogRecord.username())
            .addValue("targetKey", auditLogRecord.targetKey())
            .addValue("reason", auditLogRecord.reason())
            .addValue("details", auditLogRecord.detailsJson())
            .addValue("createdAt", toTimestamp(auditLogRecord.createdAt()));
    jdbcTemplate.update(sql, params);
  }

  public List<AdminAuditLogRecord> findRecent(int limit, int offset) {
    final String sql =
        """
        SELECT id, actor, action, target_type, username, target_key, reason,
               details::text AS details_text, created_at
        FROM notification_admin_audit_log
        ORDER BY created_at DESC
        LIMIT :limit OFFSET :offset
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("limit", limit).addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private AdminAuditLogRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new AdminAuditLogRecord(
        UUID.fromString(rs.getString("id")),
        rs.getString("actor"),
        AdminAuditAction.valueOf(rs.getString("action")),
        OverrideTargetType.valueOf(rs.getString("target_type")),
        rs.getString("username"),
        rs.getString("target_key"),
        rs.getString("reason"),
        rs.getString("details_text"),
        toInstant(rs.getTimestamp("created_at")));
  }
}
