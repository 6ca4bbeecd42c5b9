/*
 * どこで: Notifier データアクセス
 * 何を: recipient_contacts から配信先の連絡先を取得する
 * なぜ: プロフィールサービスから複製された連絡先を配信時にだけ参照するため
 */
package com.example.notifier.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.notifier.model.RecipientContact;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class RecipientContactRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<RecipientContact> findByUsername(String username) {
    final String sql =
        """
        SELECT username, email, phone, push_token
        FROM recipient_contacts
        WHERE username = :username
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("username", username);
    return jdbcTemplate
        .query(
            sql,
            params,
            (rs, rowNum) ->
                new RecipientContact(
                    rs.getString("username"),
                    rs.getString("email"),
                    rs.getString("phone"),
                    rs.getString("push_token")))
        .stream()
        .findFirst();
  }

  public void upsert(RecipientContact contact, Instant now) {
    final String sql =
        """
        INSERT INTO recipient_contacts (username, email, phone, push_token, updated_at)
        VALUES (:username, :email, :phone, :pushToken, :now)
        ON CONFLICT (username) DO UPDATE
        SET email = EXCLUDED.email,
            phone = EXCLUDED.phone,
            push_token = EXCLUDED.push_token,
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("username", contact.username())
            .addValue("email", contact.email())
            .addValue("phone", contact.phone())
            .addValue("pushToken", contact.pushToken())
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }
}
