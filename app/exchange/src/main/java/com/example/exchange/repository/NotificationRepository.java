/*
 * どこで: Exchange データアクセス
 * 何を: 欠番のない seq と既読フラグを持つユーザーごとの通知ログ
 * なぜ: 受信箱とライブのバックフィルの永続的な正本とするため
 */
package com.example.exchange.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.exchange.model.EventType;
import com.example.exchange.model.NotificationRecord;
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
public class NotificationRepository {

  private static final String COLUMNS =
      """
      notification_id, user_id, seq, type, payload_json::text AS payload_json_text, text,
      created_at, read
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * 役割: {@code userId} の次の seq を採番する。
   * 前提: カウンタ行は外側のトランザクション終了までロックされる。同じユーザーへの追記は直列化され、ロールバックされた追記の番号は使われずに戻る。
   */
  public long nextSequence(String userId) {
    final String sql =
        """
        INSERT INTO notification_sequences (user_id, last_seq)
        VALUES (:userId, 1)
        ON CONFLICT (user_id)
        DO UPDATE SET last_seq = notification_sequences.last_seq + 1
        RETURNING last_seq
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    final Long seq = jdbcTemplate.queryForObject(sql, params, Long.class);
    if (seq == null) {
      throw new IllegalStateException("sequence allocation returned no row for " + userId);
    }
    return seq;
  }

  public void insert(NotificationRecord record) {
    final String sql =
        """
        INSERT INTO notifications (
          notification_id, user_id, seq, type, payload_json, text, created_at, read
        ) VALUES (
          :notificationId, :userId, :seq, :type, :payloadJson::jsonb, :text, :createdAt, :read
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", record.notificationId())
            .addValue("userId", record.userId())
            .addValue("seq", record.seq())
            .addValue("type", record.type().value())
            .addValue("payloadJson", record.payloadJson())
            .addValue("text", record.text())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("read", record.read());
    jdbcTemplate.update(sql, params);
  }

  /** {@code seq > sinceSeq} の通知。古い順。 */
  public List<NotificationRecord> findSince(String userId, long sinceSeq, int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM notifications
            WHERE user_id = :userId
              AND seq > :sinceSeq
            ORDER BY seq
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("sinceSeq", sinceSeq)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** 受信箱の 1 ページ。新しい順。 */
  public List<NotificationRecord> findPage(
      String userId, boolean unreadOnly, int limit, int offset) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM notifications
            WHERE user_id = :userId
              AND (:unreadOnly = FALSE OR read = FALSE)
            ORDER BY seq DESC
            LIMIT :limit OFFSET :offset
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("unreadOnly", unreadOnly)
            .addValue("limit", limit)
            .addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public long count(String userId, boolean unreadOnly) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notifications
        WHERE user_id = :userId
          AND (:unreadOnly = FALSE OR read = FALSE)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("unreadOnly", unreadOnly);
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0 : count;
  }

  /** 通知が存在しないか他ユーザーのものなら 0 を返す。 */
  public int markRead(UUID notificationId, String userId) {
    final String sql =
        """
        UPDATE notifications
        SET read = TRUE
        WHERE notification_id = :notificationId
          AND user_id = :userId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", notificationId)
            .addValue("userId", userId);
    return jdbcTemplate.update(sql, params);
  }

  public int markAllRead(String userId) {
    final String sql =
        """
        UPDATE notifications
        SET read = TRUE
        WHERE user_id = :userId
          AND read = FALSE
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.update(sql, params);
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationRecord(
        rs.getObject("notification_id", UUID.class),
        rs.getString("user_id"),
        rs.getLong("seq"),
        EventType.fromValue(rs.getString("type")),
        rs.getString("payload_json_text"),
        rs.getString("text"),
        toInstant(rs.getTimestamp("created_at")),
        rs.getBoolean("read"));
  }
}
