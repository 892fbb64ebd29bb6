package com.example.exchange.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.exchange.model.MessageRecord;
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
public class MessageRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(MessageRecord message) {
    final String sql =
        """
        INSERT INTO messages (
          message_id, conversation_id, sender_id, recipient_id, content, created_at
        ) VALUES (
          :messageId, :conversationId, :senderId, :recipientId, :content, :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("messageId", message.messageId())
            .addValue("conversationId", message.conversationId())
            .addValue("senderId", message.senderId())
            .addValue("recipientId", message.recipientId())
            .addValue("content", message.content())
            .addValue("createdAt", toTimestamp(message.createdAt()));
    jdbcTemplate.update(sql, params);
  }

  /** 会話の最新 {@code limit} 件。古い順。 */
  public List<MessageRecord> findLatest(String conversationId, int limit) {
    final String sql =
        """
        SELECT message_id, conversation_id, sender_id, recipient_id, content, created_at
        FROM (
          SELECT message_id, conversation_id, sender_id, recipient_id, content, created_at
          FROM messages
          WHERE conversation_id = :conversationId
          ORDER BY created_at DESC, message_id DESC
          LIMIT :limit
        ) latest
        ORDER BY created_at, message_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("conversationId", conversationId)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private MessageRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new MessageRecord(
        rs.getObject("message_id", UUID.class),
        rs.getString("conversation_id"),
        rs.getString("sender_id"),
        rs.getString("recipient_id"),
        rs.getString("content"),
        toInstant(rs.getTimestamp("created_at")));
  }
}
