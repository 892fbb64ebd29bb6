/*
 * どこで: Exchange ライブチャネル
 * 何を: クライアントへ送る JSON フレームを組み立てる
 * なぜ: イベントのエンベロープと制御フレームで同じワイヤ形式を共有するため
 */
package com.example.exchange.live;

import com.example.exchange.model.NotificationRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import org.springframework.stereotype.Component;

@Component
public class LiveFrames {

  public static final String TYPE_CONNECTED = "connected";
  public static final String TYPE_BACKFILL_COMPLETE = "backfill_complete";
  public static final String TYPE_PONG = "pong";
  public static final String TYPE_ERROR = "error";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper is a shared Spring-managed component")
  private final ObjectMapper objectMapper;

  public LiveFrames(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /** ログ済み通知 1 件分の {"type", "seq", "data", "text", "created_at"}。 */
  public String envelope(NotificationRecord record) {
    final ObjectNode node = objectMapper.createObjectNode();
    node.put("type", record.type().value());
    node.put("seq", record.seq());
    try {
      node.set("data", objectMapper.readTree(record.payloadJson()));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("stored payload is not valid JSON seq=" + record.seq(), ex);
    }
    node.put("text", record.text());
    node.put("created_at", record.createdAt().toString());
    return write(node);
  }

  public String connected(String userId, String connectionId, Instant connectedAt) {
    final ObjectNode node = objectMapper.createObjectNode();
    node.put("type", TYPE_CONNECTED);
    final ObjectNode data = node.putObject("data");
    data.put("user_id", userId);
    data.put("connection_id", connectionId);
    data.put("connected_at", connectedAt.toString());
    return write(node);
  }

  public String backfillComplete(long lastSeq) {
    final ObjectNode node = objectMapper.createObjectNode();
    node.put("type", TYPE_BACKFILL_COMPLETE);
    node.put("seq", lastSeq);
    return write(node);
  }

  public String pong() {
    return write(objectMapper.createObjectNode().put("type", TYPE_PONG));
  }

  public String error(String message) {
    final ObjectNode node = objectMapper.createObjectNode();
    node.put("type", TYPE_ERROR);
    node.putObject("data").put("message", message);
    return write(node);
  }

  private String write(ObjectNode node) {
    try {
      return objectMapper.writeValueAsString(node);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("frame serialization failed", ex);
    }
  }
}
