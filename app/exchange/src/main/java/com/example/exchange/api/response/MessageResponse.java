package com.example.exchange.api.response;

import com.example.exchange.model.MessageRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MessageResponse(
    UUID messageId,
    String conversationId,
    String senderId,
    String recipientId,
    String content,
    Instant createdAt) {

  public static MessageResponse from(MessageRecord record) {
    return new MessageResponse(
        record.messageId(),
        record.conversationId(),
        record.senderId(),
        record.recipientId(),
        record.content(),
        record.createdAt());
  }
}
