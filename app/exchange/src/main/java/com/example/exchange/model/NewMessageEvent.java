package com.example.exchange.model;

import java.util.LinkedHashMap;
import java.util.Map;

public record NewMessageEvent(MessageRecord message) implements ExchangeEvent {

  static final int PREVIEW_LENGTH = 100;

  @Override
  public EventType type() {
    return EventType.NEW_MESSAGE;
  }

  @Override
  public Map<String, Object> data() {
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("message_id", message.messageId().toString());
    data.put("conversation_id", message.conversationId());
    data.put("sender_id", message.senderId());
    data.put("preview", preview());
    data.put("created_at", message.createdAt().toString());
    return data;
  }

  @Override
  public String text() {
    return "New message from " + message.senderId() + ": " + preview();
  }

  public String preview() {
    final String content = message.content();
    if (content.codePointCount(0, content.length()) <= PREVIEW_LENGTH) {
      return content;
    }
    return content.substring(0, content.offsetByCodePoints(0, PREVIEW_LENGTH));
  }
}
