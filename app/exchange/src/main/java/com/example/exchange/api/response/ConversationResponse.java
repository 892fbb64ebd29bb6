package com.example.exchange.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConversationResponse(String conversationId, List<MessageResponse> messages) {
  public ConversationResponse {
    messages = messages == null ? List.of() : List.copyOf(messages);
  }
}
