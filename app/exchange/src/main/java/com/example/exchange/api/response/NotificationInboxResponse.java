package com.example.exchange.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationInboxResponse(
    String userId,
    List<NotificationResponse> notifications,
    long total,
    long unreadCount,
    int page,
    int pageSize) {
  public NotificationInboxResponse {
    notifications = notifications == null ? List.of() : List.copyOf(notifications);
  }
}
