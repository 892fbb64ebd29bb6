package com.example.exchange.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/** {@code sinceSeq} より後の通知。{@code lastSeq} が次回呼び出しのカーソル。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationFeedResponse(
    String userId, long sinceSeq, long lastSeq, List<NotificationResponse> notifications) {
  public NotificationFeedResponse {
    notifications = notifications == null ? List.of() : List.copyOf(notifications);
  }
}
