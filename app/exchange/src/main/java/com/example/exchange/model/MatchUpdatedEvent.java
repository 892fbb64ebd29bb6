package com.example.exchange.model;

import java.util.LinkedHashMap;
import java.util.Map;

public record MatchUpdatedEvent(MatchRecord match, MatchState previousState)
    implements ExchangeEvent {

  @Override
  public EventType type() {
    return EventType.MATCH_UPDATED;
  }

  @Override
  public Map<String, Object> data() {
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("match_id", match.matchId().toString());
    data.put("previous_state", previousState.name());
    data.put("state", match.state().name());
    data.put("version", match.version());
    data.put("actor", match.lastTransitionActor());
    return data;
  }

  @Override
  public String text() {
    return switch (match.state()) {
      case PENDING -> "Match is pending";
      case ACCEPTED -> "Match accepted by the owner";
      case CONFIRMED -> "Sitting confirmed";
      case REJECTED -> "Match rejected";
      case CANCELLED -> "Match cancelled";
    };
  }
}
