package com.example.exchange.model;

import java.util.LinkedHashMap;
import java.util.Map;

public record NewMatchEvent(MatchRecord match) implements ExchangeEvent {

  @Override
  public EventType type() {
    return EventType.NEW_MATCH;
  }

  @Override
  public Map<String, Object> data() {
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("match_id", match.matchId().toString());
    data.put("offer_id", match.offerId().toString());
    data.put("request_id", match.requestId().toString());
    data.put("state", match.state().name());
    data.put("overlap_seconds", match.overlapSeconds());
    data.put("distance_meters", match.distanceMeters());
    return data;
  }

  @Override
  public String text() {
    return "New sitting match found";
  }
}
