package com.example.exchange.api;

import java.util.UUID;

public class MatchNotFoundException extends RuntimeException {
  public MatchNotFoundException(UUID matchId) {
    super("match not found: " + matchId);
  }
}
