/*
 * どこで: Exchange API
 * 何を: 現在の状態から許されない、または競合に負けたマッチ遷移を表す
 * なぜ: 409 に変換し、クライアントにマッチを読み直してから再試行させるため
 */
package com.example.exchange.api;

import java.util.UUID;

public class StaleTransitionException extends RuntimeException {

  private final UUID matchId;

  public StaleTransitionException(UUID matchId, String message) {
    super(message);
    this.matchId = matchId;
  }

  public UUID matchId() {
    return matchId;
  }
}
