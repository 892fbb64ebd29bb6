/*
 * どこで: Exchange ドメインモデル
 * 何を: マッチのライフサイクル状態と状態間の遷移グラフ
 * なぜ: 一度離れた状態には戻らず、遷移は前にしか進まないため
 */
package com.example.exchange.model;

import java.util.Optional;

public enum MatchState {
  PENDING,
  ACCEPTED,
  CONFIRMED,
  REJECTED,
  CANCELLED;

  public boolean isTerminal() {
    return switch (this) {
      case PENDING, ACCEPTED -> false;
      case CONFIRMED, REJECTED, CANCELLED -> true;
    };
  }

  /** この状態から {@code action} で移る先。許されない操作なら空。 */
  public Optional<MatchState> next(MatchAction action) {
    return switch (this) {
      case PENDING -> switch (action) {
        case ACCEPT -> Optional.of(ACCEPTED);
        case REJECT -> Optional.of(REJECTED);
        case CANCEL -> Optional.of(CANCELLED);
        case CONFIRM -> Optional.empty();
      };
      case ACCEPTED -> switch (action) {
        case CONFIRM -> Optional.of(CONFIRMED);
        case REJECT -> Optional.of(REJECTED);
        case CANCEL -> Optional.of(CANCELLED);
        case ACCEPT -> Optional.empty();
      };
      case CONFIRMED, REJECTED, CANCELLED -> Optional.empty();
    };
  }

  public static MatchState fromValue(String state) {
    for (MatchState matchState : values()) {
      if (matchState.name().equalsIgnoreCase(state)) {
        return matchState;
      }
    }
    throw new IllegalArgumentException("unsupported state: " + state);
  }
}
