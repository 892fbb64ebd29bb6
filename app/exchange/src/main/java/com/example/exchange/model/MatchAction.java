/*
 * どこで: Exchange ドメインモデル
 * 何を: マッチの状態を進めるユーザー操作
 * なぜ: 受け付ける操作文字列を閉じた集合にまとめるため
 */
package com.example.exchange.model;

public enum MatchAction {
  ACCEPT("accept"),
  CONFIRM("confirm"),
  REJECT("reject"),
  CANCEL("cancel");

  private final String value;

  MatchAction(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * 役割: API で受け取った action 文字列を列挙型へ変換する。
   * 動作: 大文字小文字を無視して照合し、未対応値は {@link IllegalArgumentException} を送出する。
   */
  public static MatchAction fromValue(String action) {
    for (MatchAction matchAction : values()) {
      if (matchAction.value.equalsIgnoreCase(action)) {
        return matchAction;
      }
    }
    throw new IllegalArgumentException("unsupported action: " + action);
  }

  /** {@code userId} が {@code match} に対してこの操作をしてよい当事者か。 */
  public boolean isAllowedFor(MatchRecord match, String userId) {
    return switch (this) {
      case ACCEPT -> match.offerOwnerId().equals(userId);
      case CONFIRM -> match.seekerId().equals(userId);
      case REJECT, CANCEL -> match.isParty(userId);
    };
  }
}
