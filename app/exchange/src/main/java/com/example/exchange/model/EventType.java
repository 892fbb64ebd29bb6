/*
 * どこで: Exchange ドメインモデル
 * 何を: 通知イベント種別の閉じた集合
 * なぜ: ワイヤ上の名前がログに保存され、エンベロープの type として送られるため
 */
package com.example.exchange.model;

public enum EventType {
  NEW_MATCH("new_match"),
  MATCH_UPDATED("match_updated"),
  NEW_MESSAGE("new_message");

  private final String value;

  EventType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static EventType fromValue(String type) {
    for (EventType eventType : values()) {
      if (eventType.value.equals(type)) {
        return eventType;
      }
    }
    throw new IllegalArgumentException("unsupported event type: " + type);
  }
}
