package com.example.exchange.model;

import java.util.Map;

/** ユーザーに知らせるべき出来事。ユーザーのログに追記してからライブで push する。 */
public sealed interface ExchangeEvent permits NewMatchEvent, MatchUpdatedEvent, NewMessageEvent {

  EventType type();

  /** エンベロープの {@code data} として直列化される構造化ペイロード。 */
  Map<String, Object> data();

  /** 受信箱に表示する 1 行の文言。 */
  String text();
}
