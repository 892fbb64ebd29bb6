package com.example.exchange.model;

import java.time.Instant;
import java.util.UUID;

public record MessageRecord(
    UUID messageId,
    String conversationId,
    String senderId,
    String recipientId,
    String content,
    Instant createdAt) {

  /** 双方向で共通の会話キー。2 つの ID を並べ替えて ':' でつなぐ。 */
  public static String conversationIdOf(String userA, String userB) {
    return userA.compareTo(userB) <= 0 ? userA + ":" + userB : userB + ":" + userA;
  }
}
