/*
 * どこで: Exchange ドメインモデル
 * 何を: マッチの行スナップショットと両当事者のユーザー ID
 * なぜ: 権限チェックにはマッチ状態と並べてオファー側とリクエスト側のユーザーが必要なため
 */
package com.example.exchange.model;

import java.time.Instant;
import java.util.UUID;

public record MatchRecord(
    UUID matchId,
    UUID offerId,
    UUID requestId,
    String offerOwnerId,
    String seekerId,
    MatchState state,
    long overlapSeconds,
    double distanceMeters,
    long version,
    Instant createdAt,
    Instant lastTransitionAt,
    String lastTransitionActor) {

  public boolean isParty(String userId) {
    return offerOwnerId.equals(userId) || seekerId.equals(userId);
  }

  /** マッチが操作を待っている当事者。終端状態なら {@code null}。 */
  public String awaitingUserId() {
    return switch (state) {
      case PENDING -> offerOwnerId;
      case ACCEPTED -> seekerId;
      case CONFIRMED, REJECTED, CANCELLED -> null;
    };
  }
}
