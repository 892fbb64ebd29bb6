package com.example.exchange.api.response;

import com.example.exchange.model.MatchRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MatchResponse(
    UUID matchId,
    UUID offerId,
    UUID requestId,
    String offerOwnerId,
    String seekerId,
    String state,
    String awaitingUserId,
    long overlapSeconds,
    double distanceMeters,
    long version,
    Instant createdAt,
    Instant lastTransitionAt,
    String lastTransitionActor) {

  public static MatchResponse from(MatchRecord record) {
    return new MatchResponse(
        record.matchId(),
        record.offerId(),
        record.requestId(),
        record.offerOwnerId(),
        record.seekerId(),
        record.state().name(),
        record.awaitingUserId(),
        record.overlapSeconds(),
        record.distanceMeters(),
        record.version(),
        record.createdAt(),
        record.lastTransitionAt(),
        record.lastTransitionActor());
  }
}
