package com.example.exchange.api.response;

import com.example.exchange.model.OfferRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OfferResponse(
    UUID offerId,
    String ownerId,
    String dogId,
    Instant startAt,
    Instant endAt,
    double latitude,
    double longitude,
    String status,
    Instant createdAt,
    Instant updatedAt) {

  public static OfferResponse from(OfferRecord record) {
    return new OfferResponse(
        record.offerId(),
        record.ownerId(),
        record.dogId(),
        record.startAt(),
        record.endAt(),
        record.latitude(),
        record.longitude(),
        record.status().name(),
        record.createdAt(),
        record.updatedAt());
  }
}
