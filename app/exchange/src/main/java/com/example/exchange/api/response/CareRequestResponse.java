package com.example.exchange.api.response;

import com.example.exchange.model.CareRequestRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CareRequestResponse(
    UUID requestId,
    String seekerId,
    Instant startAt,
    Instant endAt,
    double latitude,
    double longitude,
    double radiusMeters,
    String status,
    Instant createdAt,
    Instant updatedAt) {

  public static CareRequestResponse from(CareRequestRecord record) {
    return new CareRequestResponse(
        record.requestId(),
        record.seekerId(),
        record.startAt(),
        record.endAt(),
        record.latitude(),
        record.longitude(),
        record.radiusMeters(),
        record.status().name(),
        record.createdAt(),
        record.updatedAt());
  }
}
