package com.example.exchange.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CareRequestUpsertRequest(
    UUID requestId,
    @NotNull Instant startAt,
    @NotNull Instant endAt,
    @NotNull Double latitude,
    @NotNull Double longitude,
    @NotNull Double radiusMeters) {}
