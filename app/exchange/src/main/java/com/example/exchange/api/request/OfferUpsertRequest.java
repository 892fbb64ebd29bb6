/*
 * どこで: Exchange API リクエスト DTO
 * 何を: オファー登録・更新のボディ。offer_id があれば更新
 * なぜ: JSON ボディを型付きの値で受け取るため
 */
package com.example.exchange.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OfferUpsertRequest(
    UUID offerId,
    @NotBlank String dogId,
    @NotNull Instant startAt,
    @NotNull Instant endAt,
    @NotNull Double latitude,
    @NotNull Double longitude) {}
