/*
 * どこで: Exchange ドメインモデル
 * 何を: 犬の飼い主が出したオファーの行スナップショット
 * なぜ: オファーの状態をストア、マッチャー、API の間で受け渡すため
 */
package com.example.exchange.model;

import java.time.Instant;
import java.util.UUID;

public record OfferRecord(
    UUID offerId,
    String ownerId,
    String dogId,
    Instant startAt,
    Instant endAt,
    double latitude,
    double longitude,
    AvailabilityStatus status,
    Instant createdAt,
    Instant updatedAt) {

  public TimeWindow window() {
    return new TimeWindow(startAt, endAt);
  }

  public GeoPoint point() {
    return new GeoPoint(latitude, longitude);
  }

  public boolean isOpen() {
    return status == AvailabilityStatus.OPEN;
  }
}
