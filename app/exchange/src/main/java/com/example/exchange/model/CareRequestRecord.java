/*
 * どこで: Exchange ドメインモデル
 * 何を: 預け先を探す利用者が出したリクエストの行スナップショット
 * なぜ: どこまで離れたオファーを候補にするかはリクエスト側の半径で決まるため
 */
package com.example.exchange.model;

import java.time.Instant;
import java.util.UUID;

public record CareRequestRecord(
    UUID requestId,
    String seekerId,
    Instant startAt,
    Instant endAt,
    double latitude,
    double longitude,
    double radiusMeters,
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
