package com.example.exchange.model;

import java.time.Duration;
import java.util.Comparator;
import java.util.Optional;

/** 条件を満たすオファー/リクエストの組と、順位付けに使う値。 */
public record MatchCandidate(
    OfferRecord offer, CareRequestRecord request, Duration overlap, double distanceMeters) {

  /** 重なりが長い順、同じなら近い順。 */
  public static final Comparator<MatchCandidate> SCORE_ORDER =
      Comparator.comparing(MatchCandidate::overlap)
          .reversed()
          .thenComparingDouble(MatchCandidate::distanceMeters);

  /**
   * 役割: オファーとリクエストの組を評価する。
   * 動作: 同一ユーザー同士、期間が重ならない組、リクエストの半径外のオファーは空を返す。
   */
  public static Optional<MatchCandidate> evaluate(OfferRecord offer, CareRequestRecord request) {
    if (offer.ownerId().equals(request.seekerId())) {
      return Optional.empty();
    }
    if (!offer.window().overlaps(request.window())) {
      return Optional.empty();
    }
    final double distance = offer.point().distanceMeters(request.point());
    if (distance > request.radiusMeters()) {
      return Optional.empty();
    }
    return Optional.of(
        new MatchCandidate(offer, request, offer.window().overlapWith(request.window()), distance));
  }
}
