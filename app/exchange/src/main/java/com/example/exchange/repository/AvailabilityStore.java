/*
 * どこで: Exchange データアクセス
 * 何を: オファーとリクエストの永続化、マッチャー用の重なり/距離クエリ、検索クエリを定義する
 * なぜ: マッチャーとサービスを保存方式から切り離すため
 */
package com.example.exchange.repository;

import com.example.exchange.model.AvailabilitySearch;
import com.example.exchange.model.CareRequestRecord;
import com.example.exchange.model.OfferRecord;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AvailabilityStore {

  OfferRecord insertOffer(OfferRecord offer);

  /** {@code offer.ownerId()} が持つ OPEN のオファーの期間・犬・地点を書き換える。 */
  Optional<OfferRecord> updateOpenOffer(OfferRecord offer);

  Optional<OfferRecord> findOffer(UUID offerId);

  /** OPEN → WITHDRAWN。変更行数を返す (OPEN でなければ 0)。 */
  int withdrawOffer(UUID offerId, Instant now);

  List<OfferRecord> findOffersByOwner(String ownerId, int limit, int offset);

  long countOffersByOwner(String ownerId);

  CareRequestRecord insertRequest(CareRequestRecord request);

  Optional<CareRequestRecord> updateOpenRequest(CareRequestRecord request);

  Optional<CareRequestRecord> findRequest(UUID requestId);

  int withdrawRequest(UUID requestId, Instant now);

  List<CareRequestRecord> findRequestsBySeeker(String seekerId, int limit, int offset);

  long countRequestsBySeeker(String seekerId);

  /** OPEN のオファーを条件で絞り、{@code search} の並び順でページングする。 */
  List<OfferRecord> searchOffers(AvailabilitySearch search, int limit, int offset);

  long countOffers(AvailabilitySearch search);

  List<CareRequestRecord> searchRequests(AvailabilitySearch search, int limit, int offset);

  long countRequests(AvailabilitySearch search);

  /** 他ユーザーの OPEN リクエストのうち、期間がオファーと重なり、リクエスト自身の半径がオファー地点を含むもの。 */
  List<CareRequestRecord> requestsOverlapping(OfferRecord offer);

  /** 他ユーザーの OPEN オファーのうち、リクエストと期間が重なり、リクエストの半径内にあるもの。 */
  List<OfferRecord> offersOverlapping(CareRequestRecord request);

  /** end_at が {@code threshold} 以前の OPEN オファー/リクエストを EXPIRED にする。 */
  ExpiredCounts expireEndedBefore(Instant threshold, Instant now);

  record ExpiredCounts(int offers, int requests) {
    public int total() {
      return offers + requests;
    }
  }
}
