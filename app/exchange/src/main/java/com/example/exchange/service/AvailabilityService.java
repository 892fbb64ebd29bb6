/*
 * どこで: Exchange サービス層
 * 何を: オファーとリクエストを検証して保存し、保存したレコードでマッチャーを動かす
 * なぜ: レコードを変更できるのは持ち主だけで、それも OPEN の間に限るため
 */
package com.example.exchange.service;

import com.example.exchange.api.CareRequestNotFoundException;
import com.example.exchange.api.ForbiddenActionException;
import com.example.exchange.api.OfferNotFoundException;
import com.example.exchange.api.ValidationException;
import com.example.exchange.api.request.CareRequestUpsertRequest;
import com.example.exchange.api.request.OfferUpsertRequest;
import com.example.exchange.api.response.AvailabilityUpsertResponse;
import com.example.exchange.api.response.CareRequestResponse;
import com.example.exchange.api.response.OfferResponse;
import com.example.exchange.api.response.PageResponse;
import com.example.exchange.config.ExchangeFeedProperties;
import com.example.exchange.model.AvailabilitySearch;
import com.example.exchange.model.AvailabilityStatus;
import com.example.exchange.model.CareRequestRecord;
import com.example.exchange.model.GeoPoint;
import com.example.exchange.model.OfferRecord;
import com.example.exchange.model.TimeWindow;
import com.example.exchange.repository.AvailabilityStore;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AvailabilityService {

  private static final Logger logger = LoggerFactory.getLogger(AvailabilityService.class);

  private final AvailabilityStore availabilityStore;
  private final Matcher matcher;
  private final ExchangeFeedProperties feedProperties;
  private final Clock clock;

  public AvailabilityUpsertResponse upsertOffer(String ownerId, OfferUpsertRequest request) {
    requireUser(ownerId);
    validateOffer(request);
    final Instant now = Instant.now(clock);
    final OfferRecord saved;
    if (request.offerId() == null) {
      saved =
          availabilityStore.insertOffer(
              new OfferRecord(
                  UUID.randomUUID(),
                  ownerId,
                  request.dogId().trim(),
                  request.startAt(),
                  request.endAt(),
                  request.latitude(),
                  request.longitude(),
                  AvailabilityStatus.OPEN,
                  now,
                  now));
    } else {
      final OfferRecord existing =
          availabilityStore
              .findOffer(request.offerId())
              .orElseThrow(() -> new OfferNotFoundException(request.offerId()));
      ensureOwner(existing.ownerId(), ownerId, "offer");
      ensureOpen(existing.status(), "offer");
      saved =
          availabilityStore
              .updateOpenOffer(
                  new OfferRecord(
                      existing.offerId(),
                      ownerId,
                      request.dogId().trim(),
                      request.startAt(),
                      request.endAt(),
                      request.latitude(),
                      request.longitude(),
                      AvailabilityStatus.OPEN,
                      existing.createdAt(),
                      now))
              .orElseThrow(() -> new ValidationException("only OPEN offers can be updated"));
    }
    logger.info("offer saved offer_id={} owner_id={}", saved.offerId(), ownerId);
    final List<UUID> matchIds = matcher.matchOffer(saved);
    return new AvailabilityUpsertResponse(saved.offerId(), saved.status().name(), matchIds);
  }

  public AvailabilityUpsertResponse upsertRequest(
      String seekerId, CareRequestUpsertRequest request) {
    requireUser(seekerId);
    validateRequest(request);
    final Instant now = Instant.now(clock);
    final CareRequestRecord saved;
    if (request.requestId() == null) {
      saved =
          availabilityStore.insertRequest(
              new CareRequestRecord(
                  UUID.randomUUID(),
                  seekerId,
                  request.startAt(),
                  request.endAt(),
                  request.latitude(),
                  request.longitude(),
                  request.radiusMeters(),
                  AvailabilityStatus.OPEN,
                  now,
                  now));
    } else {
      final CareRequestRecord existing =
          availabilityStore
              .findRequest(request.requestId())
              .orElseThrow(() -> new CareRequestNotFoundException(request.requestId()));
      ensureOwner(existing.seekerId(), seekerId, "request");
      ensureOpen(existing.status(), "request");
      saved =
          availabilityStore
              .updateOpenRequest(
                  new CareRequestRecord(
                      existing.requestId(),
                      seekerId,
                      request.startAt(),
                      request.endAt(),
                      request.latitude(),
                      request.longitude(),
                      request.radiusMeters(),
                      AvailabilityStatus.OPEN,
                      existing.createdAt(),
                      now))
              .orElseThrow(() -> new ValidationException("only OPEN requests can be updated"));
    }
    logger.info("request saved request_id={} seeker_id={}", saved.requestId(), seekerId);
    final List<UUID> matchIds = matcher.matchRequest(saved);
    return new AvailabilityUpsertResponse(saved.requestId(), saved.status().name(), matchIds);
  }

  /** OPEN → WITHDRAWN。OPEN でなくなったレコードはそのままにする。 */
  public void withdrawOffer(UUID offerId, String actingUserId) {
    requireUser(actingUserId);
    final OfferRecord offer =
        availabilityStore.findOffer(offerId).orElseThrow(() -> new OfferNotFoundException(offerId));
    ensureOwner(offer.ownerId(), actingUserId, "offer");
    final int updated = availabilityStore.withdrawOffer(offerId, Instant.now(clock));
    logger.info("offer withdrawn offer_id={} changed={}", offerId, updated > 0);
  }

  public void withdrawRequest(UUID requestId, String actingUserId) {
    requireUser(actingUserId);
    final CareRequestRecord request =
        availabilityStore
            .findRequest(requestId)
            .orElseThrow(() -> new CareRequestNotFoundException(requestId));
    ensureOwner(request.seekerId(), actingUserId, "request");
    final int updated = availabilityStore.withdrawRequest(requestId, Instant.now(clock));
    logger.info("request withdrawn request_id={} changed={}", requestId, updated > 0);
  }

  public PageResponse<OfferResponse> listOffersByOwner(String ownerId, int page, int pageSize) {
    requireUser(ownerId);
    final Paging paging = Paging.of(page, pageSize, feedProperties.maxPageSize());
    final List<OfferResponse> items =
        availabilityStore.findOffersByOwner(ownerId, paging.pageSize(), paging.offset()).stream()
            .map(OfferResponse::from)
            .toList();
    return new PageResponse<>(
        items, availabilityStore.countOffersByOwner(ownerId), page, pageSize);
  }

  public PageResponse<CareRequestResponse> listRequestsBySeeker(
      String seekerId, int page, int pageSize) {
    requireUser(seekerId);
    final Paging paging = Paging.of(page, pageSize, feedProperties.maxPageSize());
    final List<CareRequestResponse> items =
        availabilityStore.findRequestsBySeeker(seekerId, paging.pageSize(), paging.offset())
            .stream()
            .map(CareRequestResponse::from)
            .toList();
    return new PageResponse<>(
        items, availabilityStore.countRequestsBySeeker(seekerId), page, pageSize);
  }

  /**
   * 役割: OPEN のオファーを期間と並び順で検索する。
   * 動作: {@code excludeMine} なら呼び出しユーザーのオファーを除く。sort は {@code -} 始まりで降順。
   * 前提: page は 1 始まり、page_size は設定上限以内。
   */
  public PageResponse<OfferResponse> searchOffers(
      String userId,
      Instant startDate,
      Instant endDate,
      boolean excludeMine,
      String sort,
      int page,
      int pageSize) {
    final AvailabilitySearch search = search(userId, startDate, endDate, excludeMine, sort);
    final Paging paging = Paging.of(page, pageSize, feedProperties.maxPageSize());
    final List<OfferResponse> items =
        availabilityStore.searchOffers(search, paging.pageSize(), paging.offset()).stream()
            .map(OfferResponse::from)
            .toList();
    return new PageResponse<>(items, availabilityStore.countOffers(search), page, pageSize);
  }

  /** リクエスト版の {@link #searchOffers}。 */
  public PageResponse<CareRequestResponse> searchRequests(
      String userId,
      Instant startDate,
      Instant endDate,
      boolean excludeMine,
      String sort,
      int page,
      int pageSize) {
    final AvailabilitySearch search = search(userId, startDate, endDate, excludeMine, sort);
    final Paging paging = Paging.of(page, pageSize, feedProperties.maxPageSize());
    final List<CareRequestResponse> items =
        availabilityStore.searchRequests(search, paging.pageSize(), paging.offset()).stream()
            .map(CareRequestResponse::from)
            .toList();
    return new PageResponse<>(items, availabilityStore.countRequests(search), page, pageSize);
  }

  private AvailabilitySearch search(
      String userId, Instant startDate, Instant endDate, boolean excludeMine, String sort) {
    requireUser(userId);
    return AvailabilitySearch.of(startDate, endDate, excludeMine ? userId : null, sort);
  }

  private void validateOffer(OfferUpsertRequest request) {
    if (request == null) {
      throw new ValidationException("request is required");
    }
    if (request.dogId() == null || request.dogId().isBlank()) {
      throw new ValidationException("dog_id is required");
    }
    validateWindow(request.startAt(), request.endAt());
    validatePoint(request.latitude(), request.longitude());
  }

  private void validateRequest(CareRequestUpsertRequest request) {
    if (request == null) {
      throw new ValidationException("request is required");
    }
    validateWindow(request.startAt(), request.endAt());
    validatePoint(request.latitude(), request.longitude());
    final Double radius = request.radiusMeters();
    if (radius == null || !Double.isFinite(radius) || radius <= 0) {
      throw new ValidationException("radius_meters must be > 0");
    }
  }

  private void validateWindow(Instant startAt, Instant endAt) {
    if (startAt == null || endAt == null) {
      throw new ValidationException("start_at and end_at are required");
    }
    if (!new TimeWindow(startAt, endAt).isValid()) {
      throw new ValidationException("start_at must be before end_at");
    }
  }

  private void validatePoint(Double latitude, Double longitude) {
    if (latitude == null || longitude == null) {
      throw new ValidationException("latitude and longitude are required");
    }
    if (!new GeoPoint(latitude, longitude).isValid()) {
      throw new ValidationException(
          "latitude must be within [-90, 90] and longitude within [-180, 180]");
    }
  }

  private void ensureOwner(String ownerId, String actingUserId, String kind) {
    if (!ownerId.equals(actingUserId)) {
      throw new ForbiddenActionException("only the owner can change this " + kind);
    }
  }

  private void ensureOpen(AvailabilityStatus status, String kind) {
    if (status != AvailabilityStatus.OPEN) {
      throw new ValidationException("only OPEN " + kind + "s can be updated");
    }
  }

  private void requireUser(String userId) {
    if (userId == null || userId.isBlank()) {
      throw new ValidationException("X-User-Id is required");
    }
  }
}
