/*
 * どこで: Exchange サービス層
 * 何を: PENDING のマッチを作り、ライフサイクルに沿って状態を進める
 * なぜ: 状態変更とその通知を同じトランザクションでまとめてコミットするため
 */
package com.example.exchange.service;

import com.example.exchange.api.CareRequestNotFoundException;
import com.example.exchange.api.ForbiddenActionException;
import com.example.exchange.api.MatchNotFoundException;
import com.example.exchange.api.OfferNotFoundException;
import com.example.exchange.api.StaleTransitionException;
import com.example.exchange.api.ValidationException;
import com.example.exchange.api.response.MatchResponse;
import com.example.exchange.api.response.PageResponse;
import com.example.exchange.config.ExchangeFeedProperties;
import com.example.exchange.model.CareRequestRecord;
import com.example.exchange.model.MatchAction;
import com.example.exchange.model.MatchCandidate;
import com.example.exchange.model.MatchRecord;
import com.example.exchange.model.MatchState;
import com.example.exchange.model.MatchUpdatedEvent;
import com.example.exchange.model.NewMatchEvent;
import com.example.exchange.model.OfferRecord;
import com.example.exchange.repository.AvailabilityStore;
import com.example.exchange.repository.MatchRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class MatchLifecycleService {

  private static final Logger logger = LoggerFactory.getLogger(MatchLifecycleService.class);

  /** マッチャーが作ったマッチに記録する操作者。 */
  public static final String MATCHER_ACTOR = "system:matcher";

  // insert と検索の間に、競合したマッチが終端状態になっていることがある
  private static final int MAX_INSERT_ATTEMPTS = 3;

  private final MatchRepository matchRepository;
  private final AvailabilityStore availabilityStore;
  private final NotificationDispatcher dispatcher;
  private final ExchangeMetrics metrics;
  private final ExchangeFeedProperties feedProperties;
  private final Clock clock;

  public record PendingMatch(UUID matchId, boolean created) {}

  /**
   * 役割: 当事者の一方によるマッチの明示作成。
   * 動作: 既にある組を再送した場合はそのマッチ ID を返す。
   * 前提: 両レコードが存在し OPEN で、組として条件を満たすこと。
   */
  @Transactional
  public PendingMatch createPendingMatch(UUID offerId, UUID requestId, String actingUserId) {
    requireUser(actingUserId);
    final OfferRecord offer =
        availabilityStore.findOffer(offerId).orElseThrow(() -> new OfferNotFoundException(offerId));
    final CareRequestRecord request =
        availabilityStore
            .findRequest(requestId)
            .orElseThrow(() -> new CareRequestNotFoundException(requestId));
    if (!offer.ownerId().equals(actingUserId) && !request.seekerId().equals(actingUserId)) {
      throw new ForbiddenActionException("only the offer owner or the seeker can create this match");
    }
    if (!offer.isOpen() || !request.isOpen()) {
      throw new ValidationException("offer and request must both be OPEN");
    }
    final MatchCandidate candidate =
        MatchCandidate.evaluate(offer, request)
            .orElseThrow(
                () -> new ValidationException("offer and request do not overlap within radius"));
    return createPendingMatch(candidate, actingUserId);
  }

  /** 評価済みの組のマッチを作る。組に終端でないマッチがあればそれを返す。 */
  @Transactional
  public PendingMatch createPendingMatch(MatchCandidate candidate, String actor) {
    final UUID offerId = candidate.offer().offerId();
    final UUID requestId = candidate.request().requestId();
    for (int attempt = 1; attempt <= MAX_INSERT_ATTEMPTS; attempt++) {
      final Optional<UUID> inserted =
          matchRepository.insertPendingIfAbsent(
              UUID.randomUUID(),
              offerId,
              requestId,
              candidate.overlap().toSeconds(),
              candidate.distanceMeters(),
              actor,
              Instant.now(clock));
      if (inserted.isPresent()) {
        final MatchRecord match =
            matchRepository
                .findById(inserted.get())
                .orElseThrow(() -> new IllegalStateException("inserted match vanished"));
        dispatcher.notifyUsers(
            List.of(match.offerOwnerId(), match.seekerId()), new NewMatchEvent(match));
        metrics.recordMatchCreated();
        logger.info(
            "match created match_id={} offer_id={} request_id={} overlap_seconds={}"
                + " distance_meters={}",
            match.matchId(),
            offerId,
            requestId,
            match.overlapSeconds(),
            Math.round(match.distanceMeters()));
        return new PendingMatch(match.matchId(), true);
      }
      final Optional<MatchRecord> existing = matchRepository.findActiveByPair(offerId, requestId);
      if (existing.isPresent()) {
        logger.debug(
            "match already active match_id={} offer_id={} request_id={}",
            existing.get().matchId(),
            offerId,
            requestId);
        return new PendingMatch(existing.get().matchId(), false);
      }
    }
    throw new IllegalStateException(
        "could not settle match for offer " + offerId + " and request " + requestId);
  }

  /**
   * 役割: {@code actingUserId} として {@code action} を適用する。
   * 動作: version 付きの条件付き更新で遷移し、遷移と通知を同じトランザクションでコミットする。
   *
   * @throws ForbiddenActionException 操作者が当事者でない、またはその操作を行える側でないとき
   * @throws StaleTransitionException 現在の状態から許されない操作か、読み取り後にマッチが変わったとき
   */
  @Transactional
  public MatchResponse transition(UUID matchId, String action, String actingUserId) {
    requireUser(actingUserId);
    final MatchAction matchAction = parseAction(action);
    final MatchRecord match =
        matchRepository.findById(matchId).orElseThrow(() -> new MatchNotFoundException(matchId));
    if (!match.isParty(actingUserId)) {
      metrics.recordTransition(matchAction.value(), "forbidden");
      throw new ForbiddenActionException("user is not a party of match " + matchId);
    }
    if (!matchAction.isAllowedFor(match, actingUserId)) {
      metrics.recordTransition(matchAction.value(), "forbidden");
      throw new ForbiddenActionException(
          "user may not " + matchAction.value() + " match " + matchId);
    }
    final Optional<MatchState> target = match.state().next(matchAction);
    if (target.isEmpty()) {
      metrics.recordTransition(matchAction.value(), "stale");
      throw new StaleTransitionException(
          matchId, "cannot " + matchAction.value() + " a match in state " + match.state());
    }
    final Optional<MatchRecord> updated =
        matchRepository.compareAndSetState(
            matchId,
            match.version(),
            match.state(),
            target.get(),
            actingUserId,
            Instant.now(clock));
    if (updated.isEmpty()) {
      metrics.recordTransition(matchAction.value(), "stale");
      throw new StaleTransitionException(matchId, "match " + matchId + " was modified concurrently");
    }
    final MatchRecord result = updated.get();
    dispatcher.notifyUsers(
        List.of(result.offerOwnerId(), result.seekerId()),
        new MatchUpdatedEvent(result, match.state()));
    metrics.recordTransition(matchAction.value(), "success");
    logger.info(
        "match transition match_id={} action={} from={} to={} actor={} version={}",
        matchId,
        matchAction.value(),
        match.state(),
        result.state(),
        actingUserId,
        result.version());
    return MatchResponse.from(result);
  }

  public MatchResponse find(UUID matchId, String userId) {
    requireUser(userId);
    final MatchRecord match =
        matchRepository.findById(matchId).orElseThrow(() -> new MatchNotFoundException(matchId));
    if (!match.isParty(userId)) {
      throw new ForbiddenActionException("user is not a party of match " + matchId);
    }
    return MatchResponse.from(match);
  }

  /** ユーザーの操作待ちのマッチ。スコアの高い順。 */
  public PageResponse<MatchResponse> pendingFor(String userId, int page, int pageSize) {
    requireUser(userId);
    final Paging paging = Paging.of(page, pageSize, feedProperties.maxPageSize());
    final List<MatchResponse> items =
        matchRepository.findAwaiting(userId, paging.pageSize(), paging.offset()).stream()
            .map(MatchResponse::from)
            .toList();
    return new PageResponse<>(items, matchRepository.countAwaiting(userId), page, pageSize);
  }

  /** ユーザーのすべてのマッチ。状態名で絞り込める。 */
  public PageResponse<MatchResponse> matchesFor(
      String userId, String stateFilter, int page, int pageSize) {
    requireUser(userId);
    final MatchState state = parseStateFilter(stateFilter);
    final Paging paging = Paging.of(page, pageSize, feedProperties.maxPageSize());
    final List<MatchResponse> items =
        matchRepository.findByParticipant(userId, state, paging.pageSize(), paging.offset())
            .stream()
            .map(MatchResponse::from)
            .toList();
    return new PageResponse<>(
        items, matchRepository.countByParticipant(userId, state), page, pageSize);
  }

  private MatchAction parseAction(String action) {
    if (action == null || action.isBlank()) {
      throw new ValidationException("action is required");
    }
    try {
      return MatchAction.fromValue(action.trim());
    } catch (IllegalArgumentException ex) {
      throw new ValidationException(ex.getMessage());
    }
  }

  private MatchState parseStateFilter(String stateFilter) {
    if (stateFilter == null || stateFilter.isBlank()) {
      return null;
    }
    try {
      return MatchState.fromValue(stateFilter.trim());
    } catch (IllegalArgumentException ex) {
      throw new ValidationException(ex.getMessage());
    }
  }

  private void requireUser(String userId) {
    if (userId == null || userId.isBlank()) {
      throw new ValidationException("X-User-Id is required");
    }
  }
}
