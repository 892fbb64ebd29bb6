/*
 * どこで: Exchange サービス層
 * 何を: 保存直後のオファー/リクエストの相手候補を探し、スコアの高い順に PENDING マッチを作る
 * なぜ: マッチングは登録・更新のたびに同期で走り、一時的な DB 障害ではスキャン全体を上限回数までやり直すため
 */
package com.example.exchange.service;

import com.example.exchange.api.MatchingUnavailableException;
import com.example.exchange.config.ExchangeMatchingProperties;
import com.example.exchange.model.CareRequestRecord;
import com.example.exchange.model.MatchCandidate;
import com.example.exchange.model.OfferRecord;
import com.example.exchange.repository.AvailabilityStore;
import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class Matcher {

    private static final Logger logger = LoggerFactory.getLogger(Matcher.class);

    private final AvailabilityStore availabilityStore;
    private final MatchLifecycleService lifecycleService;
    private final ExchangeMatchingProperties properties;
    private final ExchangeMetrics metrics;

    /** {@code offer} と条件を満たすすべての OPEN リクエストとのマッチを作る。 */
    public List<UUID> matchOffer(OfferRecord offer) {
        return runScan("offer_id=" + offer.offerId(), () -> createAll(
                availabilityStore.requestsOverlapping(offer).stream()
                        .map(request -> MatchCandidate.evaluate(offer, request))
                        .flatMap(Optional::stream)
                        .sorted(MatchCandidate.SCORE_ORDER)
                        .toList()));
    }

    /** {@code request} と条件を満たすすべての OPEN オファーとのマッチを作る。 */
    public List<UUID> matchRequest(CareRequestRecord request) {
        return runScan("request_id=" + request.requestId(), () -> createAll(
                availabilityStore.offersOverlapping(request).stream()
                        .map(offer -> MatchCandidate.evaluate(offer, request))
                        .flatMap(Optional::stream)
                        .sorted(MatchCandidate.SCORE_ORDER)
                        .toList()));
    }

    private List<UUID> createAll(List<MatchCandidate> candidates) {
        List<UUID> matchIds = new ArrayList<>(candidates.size());
        for (MatchCandidate candidate : candidates) {
            matchIds.add(lifecycleService
                    .createPendingMatch(candidate, MatchLifecycleService.MATCHER_ACTOR)
                    .matchId());
        }
        return matchIds;
    }

    private List<UUID> runScan(String subject, Supplier<List<UUID>> scan) {
        int maxAttempts = Math.max(1, properties.maxAttempts());
        int attempt = 1;
        while (true) {
            try {
                List<UUID> matchIds = scan.get();
                logger.debug("matching scan finished {} matches={} attempt={}", subject, matchIds.size(), attempt);
                return matchIds;
            } catch (TransientDataAccessException
                    | DataAccessResourceFailureException
                    | RecoverableDataAccessException ex) {
                if (attempt >= maxAttempts) {
                    logger.error("matching scan gave up {} attempts={}", subject, attempt, ex);
                    throw new MatchingUnavailableException("matching is temporarily unavailable", ex);
                }
                Duration backoff = computeBackoffDuration(attempt);
                metrics.recordMatchingRetry();
                logger.warn("matching scan failed {} attempt={} retry_in_ms={}", subject, attempt, backoff.toMillis(), ex);
                sleep(backoff);
                attempt++;
            }
        }
    }

    @VisibleForTesting
    Duration computeBackoffDuration(int attempt) {
        double baseMillis = properties.backoffBase().toMillis();
        double exp = baseMillis * Math.pow(2, attempt - 1);
        double capped = Math.min(exp, properties.backoffMax().toMillis());
        return Duration.ofMillis((long) Math.ceil(capped));
    }

    @VisibleForTesting
    void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new MatchingUnavailableException("matching interrupted", ex);
        }
    }
}
