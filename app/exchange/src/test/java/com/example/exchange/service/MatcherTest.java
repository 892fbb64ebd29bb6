/*
 * どこで: Exchange マッチャーの単体テスト
 * 何を: 候補の順位付けと候補スキャンの上限つきリトライを確認する
 * なぜ: 一時的な DB 障害で登録・更新が中途半端にマッチした状態を残さないため
 */
package com.example.exchange.service;

import static com.example.exchange.ExchangeTestRecords.FIVE_PM;
import static com.example.exchange.ExchangeTestRecords.LATITUDE;
import static com.example.exchange.ExchangeTestRecords.NINE;
import static com.example.exchange.ExchangeTestRecords.NOON;
import static com.example.exchange.ExchangeTestRecords.TEN;
import static com.example.exchange.ExchangeTestRecords.latitudeDelta;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.exchange.ExchangeTestRecords;
import com.example.exchange.api.MatchingUnavailableException;
import com.example.exchange.config.ExchangeMatchingProperties;
import com.example.exchange.model.CareRequestRecord;
import com.example.exchange.model.MatchCandidate;
import com.example.exchange.model.OfferRecord;
import com.example.exchange.repository.AvailabilityStore;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessResourceException;

class MatcherTest {

    private static final ExchangeMatchingProperties PROPERTIES =
            new ExchangeMatchingProperties(3, Duration.ofMillis(100), Duration.ofMillis(250));

    private AvailabilityStore availabilityStore;
    private MatchLifecycleService lifecycleService;
    private ExchangeMetrics metrics;
    private List<Duration> sleeps;
    private Matcher matcher;

    @BeforeEach
    void setUp() {
        availabilityStore = mock(AvailabilityStore.class);
        lifecycleService = mock(MatchLifecycleService.class);
        metrics = mock(ExchangeMetrics.class);
        sleeps = new ArrayList<>();
        matcher = new Matcher(availabilityStore, lifecycleService, PROPERTIES, metrics) {
            @Override
            void sleep(Duration duration) {
                sleeps.add(duration);
            }
        };
        when(lifecycleService.createPendingMatch(any(MatchCandidate.class), eq(MatchLifecycleService.MATCHER_ACTOR)))
                .thenAnswer(invocation -> new MatchLifecycleService.PendingMatch(UUID.randomUUID(), true));
    }

    @Test
    void matchOfferCreatesQualifyingMatchesBestScoreFirst() {
        OfferRecord offer = ExchangeTestRecords.offer("owner-a");
        CareRequestRecord shortOverlap = ExchangeTestRecords.request(
                "seeker-1", TEN, TEN.plus(Duration.ofMinutes(30)), LATITUDE, 5_000.0);
        CareRequestRecord longOverlapFar = ExchangeTestRecords.request(
                "seeker-2", NINE, NOON, LATITUDE + latitudeDelta(3_000.0), 5_000.0);
        CareRequestRecord longOverlapNear = ExchangeTestRecords.request(
                "seeker-3", NINE, NOON, LATITUDE + latitudeDelta(500.0), 5_000.0);
        CareRequestRecord outOfRadius = ExchangeTestRecords.request(
                "seeker-4", NINE, FIVE_PM, LATITUDE + latitudeDelta(50_000.0), 5_000.0);
        when(availabilityStore.requestsOverlapping(offer))
                .thenReturn(List.of(shortOverlap, longOverlapFar, outOfRadius, longOverlapNear));

        List<UUID> matchIds = matcher.matchOffer(offer);

        ArgumentCaptor<MatchCandidate> captor = ArgumentCaptor.forClass(MatchCandidate.class);
        verify(lifecycleService, times(3))
                .createPendingMatch(captor.capture(), eq(MatchLifecycleService.MATCHER_ACTOR));
        assertThat(captor.getAllValues())
                .extracting(candidate -> candidate.request().seekerId())
                .containsExactly("seeker-3", "seeker-2", "seeker-1");
        assertThat(matchIds).hasSize(3).doesNotHaveDuplicates();
    }

    @Test
    void matchRequestWithNoCandidatesCreatesNothing() {
        CareRequestRecord request = ExchangeTestRecords.request("seeker-1");
        when(availabilityStore.offersOverlapping(request)).thenReturn(List.of());

        assertThat(matcher.matchRequest(request)).isEmpty();
        verify(lifecycleService, never()).createPendingMatch(any(MatchCandidate.class), any());
    }

    @Test
    void transientFailureRestartsTheScan() {
        CareRequestRecord request = ExchangeTestRecords.request("seeker-1");
        OfferRecord offer = ExchangeTestRecords.offer("owner-a");
        when(availabilityStore.offersOverlapping(request))
                .thenThrow(new TransientDataAccessResourceException("connection reset"))
                .thenReturn(List.of(offer));

        List<UUID> matchIds = matcher.matchRequest(request);

        assertThat(matchIds).hasSize(1);
        assertThat(sleeps).containsExactly(Duration.ofMillis(100));
        verify(metrics).recordMatchingRetry();
    }

    @Test
    void exhaustedRetriesRaiseMatchingUnavailable() {
        OfferRecord offer = ExchangeTestRecords.offer("owner-a");
        when(availabilityStore.requestsOverlapping(offer))
                .thenThrow(new QueryTimeoutException("statement timeout"));

        assertThatThrownBy(() -> matcher.matchOffer(offer))
                .isInstanceOf(MatchingUnavailableException.class)
                .hasCauseInstanceOf(QueryTimeoutException.class);

        assertThat(sleeps).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
        verify(availabilityStore, times(3)).requestsOverlapping(offer);
        verify(metrics, times(2)).recordMatchingRetry();
    }

    @Test
    void nonTransientFailureIsNotRetried() {
        OfferRecord offer = ExchangeTestRecords.offer("owner-a");
        when(availabilityStore.requestsOverlapping(offer))
                .thenThrow(new DataIntegrityViolationException("broken row"));

        assertThatThrownBy(() -> matcher.matchOffer(offer))
                .isInstanceOf(DataIntegrityViolationException.class);

        assertThat(sleeps).isEmpty();
        verify(metrics, never()).recordMatchingRetry();
    }

    @Test
    void computeBackoffDurationDoublesUntilCap() {
        assertThat(matcher.computeBackoffDuration(1)).isEqualTo(Duration.ofMillis(100));
        assertThat(matcher.computeBackoffDuration(2)).isEqualTo(Duration.ofMillis(200));
        assertThat(matcher.computeBackoffDuration(3)).isEqualTo(Duration.ofMillis(250));
        assertThat(matcher.computeBackoffDuration(10)).isEqualTo(Duration.ofMillis(250));
    }
}
