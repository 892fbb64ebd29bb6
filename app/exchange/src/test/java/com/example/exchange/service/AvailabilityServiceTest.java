package com.example.exchange.service;

import static com.example.exchange.ExchangeTestRecords.FIVE_PM;
import static com.example.exchange.ExchangeTestRecords.LATITUDE;
import static com.example.exchange.ExchangeTestRecords.LONGITUDE;
import static com.example.exchange.ExchangeTestRecords.NINE;
import static com.example.exchange.ExchangeTestRecords.NOON;
import static com.example.exchange.ExchangeTestRecords.TEN;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.exchange.ExchangeTestRecords;
import com.example.exchange.api.CareRequestNotFoundException;
import com.example.exchange.api.ForbiddenActionException;
import com.example.exchange.api.MatchingUnavailableException;
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
import com.example.exchange.model.AvailabilitySearch.SortField;
import com.example.exchange.model.AvailabilityStatus;
import com.example.exchange.model.CareRequestRecord;
import com.example.exchange.model.OfferRecord;
import com.example.exchange.repository.AvailabilityStore;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AvailabilityServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2025-05-31T12:00:00Z");
  private static final String OWNER = "owner-a";
  private static final String SEEKER = "seeker-b";

  @Mock private AvailabilityStore availabilityStore;
  @Mock private Matcher matcher;

  private AvailabilityService service;

  @BeforeEach
  void setUp() {
    service =
        new AvailabilityService(
            availabilityStore,
            matcher,
            new ExchangeFeedProperties(50, 200, 100, 100),
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void newOfferIsStoredOpenAndMatched() {
    final UUID matchId = UUID.randomUUID();
    when(availabilityStore.insertOffer(any())).thenAnswer(invocation -> invocation.getArgument(0));
    when(matcher.matchOffer(any())).thenReturn(List.of(matchId));

    final AvailabilityUpsertResponse response =
        service.upsertOffer(OWNER, offerRequest(null, " rex ", NINE, FIVE_PM, LATITUDE));

    final ArgumentCaptor<OfferRecord> stored = ArgumentCaptor.forClass(OfferRecord.class);
    verify(availabilityStore).insertOffer(stored.capture());
    assertThat(stored.getValue().ownerId()).isEqualTo(OWNER);
    assertThat(stored.getValue().dogId()).isEqualTo("rex");
    assertThat(stored.getValue().status()).isEqualTo(AvailabilityStatus.OPEN);
    assertThat(stored.getValue().createdAt()).isEqualTo(FIXED_NOW);
    assertThat(response.id()).isEqualTo(stored.getValue().offerId());
    assertThat(response.status()).isEqualTo("OPEN");
    assertThat(response.matchIds()).containsExactly(matchId);
  }

  @Test
  void offerValidationRejectsBadInput() {
    assertThatThrownBy(() -> service.upsertOffer(OWNER, offerRequest(null, " ", NINE, NOON, 0)))
        .isInstanceOf(ValidationException.class)
        .hasMessage("dog_id is required");
    assertThatThrownBy(() -> service.upsertOffer(OWNER, offerRequest(null, "rex", NOON, NOON, 0)))
        .isInstanceOf(ValidationException.class)
        .hasMessage("start_at must be before end_at");
    assertThatThrownBy(() -> service.upsertOffer(OWNER, offerRequest(null, "rex", NINE, NOON, 91)))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("latitude");
    assertThatThrownBy(() -> service.upsertOffer(null, offerRequest(null, "rex", NINE, NOON, 0)))
        .isInstanceOf(ValidationException.class)
        .hasMessage("X-User-Id is required");
    verifyNoInteractions(availabilityStore, matcher);
  }

  @Test
  void requestRadiusMustBePositive() {
    final CareRequestUpsertRequest request =
        new CareRequestUpsertRequest(null, TEN, NOON, LATITUDE, LONGITUDE, 0.0);

    assertThatThrownBy(() -> service.upsertRequest(SEEKER, request))
        .isInstanceOf(ValidationException.class)
        .hasMessage("radius_meters must be > 0");
  }

  @Test
  void onlyTheOwnerMayUpdateAnOffer() {
    final OfferRecord existing = ExchangeTestRecords.offer(OWNER);
    when(availabilityStore.findOffer(existing.offerId())).thenReturn(Optional.of(existing));

    assertThatThrownBy(
            () ->
                service.upsertOffer(
                    SEEKER, offerRequest(existing.offerId(), "rex", NINE, NOON, LATITUDE)))
        .isInstanceOf(ForbiddenActionException.class);
    verify(availabilityStore, never()).updateOpenOffer(any());
    verifyNoInteractions(matcher);
  }

  @Test
  void withdrawnOfferCannotBeUpdated() {
    final OfferRecord existing =
        ExchangeTestRecords.offer(
            UUID.randomUUID(), OWNER, NINE, NOON, LATITUDE, AvailabilityStatus.WITHDRAWN);
    when(availabilityStore.findOffer(existing.offerId())).thenReturn(Optional.of(existing));

    assertThatThrownBy(
            () ->
                service.upsertOffer(
                    OWNER, offerRequest(existing.offerId(), "rex", NINE, NOON, LATITUDE)))
        .isInstanceOf(ValidationException.class)
        .hasMessage("only OPEN offers can be updated");
  }

  @Test
  void updateOfUnknownOfferIsNotFound() {
    final UUID offerId = UUID.randomUUID();
    when(availabilityStore.findOffer(offerId)).thenReturn(Optional.empty());

    assertThatThrownBy(
            () -> service.upsertOffer(OWNER, offerRequest(offerId, "rex", NINE, NOON, LATITUDE)))
        .isInstanceOf(OfferNotFoundException.class);
  }

  @Test
  void updateKeepsCreatedAtAndRematches() {
    final OfferRecord existing = ExchangeTestRecords.offer(OWNER);
    when(availabilityStore.findOffer(existing.offerId())).thenReturn(Optional.of(existing));
    when(availabilityStore.updateOpenOffer(any()))
        .thenAnswer(invocation -> Optional.of(invocation.getArgument(0)));
    when(matcher.matchOffer(any())).thenReturn(List.of());

    service.upsertOffer(OWNER, offerRequest(existing.offerId(), "rex", TEN, NOON, LATITUDE));

    final ArgumentCaptor<OfferRecord> updated = ArgumentCaptor.forClass(OfferRecord.class);
    verify(availabilityStore).updateOpenOffer(updated.capture());
    assertThat(updated.getValue().startAt()).isEqualTo(TEN);
    assertThat(updated.getValue().createdAt()).isEqualTo(existing.createdAt());
    assertThat(updated.getValue().updatedAt()).isEqualTo(FIXED_NOW);
    verify(matcher).matchOffer(updated.getValue());
  }

  @Test
  void matcherFailureSurfacesAfterTheRequestIsStored() {
    when(availabilityStore.insertRequest(any()))
        .thenAnswer(invocation -> invocation.getArgument(0));
    when(matcher.matchRequest(any()))
        .thenThrow(new MatchingUnavailableException("matching is temporarily unavailable", null));

    assertThatThrownBy(
            () ->
                service.upsertRequest(
                    SEEKER,
                    new CareRequestUpsertRequest(null, TEN, NOON, LATITUDE, LONGITUDE, 5_000.0)))
        .isInstanceOf(MatchingUnavailableException.class);
    verify(availabilityStore).insertRequest(any(CareRequestRecord.class));
  }

  @Test
  void withdrawIsRestrictedToTheOwner() {
    final OfferRecord existing = ExchangeTestRecords.offer(OWNER);
    when(availabilityStore.findOffer(existing.offerId())).thenReturn(Optional.of(existing));

    assertThatThrownBy(() -> service.withdrawOffer(existing.offerId(), SEEKER))
        .isInstanceOf(ForbiddenActionException.class);

    service.withdrawOffer(existing.offerId(), OWNER);
    verify(availabilityStore).withdrawOffer(existing.offerId(), FIXED_NOW);
  }

  @Test
  void withdrawOfUnknownRequestIsNotFound() {
    final UUID requestId = UUID.randomUUID();
    when(availabilityStore.findRequest(requestId)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.withdrawRequest(requestId, SEEKER))
        .isInstanceOf(CareRequestNotFoundException.class);
  }

  @Test
  void listingRejectsOversizedPages() {
    assertThatThrownBy(() -> service.listOffersByOwner(OWNER, 1, 101))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> service.listRequestsBySeeker(SEEKER, 0, 10))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void searchExcludesTheCallerAndParsesDescendingSort() {
    final OfferRecord other = ExchangeTestRecords.offer("owner-z");
    when(availabilityStore.searchOffers(any(), eq(20), eq(20))).thenReturn(List.of(other));
    when(availabilityStore.countOffers(any())).thenReturn(41L);

    final PageResponse<OfferResponse> page =
        service.searchOffers(OWNER, NINE, FIVE_PM, true, "-end_at", 2, 20);

    final ArgumentCaptor<AvailabilitySearch> search =
        ArgumentCaptor.forClass(AvailabilitySearch.class);
    verify(availabilityStore).searchOffers(search.capture(), eq(20), eq(20));
    assertThat(search.getValue().excludeUserId()).isEqualTo(OWNER);
    assertThat(search.getValue().startFrom()).isEqualTo(NINE);
    assertThat(search.getValue().endBy()).isEqualTo(FIVE_PM);
    assertThat(search.getValue().sortField()).isEqualTo(SortField.END_AT);
    assertThat(search.getValue().descending()).isTrue();
    assertThat(page.items()).extracting(OfferResponse::ownerId).containsExactly("owner-z");
    assertThat(page.total()).isEqualTo(41);
    assertThat(page.hasMore()).isTrue();
  }

  @Test
  void searchKeepsOwnRecordsAndFallsBackToStartAtForUnknownSort() {
    when(availabilityStore.searchRequests(any(), eq(10), eq(0))).thenReturn(List.of());
    when(availabilityStore.countRequests(any())).thenReturn(0L);

    final PageResponse<CareRequestResponse> page =
        service.searchRequests(SEEKER, null, null, false, "popularity", 1, 10);

    final ArgumentCaptor<AvailabilitySearch> search =
        ArgumentCaptor.forClass(AvailabilitySearch.class);
    verify(availabilityStore).countRequests(search.capture());
    assertThat(search.getValue().excludeUserId()).isNull();
    assertThat(search.getValue().sortField()).isEqualTo(SortField.START_AT);
    assertThat(search.getValue().descending()).isFalse();
    assertThat(page.items()).isEmpty();
    assertThat(page.hasMore()).isFalse();
  }

  @Test
  void searchRejectsOversizedPagesAndMissingUser() {
    assertThatThrownBy(() -> service.searchOffers(OWNER, null, null, false, null, 1, 101))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> service.searchRequests(" ", null, null, true, null, 1, 10))
        .isInstanceOf(ValidationException.class);
    verifyNoInteractions(availabilityStore);
  }

  private static OfferUpsertRequest offerRequest(
      UUID offerId, String dogId, Instant start, Instant end, double latitude) {
    return new OfferUpsertRequest(offerId, dogId, start, end, latitude, LONGITUDE);
  }
}
