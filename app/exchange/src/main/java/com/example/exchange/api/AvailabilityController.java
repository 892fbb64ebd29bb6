/*
 * どこで: Exchange API
 * 何を: オファー/リクエストの登録・更新、自分の一覧、検索、取り下げのエンドポイント
 * なぜ: 飼い主と預け先探しの利用者が空き状況を公開し探すための入口
 */
package com.example.exchange.api;

import com.example.exchange.api.request.CareRequestUpsertRequest;
import com.example.exchange.api.request.OfferUpsertRequest;
import com.example.exchange.api.response.AvailabilityUpsertResponse;
import com.example.exchange.api.response.CareRequestResponse;
import com.example.exchange.api.response.OfferResponse;
import com.example.exchange.api.response.PageResponse;
import com.example.exchange.model.AvailabilitySearch;
import com.example.exchange.service.AvailabilityService;
import jakarta.validation.Valid;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class AvailabilityController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private final AvailabilityService availabilityService;

  @PostMapping("/offers")
  public ResponseEntity<AvailabilityUpsertResponse> upsertOffer(
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody OfferUpsertRequest request) {
    return ResponseEntity.ok(availabilityService.upsertOffer(userId, request));
  }

  @GetMapping("/offers/mine")
  public ResponseEntity<PageResponse<OfferResponse>> myOffers(
      @RequestHeader(HEADER_USER_ID) String userId,
      @RequestParam(name = "page", defaultValue = "1") int page,
      @RequestParam(name = "page_size", defaultValue = "20") int pageSize) {
    return ResponseEntity.ok(availabilityService.listOffersByOwner(userId, page, pageSize));
  }

  @GetMapping("/offers/search")
  public ResponseEntity<PageResponse<OfferResponse>> searchOffers(
      @RequestHeader(HEADER_USER_ID) String userId,
      @RequestParam(name = "start_date", required = false) Instant startDate,
      @RequestParam(name = "end_date", required = false) Instant endDate,
      @RequestParam(name = "exclude_mine", defaultValue = "false") boolean excludeMine,
      @RequestParam(name = "sort", defaultValue = AvailabilitySearch.DEFAULT_SORT) String sort,
      @RequestParam(name = "page", defaultValue = "1") int page,
      @RequestParam(name = "page_size", defaultValue = "20") int pageSize) {
    return ResponseEntity.ok(
        availabilityService.searchOffers(
            userId, startDate, endDate, excludeMine, sort, page, pageSize));
  }

  @DeleteMapping("/offers/{offerId}")
  public ResponseEntity<Void> withdrawOffer(
      @PathVariable("offerId") UUID offerId, @RequestHeader(HEADER_USER_ID) String userId) {
    availabilityService.withdrawOffer(offerId, userId);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/requests")
  public ResponseEntity<AvailabilityUpsertResponse> upsertRequest(
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody CareRequestUpsertRequest request) {
    return ResponseEntity.ok(availabilityService.upsertRequest(userId, request));
  }

  @GetMapping("/requests/mine")
  public ResponseEntity<PageResponse<CareRequestResponse>> myRequests(
      @RequestHeader(HEADER_USER_ID) String userId,
      @RequestParam(name = "page", defaultValue = "1") int page,
      @RequestParam(name = "page_size", defaultValue = "20") int pageSize) {
    return ResponseEntity.ok(availabilityService.listRequestsBySeeker(userId, page, pageSize));
  }

  @GetMapping("/requests/search")
  public ResponseEntity<PageResponse<CareRequestResponse>> searchRequests(
      @RequestHeader(HEADER_USER_ID) String userId,
      @RequestParam(name = "start_date", required = false) Instant startDate,
      @RequestParam(name = "end_date", required = false) Instant endDate,
      @RequestParam(name = "exclude_mine", defaultValue = "false") boolean excludeMine,
      @RequestParam(name = "sort", defaultValue = AvailabilitySearch.DEFAULT_SORT) String sort,
      @RequestParam(name = "page", defaultValue = "1") int page,
      @RequestParam(name = "page_size", defaultValue = "20") int pageSize) {
    return ResponseEntity.ok(
        availabilityService.searchRequests(
            userId, startDate, endDate, excludeMine, sort, page, pageSize));
  }

  @DeleteMapping("/requests/{requestId}")
  public ResponseEntity<Void> withdrawRequest(
      @PathVariable("requestId") UUID requestId, @RequestHeader(HEADER_USER_ID) String userId) {
    availabilityService.withdrawRequest(requestId, userId);
    return ResponseEntity.noContent().build();
  }
}
