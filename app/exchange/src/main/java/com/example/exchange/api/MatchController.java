/*
 * どこで: Exchange API
 * 何を: マッチの作成、状態遷移、一覧のエンドポイント
 * なぜ: ユーザーはここから承諾・確定・拒否・取消を行うため
 */
package com.example.exchange.api;

import com.example.exchange.api.request.CreateMatchRequest;
import com.example.exchange.api.request.MatchTransitionRequest;
import com.example.exchange.api.response.CreateMatchResponse;
import com.example.exchange.api.response.MatchResponse;
import com.example.exchange.api.response.PageResponse;
import com.example.exchange.service.MatchLifecycleService;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/matches")
@RequiredArgsConstructor
public class MatchController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private final MatchLifecycleService lifecycleService;

  /**
   * 役割:
   * - オファーとリクエストの組から PENDING のマッチを作る。
   *
   * 期待動作:
   * - 新規作成なら 201、同じ組の進行中マッチが既にあれば 200 でその ID を返す。
   */
  @PostMapping
  public ResponseEntity<CreateMatchResponse> createMatch(
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody CreateMatchRequest request) {
    final MatchLifecycleService.PendingMatch pending =
        lifecycleService.createPendingMatch(request.offerId(), request.requestId(), userId);
    return ResponseEntity.status(pending.created() ? HttpStatus.CREATED : HttpStatus.OK)
        .body(new CreateMatchResponse(pending.matchId()));
  }

  /**
   * 役割:
   * - accept/confirm/reject/cancel を受け付けてマッチを次の状態へ進める。
   *
   * 期待動作:
   * - 当事者でなければ 403、現在の状態から許されない操作や競合負けは 409 とする。
   */
  @PostMapping("/{matchId}/transitions")
  public ResponseEntity<MatchResponse> transition(
      @PathVariable("matchId") UUID matchId,
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody MatchTransitionRequest request) {
    return ResponseEntity.ok(lifecycleService.transition(matchId, request.action(), userId));
  }

  @GetMapping("/pending")
  public ResponseEntity<PageResponse<MatchResponse>> pending(
      @RequestHeader(HEADER_USER_ID) String userId,
      @RequestParam(name = "page", defaultValue = "1") int page,
      @RequestParam(name = "page_size", defaultValue = "20") int pageSize) {
    return ResponseEntity.ok(lifecycleService.pendingFor(userId, page, pageSize));
  }

  @GetMapping("/mine")
  public ResponseEntity<PageResponse<MatchResponse>> mine(
      @RequestHeader(HEADER_USER_ID) String userId,
      @RequestParam(name = "state", required = false) String state,
      @RequestParam(name = "page", defaultValue = "1") int page,
      @RequestParam(name = "page_size", defaultValue = "20") int pageSize) {
    return ResponseEntity.ok(lifecycleService.matchesFor(userId, state, page, pageSize));
  }

  @GetMapping("/{matchId}")
  public ResponseEntity<MatchResponse> get(
      @PathVariable("matchId") UUID matchId, @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(lifecycleService.find(matchId, userId));
  }
}
