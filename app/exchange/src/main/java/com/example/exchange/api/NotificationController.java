/*
 * どこで: Exchange API
 * 何を: 通知フィード、受信箱、既読フラグのエンドポイント
 * なぜ: ライブ接続のないクライアントは最後に見た seq でフィードをポーリングするため
 */
package com.example.exchange.api;

import com.example.exchange.api.response.NotificationFeedResponse;
import com.example.exchange.api.response.NotificationInboxResponse;
import com.example.exchange.api.response.ReadAllResponse;
import com.example.exchange.service.NotificationFeedService;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/notifications")
@RequiredArgsConstructor
public class NotificationController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private final NotificationFeedService feedService;

  @GetMapping
  public ResponseEntity<NotificationFeedResponse> feed(
      @RequestHeader(HEADER_USER_ID) String userId,
      @RequestParam(name = "since_seq", defaultValue = "0") long sinceSeq,
      @RequestParam(name = "limit", required = false) Integer limit) {
    return ResponseEntity.ok(feedService.feed(userId, sinceSeq, limit));
  }

  @GetMapping("/inbox")
  public ResponseEntity<NotificationInboxResponse> inbox(
      @RequestHeader(HEADER_USER_ID) String userId,
      @RequestParam(name = "unread_only", defaultValue = "false") boolean unreadOnly,
      @RequestParam(name = "page", defaultValue = "1") int page,
      @RequestParam(name = "page_size", defaultValue = "20") int pageSize) {
    return ResponseEntity.ok(feedService.list(userId, unreadOnly, page, pageSize));
  }

  @PutMapping("/{notificationId}/read")
  public ResponseEntity<Void> markRead(
      @PathVariable("notificationId") UUID notificationId,
      @RequestHeader(HEADER_USER_ID) String userId) {
    feedService.markRead(notificationId, userId);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/read-all")
  public ResponseEntity<ReadAllResponse> markAllRead(@RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(new ReadAllResponse(feedService.markAllRead(userId)));
  }
}
