package com.example.exchange.api;

import com.example.exchange.api.request.SendMessageRequest;
import com.example.exchange.api.response.ConversationResponse;
import com.example.exchange.api.response.MessageResponse;
import com.example.exchange.service.MessageService;
import jakarta.validation.Valid;
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
@RequestMapping("/v1/messages")
@RequiredArgsConstructor
public class MessageController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private final MessageService messageService;

  @PostMapping
  public ResponseEntity<MessageResponse> send(
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody SendMessageRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED).body(messageService.send(userId, request));
  }

  @GetMapping("/conversations/{otherUserId}")
  public ResponseEntity<ConversationResponse> conversation(
      @PathVariable("otherUserId") String otherUserId,
      @RequestHeader(HEADER_USER_ID) String userId,
      @RequestParam(name = "limit", required = false) Integer limit) {
    return ResponseEntity.ok(messageService.conversation(userId, otherUserId, limit));
  }
}
