/*
 * どこで: Exchange サービス層
 * 何を: ユーザー間のダイレクトメッセージを保存し、受信者に通知する
 * なぜ: メッセージ行と new_message 通知を一緒にコミットするため
 */
package com.example.exchange.service;

import com.example.exchange.api.ValidationException;
import com.example.exchange.api.request.SendMessageRequest;
import com.example.exchange.api.response.ConversationResponse;
import com.example.exchange.api.response.MessageResponse;
import com.example.exchange.config.ExchangeFeedProperties;
import com.example.exchange.model.MessageRecord;
import com.example.exchange.model.NewMessageEvent;
import com.example.exchange.repository.MessageRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class MessageService {

  private static final Logger logger = LoggerFactory.getLogger(MessageService.class);

  static final int MAX_CONTENT_LENGTH = 4000;

  private final MessageRepository messageRepository;
  private final NotificationDispatcher dispatcher;
  private final ExchangeFeedProperties feedProperties;
  private final Clock clock;

  @Transactional
  public MessageResponse send(String senderId, SendMessageRequest request) {
    requireUser(senderId);
    if (request == null || request.recipientId() == null || request.recipientId().isBlank()) {
      throw new ValidationException("recipient_id is required");
    }
    final String recipientId = request.recipientId().trim();
    if (recipientId.equals(senderId)) {
      throw new ValidationException("cannot send a message to yourself");
    }
    final String content = request.content() == null ? "" : request.content().strip();
    if (content.isEmpty() || content.length() > MAX_CONTENT_LENGTH) {
      throw new ValidationException(
          "content must be between 1 and " + MAX_CONTENT_LENGTH + " characters");
    }
    final MessageRecord message =
        new MessageRecord(
            UUID.randomUUID(),
            MessageRecord.conversationIdOf(senderId, recipientId),
            senderId,
            recipientId,
            content,
            Instant.now(clock));
    messageRepository.insert(message);
    dispatcher.notifyUser(recipientId, new NewMessageEvent(message));
    logger.info(
        "message sent message_id={} conversation_id={}",
        message.messageId(),
        message.conversationId());
    return MessageResponse.from(message);
  }

  /** 2 人の間の最新メッセージ。古い順。 */
  public ConversationResponse conversation(String userId, String otherUserId, Integer limit) {
    requireUser(userId);
    if (otherUserId == null || otherUserId.isBlank()) {
      throw new ValidationException("other user id is required");
    }
    final int effectiveLimit = limit == null ? feedProperties.conversationLimit() : limit;
    if (effectiveLimit < 1 || effectiveLimit > feedProperties.maxLimit()) {
      throw new ValidationException("limit must be between 1 and " + feedProperties.maxLimit());
    }
    final String conversationId = MessageRecord.conversationIdOf(userId, otherUserId.trim());
    return new ConversationResponse(
        conversationId,
        messageRepository.findLatest(conversationId, effectiveLimit).stream()
            .map(MessageResponse::from)
            .toList());
  }

  private void requireUser(String userId) {
    if (userId == null || userId.isBlank()) {
      throw new ValidationException("X-User-Id is required");
    }
  }
}
