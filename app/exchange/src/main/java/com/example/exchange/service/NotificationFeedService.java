/*
 * どこで: Exchange サービス層
 * 何を: ユーザーごとの通知ログへの追記と読み取り
 * なぜ: 受信箱とライブのバックフィルが共に読む永続記録がこのログであるため
 */
package com.example.exchange.service;

import com.example.exchange.api.NotificationNotFoundException;
import com.example.exchange.api.ValidationException;
import com.example.exchange.api.response.NotificationFeedResponse;
import com.example.exchange.api.response.NotificationInboxResponse;
import com.example.exchange.api.response.NotificationResponse;
import com.example.exchange.config.ExchangeFeedProperties;
import com.example.exchange.model.ExchangeEvent;
import com.example.exchange.model.NotificationRecord;
import com.example.exchange.repository.NotificationRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class NotificationFeedService {

    private final NotificationRepository notificationRepository;
    private final ExchangeFeedProperties properties;
    private final ExchangeMetrics metrics;
    private final Clock clock;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "ObjectMapper is a shared Spring-managed component")
    private final ObjectMapper objectMapper;

    public NotificationFeedService(
            NotificationRepository notificationRepository,
            ExchangeFeedProperties properties,
            ExchangeMetrics metrics,
            Clock clock,
            ObjectMapper objectMapper) {
        this.notificationRepository = notificationRepository;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
        this.objectMapper = objectMapper;
    }

    /**
     * 役割: {@code event} を {@code userId} のログへ、そのユーザーの次の seq で追記する。
     * 前提: 呼び出し側のトランザクションに参加し、seq 行はその終了までロックされたままになる。
     */
    @Transactional
    public NotificationRecord append(String userId, ExchangeEvent event) {
        long seq = notificationRepository.nextSequence(userId);
        NotificationRecord record = new NotificationRecord(
                UUID.randomUUID(),
                userId,
                seq,
                event.type(),
                serialize(event),
                event.text(),
                Instant.now(clock),
                false);
        notificationRepository.insert(record);
        metrics.recordNotificationAppended(event.type().value());
        return record;
    }

    /** ライブのバックフィル用。引数は検証しない。 */
    public List<NotificationRecord> readAfter(String userId, long sinceSeq, int limit) {
        return notificationRepository.findSince(userId, sinceSeq, limit);
    }

    public List<NotificationRecord> listSince(String userId, long sinceSeq, int limit) {
        requireUser(userId);
        if (sinceSeq < 0) {
            throw new ValidationException("since_seq must be >= 0");
        }
        if (limit < 1 || limit > properties.maxLimit()) {
            throw new ValidationException("limit must be between 1 and " + properties.maxLimit());
        }
        return notificationRepository.findSince(userId, sinceSeq, limit);
    }

    public NotificationFeedResponse feed(String userId, long sinceSeq, Integer limit) {
        int effectiveLimit = limit == null ? properties.defaultLimit() : limit;
        List<NotificationRecord> records = listSince(userId, sinceSeq, effectiveLimit);
        long lastSeq = records.isEmpty() ? sinceSeq : records.get(records.size() - 1).seq();
        return new NotificationFeedResponse(
                userId, sinceSeq, lastSeq, records.stream().map(this::toResponse).toList());
    }

    public NotificationInboxResponse list(String userId, boolean unreadOnly, int page, int pageSize) {
        requireUser(userId);
        Paging paging = Paging.of(page, pageSize, properties.maxPageSize());
        List<NotificationResponse> items = notificationRepository
                .findPage(userId, unreadOnly, paging.pageSize(), paging.offset())
                .stream()
                .map(this::toResponse)
                .toList();
        long total = notificationRepository.count(userId, unreadOnly);
        long unread = unreadOnly ? total : notificationRepository.count(userId, true);
        return new NotificationInboxResponse(userId, items, total, unread, page, pageSize);
    }

    public void markRead(UUID notificationId, String userId) {
        requireUser(userId);
        int updated = notificationRepository.markRead(notificationId, userId);
        if (updated == 0) {
            throw new NotificationNotFoundException(notificationId);
        }
    }

    public int markAllRead(String userId) {
        requireUser(userId);
        return notificationRepository.markAllRead(userId);
    }

    public long unreadCount(String userId) {
        requireUser(userId);
        return notificationRepository.count(userId, true);
    }

    public NotificationResponse toResponse(NotificationRecord record) {
        return new NotificationResponse(
                record.notificationId(),
                record.seq(),
                record.type().value(),
                parse(record.payloadJson()),
                record.text(),
                record.read(),
                record.createdAt());
    }

    private String serialize(ExchangeEvent event) {
        try {
            return objectMapper.writeValueAsString(event.data());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("event payload serialization failed type=" + event.type(), ex);
        }
    }

    private JsonNode parse(String payloadJson) {
        try {
            return objectMapper.readTree(payloadJson);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("stored payload is not valid JSON", ex);
        }
    }

    private void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("X-User-Id is required");
        }
    }
}
