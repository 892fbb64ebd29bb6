package com.example.exchange.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationRecord(
    UUID notificationId,
    String userId,
    long seq,
    EventType type,
    String payloadJson,
    String text,
    Instant createdAt,
    boolean read) {}
