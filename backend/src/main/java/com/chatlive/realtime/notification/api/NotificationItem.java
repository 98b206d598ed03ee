package com.chatlive.realtime.notification.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record NotificationItem(
        String id,
        String userId,
        String title,
        String message,
        String type,
        String status,
        JsonNode metadata,
        Instant createdAt,
        Instant updatedAt,
        Instant readAt
) {
}
