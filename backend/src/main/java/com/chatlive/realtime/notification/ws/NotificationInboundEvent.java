package com.chatlive.realtime.notification.ws;

import com.chatlive.realtime.common.error.RealtimeException;
import com.chatlive.realtime.ws.InboundFrame;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Client-to-server events of the notifications namespace.
 */
public sealed interface NotificationInboundEvent {

    record MarkAsRead(String notificationId, String userId) implements NotificationInboundEvent {
    }

    record MarkAllAsRead(String userId) implements NotificationInboundEvent {
    }

    record DeleteNotification(String notificationId, String userId) implements NotificationInboundEvent {
    }

    static NotificationInboundEvent parse(InboundFrame frame, ObjectMapper objectMapper) {
        Class<? extends NotificationInboundEvent> type = switch (frame.event()) {
            case "markAsRead" -> MarkAsRead.class;
            case "markAllAsRead" -> MarkAllAsRead.class;
            case "deleteNotification" -> DeleteNotification.class;
            default -> throw RealtimeException.validation("unsupported_event");
        };
        var data = frame.data();
        // markAllAsRead may carry the bare user id, or nothing at all
        if (type == MarkAllAsRead.class && (data == null || data.isNull() || data.isTextual())) {
            return new MarkAllAsRead(data == null || data.isNull() ? null : data.asText());
        }
        if (data == null || !data.isObject()) {
            throw RealtimeException.validation("invalid_payload");
        }
        try {
            return objectMapper.treeToValue(data, type);
        } catch (JsonProcessingException ex) {
            throw RealtimeException.validation("invalid_payload");
        }
    }
}
