package com.chatlive.realtime.chat.ws;

import com.chatlive.realtime.common.error.RealtimeException;
import com.chatlive.realtime.ws.InboundFrame;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Client-to-server events of the chat namespace. {@code ping} is answered by the handler itself.
 */
public sealed interface ChatInboundEvent {

    record SendMessage(String roomId, String message, String senderId, String clientId) implements ChatInboundEvent {
    }

    record GetOrCreateRoom(String user1Id, String user2Id) implements ChatInboundEvent {
    }

    record MarkMessagesRead(String roomId, String userId) implements ChatInboundEvent {
    }

    static ChatInboundEvent parse(InboundFrame frame, ObjectMapper objectMapper) {
        Class<? extends ChatInboundEvent> type = switch (frame.event()) {
            case "sendMessage" -> SendMessage.class;
            case "getOrCreateRoom" -> GetOrCreateRoom.class;
            case "markMessagesRead" -> MarkMessagesRead.class;
            default -> throw RealtimeException.validation("unsupported_event");
        };
        if (frame.data() == null || !frame.data().isObject()) {
            throw RealtimeException.validation("invalid_payload");
        }
        try {
            return objectMapper.treeToValue(frame.data(), type);
        } catch (JsonProcessingException ex) {
            throw RealtimeException.validation("invalid_payload");
        }
    }
}
