package com.chatlive.realtime.chat.ws;

import com.chatlive.realtime.chat.service.ChatMessageService;
import com.chatlive.realtime.chat.service.RoomService;
import com.chatlive.realtime.common.error.RealtimeException;
import com.chatlive.realtime.ws.Channel;
import com.chatlive.realtime.ws.ConnectionInfo;
import com.chatlive.realtime.ws.ConnectionRegistry;
import com.chatlive.realtime.ws.InboundFrame;
import com.chatlive.realtime.ws.Namespace;
import com.chatlive.realtime.ws.NamespaceDispatcher;
import com.chatlive.realtime.ws.WsBroadcaster;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

@Component
public class ChatEventDispatcher implements NamespaceDispatcher {

    private final ObjectMapper objectMapper;
    private final RoomService roomService;
    private final ChatMessageService messageService;
    private final ConnectionRegistry registry;
    private final WsBroadcaster broadcaster;

    public ChatEventDispatcher(
            ObjectMapper objectMapper,
            RoomService roomService,
            ChatMessageService messageService,
            ConnectionRegistry registry,
            WsBroadcaster broadcaster
    ) {
        this.objectMapper = objectMapper;
        this.roomService = roomService;
        this.messageService = messageService;
        this.registry = registry;
        this.broadcaster = broadcaster;
    }

    @Override
    public Namespace namespace() {
        return Namespace.CHAT;
    }

    @Override
    public void onConnected(ConnectionInfo connection) {
        for (var roomId : roomService.listRoomIds(connection.identityId())) {
            registry.join(Channel.room(roomId), connection.connectionId());
        }
    }

    @Override
    public void dispatch(ConnectionInfo connection, InboundFrame frame) {
        var event = ChatInboundEvent.parse(frame, objectMapper);
        var identity = connection.identity();

        if (event instanceof ChatInboundEvent.SendMessage m) {
            requireSelf(identity.id(), m.senderId());
            var result = messageService.sendMessage(identity, m.roomId(), m.message(), m.clientId());
            if (result.warning() != null) {
                broadcaster.sendTo(connection, "rateLimitWarning", result.warning());
            }
        } else if (event instanceof ChatInboundEvent.GetOrCreateRoom r) {
            var data = roomService.getOrCreateRoom(identity, r.user1Id(), r.user2Id());
            broadcaster.sendTo(connection, "roomData", data, frame.ackId());
        } else if (event instanceof ChatInboundEvent.MarkMessagesRead r) {
            requireSelf(identity.id(), r.userId());
            messageService.markRead(identity, r.roomId());
        }
    }

    /**
     * Ids in payloads are optional, but when present they must name the caller.
     */
    private static void requireSelf(String identityId, String claimed) {
        if (claimed != null && !claimed.isBlank() && !claimed.equals(identityId)) {
            throw RealtimeException.accessDenied("identity_mismatch");
        }
    }
}
