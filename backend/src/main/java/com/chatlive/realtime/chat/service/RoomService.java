package com.chatlive.realtime.chat.service;

import com.chatlive.realtime.auth.repo.UserAccountRepository;
import com.chatlive.realtime.auth.service.Identity;
import com.chatlive.realtime.chat.api.MessageItem;
import com.chatlive.realtime.chat.api.RoomData;
import com.chatlive.realtime.chat.api.RoomItem;
import com.chatlive.realtime.chat.repo.ChatMessageRepository;
import com.chatlive.realtime.chat.repo.ChatRoomRepository;
import com.chatlive.realtime.common.error.RealtimeException;
import com.chatlive.realtime.ratelimit.RateLimitContext;
import com.chatlive.realtime.ratelimit.RateLimitModules;
import com.chatlive.realtime.ratelimit.RateLimiter;
import com.chatlive.realtime.ws.Channel;
import com.chatlive.realtime.ws.Namespace;
import com.chatlive.realtime.ws.WsBroadcaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@Service
public class RoomService {

    private static final Logger log = LoggerFactory.getLogger(RoomService.class);

    private final ChatRoomRepository roomRepository;
    private final ChatMessageRepository messageRepository;
    private final UserAccountRepository userRepository;
    private final RateLimiter rateLimiter;
    private final WsBroadcaster broadcaster;
    private final Clock clock;
    private final int historyLimit;

    public RoomService(
            ChatRoomRepository roomRepository,
            ChatMessageRepository messageRepository,
            UserAccountRepository userRepository,
            RateLimiter rateLimiter,
            WsBroadcaster broadcaster,
            Clock clock,
            @Value("${app.chat.history-limit:50}") int historyLimit
    ) {
        this.roomRepository = roomRepository;
        this.messageRepository = messageRepository;
        this.userRepository = userRepository;
        this.rateLimiter = rateLimiter;
        this.broadcaster = broadcaster;
        this.clock = clock;
        this.historyLimit = Math.max(1, Math.min(historyLimit, 500));
    }

    /**
     * Find-or-create on the canonical pair key. Runs outside a transaction so that a losing insert
     * can read the row the concurrent winner committed.
     */
    public RoomData getOrCreateRoom(Identity requester, String user1Id, String user2Id) {
        if (user1Id == null || user1Id.isBlank() || user2Id == null || user2Id.isBlank()) {
            throw RealtimeException.validation("missing_user_id");
        }
        if (!requester.id().equals(user1Id) && !requester.id().equals(user2Id)) {
            throw RealtimeException.accessDenied("not_a_participant");
        }
        if (user1Id.equals(user2Id)) {
            throw RealtimeException.validation("cannot_chat_with_self");
        }
        if (!userRepository.exists(user1Id) || !userRepository.exists(user2Id)) {
            throw RealtimeException.notFound("user_not_found");
        }

        var pairKey = ChatRoomRepository.pairKey(user1Id, user2Id);
        var room = roomRepository.findByPairKey(pairKey).orElse(null);
        var created = false;
        if (room == null) {
            rateLimiter.enforce(requester.id(), RateLimitModules.CHAT_ROOMS, RateLimitContext.forUser(requester.id(), "create_room"));
            try {
                room = roomRepository.insert("room_" + UUID.randomUUID(), user1Id, user2Id, clock.instant());
                created = true;
            } catch (DuplicateKeyException dup) {
                room = roomRepository.findByPairKey(pairKey).orElseThrow(() -> dup);
            }
        }

        var messages = messageRepository.listRecent(room.id(), historyLimit).stream().map(MessageItem::from).toList();

        var channel = Channel.room(room.id());
        broadcaster.joinEverywhere(Namespace.CHAT, room.user1Id(), channel);
        broadcaster.joinEverywhere(Namespace.CHAT, room.user2Id(), channel);

        if (created) {
            log.info("room_created roomId={} user1={} user2={}", room.id(), room.user1Id(), room.user2Id());
        }
        return new RoomData(RoomItem.from(room), messages, created);
    }

    public ChatRoomRepository.RoomRow requireParticipant(String identityId, String roomId) {
        if (roomId == null || roomId.isBlank()) {
            throw RealtimeException.validation("missing_room_id");
        }
        var room = roomRepository.findById(roomId).orElseThrow(() -> RealtimeException.notFound("room_not_found"));
        if (!room.hasParticipant(identityId)) {
            throw RealtimeException.accessDenied("not_a_participant");
        }
        return room;
    }

    public List<String> listRoomIds(String identityId) {
        return roomRepository.listRoomIdsForUser(identityId);
    }
}
