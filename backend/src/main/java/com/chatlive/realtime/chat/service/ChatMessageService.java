package com.chatlive.realtime.chat.service;

import com.chatlive.realtime.auth.service.Identity;
import com.chatlive.realtime.chat.api.MessageItem;
import com.chatlive.realtime.chat.api.ReadReceipt;
import com.chatlive.realtime.chat.repo.ChatMessageRepository;
import com.chatlive.realtime.chat.repo.ChatRoomRepository;
import com.chatlive.realtime.common.error.RealtimeException;
import com.chatlive.realtime.common.tx.TransactionHooks;
import com.chatlive.realtime.ratelimit.RateLimitContext;
import com.chatlive.realtime.ratelimit.RateLimitModules;
import com.chatlive.realtime.ratelimit.RateLimiter;
import com.chatlive.realtime.ws.Channel;
import com.chatlive.realtime.ws.Namespace;
import com.chatlive.realtime.ws.WsBroadcaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

@Service
public class ChatMessageService {

    private static final Logger log = LoggerFactory.getLogger(ChatMessageService.class);

    private final RoomService roomService;
    private final ChatRoomRepository roomRepository;
    private final ChatMessageRepository messageRepository;
    private final RateLimiter rateLimiter;
    private final WsBroadcaster broadcaster;
    private final Clock clock;
    private final int maxContentLength;

    public ChatMessageService(
            RoomService roomService,
            ChatRoomRepository roomRepository,
            ChatMessageRepository messageRepository,
            RateLimiter rateLimiter,
            WsBroadcaster broadcaster,
            Clock clock,
            @Value("${app.chat.max-content-length:1000}") int maxContentLength
    ) {
        this.roomService = roomService;
        this.roomRepository = roomRepository;
        this.messageRepository = messageRepository;
        this.rateLimiter = rateLimiter;
        this.broadcaster = broadcaster;
        this.clock = clock;
        this.maxContentLength = maxContentLength;
    }

    /**
     * Persists the message and broadcasts {@code receiveMessage} to the room once the transaction
     * has committed. A rate-limit denial throws before anything is written.
     */
    @Transactional
    public SendResult sendMessage(Identity sender, String roomId, String content, String clientMsgId) {
        var text = content == null ? "" : content.trim();
        if (text.isEmpty()) {
            throw RealtimeException.validation("message_empty");
        }
        if (text.length() > maxContentLength) {
            throw RealtimeException.validation("message_too_long");
        }
        roomService.requireParticipant(sender.id(), roomId);

        if (clientMsgId != null && !clientMsgId.isBlank()) {
            var existing = messageRepository.findByClientMsgId(sender.id(), clientMsgId).orElse(null);
            if (existing != null) {
                return new SendResult(MessageItem.from(existing), false, null);
            }
        }

        var limit = rateLimiter.enforce(sender.id(), RateLimitModules.CHAT, RateLimitContext.forUser(sender.id(), "send_message"));

        var now = clock.instant();
        var res = messageRepository.insert(roomId, sender.id(), clientMsgId, text, now);
        var item = MessageItem.from(res.row());
        if (!res.inserted()) {
            return new SendResult(item, false, null);
        }
        roomRepository.touch(roomId, now);

        TransactionHooks.afterCommit(() -> broadcaster.broadcast(Namespace.CHAT, Channel.room(roomId), "receiveMessage", item));
        log.debug("message_sent messageId={} roomId={} senderId={} remaining={}", item.id(), roomId, sender.id(), limit.remaining());
        return new SendResult(item, true, limit.warning());
    }

    /**
     * Marks everything the reader has not yet read in the room and tells the other participant,
     * even when nothing changed.
     */
    @Transactional
    public int markRead(Identity reader, String roomId) {
        roomService.requireParticipant(reader.id(), roomId);
        var count = messageRepository.markRead(roomId, reader.id(), clock.instant());
        var receipt = new ReadReceipt(roomId, reader.id(), count);
        TransactionHooks.afterCommit(() ->
                broadcaster.broadcastExceptIdentity(Namespace.CHAT, Channel.room(roomId), "messagesRead", receipt, reader.id()));
        return count;
    }
}
