package com.chatlive.realtime.chat.api;

import com.chatlive.realtime.chat.repo.ChatMessageRepository;

import java.time.Instant;

public record MessageItem(
        String id,
        String roomId,
        String senderId,
        String content,
        String clientId,
        Instant createdAt,
        Instant readAt
) {
    public static MessageItem from(ChatMessageRepository.MessageRow row) {
        return new MessageItem(row.id(), row.roomId(), row.senderId(), row.content(), row.clientMsgId(), row.createdAt(), row.readAt());
    }
}
