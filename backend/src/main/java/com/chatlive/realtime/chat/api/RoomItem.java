package com.chatlive.realtime.chat.api;

import com.chatlive.realtime.chat.repo.ChatRoomRepository;

import java.time.Instant;

public record RoomItem(String id, String user1Id, String user2Id, Instant createdAt, Instant updatedAt) {

    public static RoomItem from(ChatRoomRepository.RoomRow row) {
        return new RoomItem(row.id(), row.user1Id(), row.user2Id(), row.createdAt(), row.updatedAt());
    }
}
