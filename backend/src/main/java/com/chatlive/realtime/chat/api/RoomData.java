package com.chatlive.realtime.chat.api;

import java.util.List;

/**
 * Payload of {@code roomData}: the room and its most recent messages, oldest first.
 */
public record RoomData(RoomItem room, List<MessageItem> messages, boolean created) {
}
