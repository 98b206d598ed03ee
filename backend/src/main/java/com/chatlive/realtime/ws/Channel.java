package com.chatlive.realtime.ws;

/**
 * Broadcast target inside a namespace: a user's personal channel or a room.
 */
public record Channel(String kind, String id) {

    public static final String USER = "user";
    public static final String ROOM = "room";

    public static Channel user(String userId) {
        return new Channel(USER, userId);
    }

    public static Channel room(String roomId) {
        return new Channel(ROOM, roomId);
    }

    public String key() {
        return kind + ":" + id;
    }

    public static Channel parse(String key) {
        if (key == null) throw new IllegalArgumentException("bad_channel");
        var idx = key.indexOf(':');
        if (idx <= 0 || idx == key.length() - 1) throw new IllegalArgumentException("bad_channel");
        return new Channel(key.substring(0, idx), key.substring(idx + 1));
    }

    @Override
    public String toString() {
        return key();
    }
}
