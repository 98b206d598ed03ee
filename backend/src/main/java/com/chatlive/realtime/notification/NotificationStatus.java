package com.chatlive.realtime.notification;

import java.util.Locale;

/**
 * unread -> read -> archived. Deletion removes the row.
 */
public enum NotificationStatus {
    UNREAD,
    READ,
    ARCHIVED,
    DELETED;

    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static NotificationStatus fromWire(String raw) {
        return NotificationStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }

    public boolean terminal() {
        return this == ARCHIVED || this == DELETED;
    }
}
