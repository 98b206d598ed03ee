package com.chatlive.realtime.auth.service;

import java.util.Optional;

public enum Permission {
    SEND_MESSAGE("send_message"),
    RECEIVE_NOTIFICATIONS("receive_notifications"),
    SEND_NOTIFICATION("send_notification"),
    MODERATE_CHAT("moderate_chat"),
    VIEW_ADMIN_PANEL("view_admin_panel");

    private final String wire;

    Permission(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    public static Optional<Permission> fromWire(String raw) {
        if (raw == null) return Optional.empty();
        var t = raw.trim();
        for (var p : values()) {
            if (p.wire.equalsIgnoreCase(t)) return Optional.of(p);
        }
        return Optional.empty();
    }
}
