package com.chatlive.realtime.ws;

import com.chatlive.realtime.auth.service.Permission;

import java.util.Locale;
import java.util.Optional;

public enum Namespace {
    CHAT("/ws/chat", Permission.SEND_MESSAGE),
    NOTIFICATIONS("/ws/notifications", Permission.RECEIVE_NOTIFICATIONS);

    private final String path;
    private final Permission requiredPermission;

    Namespace(String path, Permission requiredPermission) {
        this.path = path;
        this.requiredPermission = requiredPermission;
    }

    public String path() {
        return path;
    }

    /**
     * Checked once when a connection is established.
     */
    public Permission requiredPermission() {
        return requiredPermission;
    }

    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Namespace> fromWire(String raw) {
        if (raw == null) return Optional.empty();
        for (var ns : values()) {
            if (ns.wire().equalsIgnoreCase(raw.trim())) return Optional.of(ns);
        }
        return Optional.empty();
    }
}
