package com.chatlive.realtime.auth.service;

import java.util.Locale;
import java.util.Optional;

/**
 * Ordered from least to most privileged.
 */
public enum Role {
    GUEST,
    USER,
    MODERATOR,
    ADMIN;

    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean atLeast(Role other) {
        return other == null || ordinal() >= other.ordinal();
    }

    public static Optional<Role> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        try {
            return Optional.of(Role.valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
