package com.chatlive.realtime.auth.service;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Either an explicit set of capabilities or the "all" sentinel. {@code receive_notifications}
 * is always part of an explicit set.
 */
public final class PermissionSet {

    public static final PermissionSet ALL = new PermissionSet(EnumSet.allOf(Permission.class), true);

    private final Set<Permission> granted;
    private final boolean all;

    private PermissionSet(Set<Permission> granted, boolean all) {
        this.granted = Collections.unmodifiableSet(granted);
        this.all = all;
    }

    public static PermissionSet of(Collection<Permission> permissions) {
        var set = EnumSet.noneOf(Permission.class);
        if (permissions != null) set.addAll(permissions);
        set.add(Permission.RECEIVE_NOTIFICATIONS);
        return new PermissionSet(set, false);
    }

    public static PermissionSet forRole(Role role) {
        if (role == null) return of(List.of());
        return switch (role) {
            case ADMIN -> of(List.of(Permission.SEND_MESSAGE, Permission.RECEIVE_NOTIFICATIONS, Permission.SEND_NOTIFICATION,
                    Permission.MODERATE_CHAT, Permission.VIEW_ADMIN_PANEL));
            case MODERATOR -> of(List.of(Permission.SEND_MESSAGE, Permission.RECEIVE_NOTIFICATIONS, Permission.SEND_NOTIFICATION,
                    Permission.MODERATE_CHAT));
            case USER -> of(List.of(Permission.SEND_MESSAGE, Permission.RECEIVE_NOTIFICATIONS, Permission.SEND_NOTIFICATION));
            case GUEST -> of(List.of(Permission.RECEIVE_NOTIFICATIONS, Permission.SEND_NOTIFICATION));
        };
    }

    /**
     * Parses a stored or claimed list. {@code null} or blank falls back to the role defaults;
     * {@code *} or {@code all} yields {@link #ALL}; unknown names are dropped.
     */
    public static PermissionSet parse(Collection<String> raw, Role role) {
        if (raw == null || raw.isEmpty()) return forRole(role);
        if (raw.stream().anyMatch(PermissionSet::isAllSentinel)) return ALL;
        var set = EnumSet.noneOf(Permission.class);
        for (var r : raw) {
            Permission.fromWire(r).ifPresent(set::add);
        }
        return of(set);
    }

    public static PermissionSet parseCsv(String csv, Role role) {
        if (csv == null || csv.isBlank()) return forRole(role);
        return parse(List.of(csv.split(",")), role);
    }

    private static boolean isAllSentinel(String s) {
        if (s == null) return false;
        var t = s.trim();
        return "*".equals(t) || "all".equalsIgnoreCase(t);
    }

    public boolean has(Permission p) {
        return all || granted.contains(p);
    }

    public boolean isAll() {
        return all;
    }

    public Set<Permission> granted() {
        return granted;
    }

    public List<String> wire() {
        if (all) return List.of("all");
        return granted.stream().map(Permission::wire).collect(Collectors.toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PermissionSet other)) return false;
        return all == other.all && granted.equals(other.granted);
    }

    @Override
    public int hashCode() {
        return granted.hashCode() * 31 + (all ? 1 : 0);
    }

    @Override
    public String toString() {
        return all ? "PermissionSet[all]" : "PermissionSet" + wire();
    }
}
