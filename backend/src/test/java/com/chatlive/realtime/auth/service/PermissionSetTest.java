package com.chatlive.realtime.auth.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PermissionSetTest {

    @Test
    void role_defaults() {
        assertThat(PermissionSet.forRole(Role.ADMIN).has(Permission.VIEW_ADMIN_PANEL)).isTrue();
        assertThat(PermissionSet.forRole(Role.MODERATOR).has(Permission.VIEW_ADMIN_PANEL)).isFalse();
        assertThat(PermissionSet.forRole(Role.MODERATOR).has(Permission.MODERATE_CHAT)).isTrue();
        assertThat(PermissionSet.forRole(Role.USER).has(Permission.SEND_MESSAGE)).isTrue();
        assertThat(PermissionSet.forRole(Role.GUEST).has(Permission.SEND_MESSAGE)).isFalse();
        assertThat(PermissionSet.forRole(Role.GUEST).has(Permission.SEND_NOTIFICATION)).isTrue();
    }

    @Test
    void receive_notifications_is_always_granted() {
        var set = PermissionSet.parse(List.of("send_message"), Role.USER);

        assertThat(set.has(Permission.RECEIVE_NOTIFICATIONS)).isTrue();
        assertThat(set.has(Permission.SEND_NOTIFICATION)).isFalse();
    }

    @Test
    void all_sentinel_grants_everything() {
        assertThat(PermissionSet.parse(List.of("*"), Role.GUEST).isAll()).isTrue();
        assertThat(PermissionSet.parseCsv("send_message, ALL", Role.GUEST).has(Permission.VIEW_ADMIN_PANEL)).isTrue();
        assertThat(PermissionSet.ALL.wire()).containsExactly("all");
    }

    @Test
    void empty_or_missing_falls_back_to_role() {
        assertThat(PermissionSet.parse(null, Role.MODERATOR)).isEqualTo(PermissionSet.forRole(Role.MODERATOR));
        assertThat(PermissionSet.parseCsv("  ", Role.USER)).isEqualTo(PermissionSet.forRole(Role.USER));
    }

    @Test
    void unknown_names_are_dropped() {
        var set = PermissionSet.parseCsv("send_message,launch_rockets", Role.GUEST);

        assertThat(set.granted()).containsExactlyInAnyOrder(Permission.SEND_MESSAGE, Permission.RECEIVE_NOTIFICATIONS);
    }

    @Test
    void role_ordering() {
        assertThat(Role.ADMIN.atLeast(Role.MODERATOR)).isTrue();
        assertThat(Role.USER.atLeast(Role.MODERATOR)).isFalse();
        assertThat(Role.parse("Moderator")).contains(Role.MODERATOR);
        assertThat(Role.parse("root")).isEmpty();
    }
}
