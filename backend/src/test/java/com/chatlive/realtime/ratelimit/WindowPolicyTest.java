package com.chatlive.realtime.ratelimit;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class WindowPolicyTest {

    private static final Instant T0 = Instant.parse("2026-01-01T10:00:00Z");

    private final ModuleConfig chat = new ModuleConfig("chat", 3, Duration.ofHours(1), Duration.ofMinutes(30), 1, Enforcement.HARD, true);

    @Test
    void first_request_opens_window() {
        var d = WindowPolicy.apply(null, chat, T0);

        assertThat(d.result().allowed()).isTrue();
        assertThat(d.result().remaining()).isEqualTo(2);
        assertThat(d.result().resetTime()).isEqualTo(T0.plus(Duration.ofHours(1)));
        assertThat(d.next().count()).isEqualTo(1);
    }

    @Test
    void warning_appears_at_threshold_only() {
        var first = WindowPolicy.apply(null, chat, T0);
        var second = WindowPolicy.apply(first.next(), chat, T0.plusSeconds(1));

        assertThat(first.result().warning()).isNull();
        assertThat(second.result().remaining()).isEqualTo(1);
        assertThat(second.result().warning()).isNotNull();
        assertThat(second.result().warning().remaining()).isEqualTo(1);
    }

    @Test
    void hard_module_blocks_and_keeps_blocked_until_on_retry() {
        RateLimitState s = null;
        for (int i = 0; i < 3; i++) {
            s = WindowPolicy.apply(s, chat, T0).next();
        }
        var denied = WindowPolicy.apply(s, chat, T0.plusSeconds(5));
        var retry = WindowPolicy.apply(denied.next(), chat, T0.plusSeconds(60));

        assertThat(denied.result().allowed()).isFalse();
        assertThat(denied.result().blockedUntil()).isEqualTo(T0.plusSeconds(5).plus(Duration.ofMinutes(30)));
        assertThat(retry.result().allowed()).isFalse();
        assertThat(retry.result().blockedUntil()).isEqualTo(denied.result().blockedUntil());
        assertThat(retry.next().count()).isEqualTo(denied.next().count());
    }

    @Test
    void expired_block_starts_a_fresh_window() {
        var blocked = new RateLimitState(T0, T0.plus(Duration.ofHours(1)), 4, T0.plus(Duration.ofMinutes(30)));
        var after = T0.plus(Duration.ofMinutes(31));

        var d = WindowPolicy.apply(blocked, chat, after);

        assertThat(d.result().allowed()).isTrue();
        assertThat(d.next().count()).isEqualTo(1);
        assertThat(d.next().windowStart()).isEqualTo(after);
        assertThat(d.next().blockedUntil()).isNull();
    }

    @Test
    void soft_module_flags_but_allows() {
        var soft = new ModuleConfig("notifications", 1, Duration.ofHours(1), null, 0, Enforcement.SOFT, true);
        var first = WindowPolicy.apply(null, soft, T0);
        var over = WindowPolicy.apply(first.next(), soft, T0.plusSeconds(1));

        assertThat(over.result().allowed()).isTrue();
        assertThat(over.result().exceeded()).isTrue();
        assertThat(over.result().blockedUntil()).isNull();
        assertThat(over.next().count()).isEqualTo(2);
    }

    @Test
    void window_end_resets_count() {
        var s = new RateLimitState(T0, T0.plus(Duration.ofHours(1)), 3, null);

        var d = WindowPolicy.apply(s, chat, T0.plus(Duration.ofHours(1)));

        assertThat(d.result().allowed()).isTrue();
        assertThat(d.next().count()).isEqualTo(1);
    }
}
