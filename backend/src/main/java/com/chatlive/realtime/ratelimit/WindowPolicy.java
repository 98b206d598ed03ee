package com.chatlive.realtime.ratelimit;

import java.time.Instant;

/**
 * Fixed-window counting with an optional block, shared by every store so that the in-memory
 * and database-backed limiters decide identically.
 */
public final class WindowPolicy {

    public record Decision(RateLimitState next, RateLimitResult result) {
    }

    private WindowPolicy() {
    }

    public static Decision apply(RateLimitState current, ModuleConfig cfg, Instant now) {
        // Still blocked: deny without touching the counter.
        if (current != null && current.blockedUntil() != null && current.blockedUntil().isAfter(now)) {
            var denied = new RateLimitResult(cfg.module(), false, 0, current.windowEnd(), null, current.blockedUntil(), true);
            return new Decision(current, denied);
        }

        var state = current;
        var blockExpired = state != null && state.blockedUntil() != null;
        if (state == null || blockExpired || !state.windowEnd().isAfter(now)) {
            state = new RateLimitState(now, now.plus(cfg.window()), 0, null);
        }

        var count = state.count() + 1;
        if (count > cfg.maxRequests()) {
            if (cfg.enforcement() == Enforcement.SOFT) {
                var next = new RateLimitState(state.windowStart(), state.windowEnd(), count, null);
                var flagged = new RateLimitResult(cfg.module(), true, 0, state.windowEnd(), null, null, true);
                return new Decision(next, flagged);
            }
            var blockedUntil = now.plus(cfg.block());
            var next = new RateLimitState(state.windowStart(), state.windowEnd(), count, blockedUntil);
            var denied = new RateLimitResult(cfg.module(), false, 0, state.windowEnd(), null, blockedUntil, true);
            return new Decision(next, denied);
        }

        var remaining = cfg.maxRequests() - count;
        var next = new RateLimitState(state.windowStart(), state.windowEnd(), count, null);
        RateLimitWarning warning = null;
        if (cfg.warnThreshold() > 0 && remaining <= cfg.warnThreshold()) {
            warning = RateLimitWarning.of(cfg, remaining, state.windowEnd());
        }
        return new Decision(next, new RateLimitResult(cfg.module(), true, remaining, state.windowEnd(), warning, null, false));
    }
}
