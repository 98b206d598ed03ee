package com.chatlive.realtime.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one rate-limit check. {@code exceeded} is set whenever the limit was crossed,
 * including soft modules where the request is still allowed.
 */
public record RateLimitResult(
        String module,
        boolean allowed,
        int remaining,
        Instant resetTime,
        RateLimitWarning warning,
        Instant blockedUntil,
        boolean exceeded
) {

    public static RateLimitResult unlimited(String module, Instant now) {
        return new RateLimitResult(module, true, Integer.MAX_VALUE, now, null, null, false);
    }

    public RateLimitResult withoutWarning() {
        if (warning == null) return this;
        return new RateLimitResult(module, allowed, remaining, resetTime, null, blockedUntil, exceeded);
    }

    /**
     * Whole seconds until a retry can succeed, rounded up, never below 1 for a denied result.
     */
    public long retryAfterSeconds(Instant now) {
        var until = blockedUntil != null ? blockedUntil : resetTime;
        if (until == null || now == null) return allowed ? 0 : 1;
        var ms = Duration.between(now, until).toMillis();
        if (ms <= 0) return allowed ? 0 : 1;
        return (ms + 999) / 1000;
    }
}
