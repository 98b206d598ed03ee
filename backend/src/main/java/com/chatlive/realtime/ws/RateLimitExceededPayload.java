package com.chatlive.realtime.ws;

import com.chatlive.realtime.ratelimit.RateLimitResult;

import java.time.Instant;

public record RateLimitExceededPayload(String error, String module, long retryAfter, Instant blockedUntil) {

    public static RateLimitExceededPayload of(RateLimitResult result, Instant now) {
        var retryAfter = result.retryAfterSeconds(now);
        var until = result.blockedUntil() != null ? result.blockedUntil() : now.plusSeconds(retryAfter);
        return new RateLimitExceededPayload("Rate limit exceeded. Try again in " + retryAfter + " seconds.",
                result.module(), retryAfter, until);
    }
}
