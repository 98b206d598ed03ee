package com.chatlive.realtime.ratelimit;

import java.time.Instant;

public record RateLimitState(Instant windowStart, Instant windowEnd, int count, Instant blockedUntil) {
}
