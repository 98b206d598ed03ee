package com.chatlive.realtime.ratelimit;

import java.time.Instant;

public record RateLimitWarning(String module, int remaining, int limit, Instant resetTime, String message) {

    static RateLimitWarning of(ModuleConfig cfg, int remaining, Instant resetTime) {
        var message = remaining == 0
                ? "This was your last allowed request in the current window."
                : "Only " + remaining + " request" + (remaining == 1 ? "" : "s") + " left in the current window.";
        return new RateLimitWarning(cfg.module(), remaining, cfg.maxRequests(), resetTime, message);
    }
}
