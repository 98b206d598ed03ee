package com.chatlive.realtime.ratelimit;

/**
 * Request details carried into rate-limit log lines.
 */
public record RateLimitContext(String userId, String ip, String action) {

    public static RateLimitContext forUser(String userId, String action) {
        return new RateLimitContext(userId, null, action);
    }

    public static RateLimitContext forIp(String ip, String action) {
        return new RateLimitContext(null, ip, action);
    }
}
