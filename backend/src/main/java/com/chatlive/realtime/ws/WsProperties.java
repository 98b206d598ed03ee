package com.chatlive.realtime.ws;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

@ConfigurationProperties(prefix = "app.ws")
public record WsProperties(
        List<String> allowedOrigins,
        Duration inactivityTimeout,
        Duration sendTimeLimit,
        Integer sendBufferSizeLimit,
        Integer dispatchThreads,
        Integer maxPendingFrames
) {
    public String[] effectiveAllowedOrigins() {
        if (allowedOrigins == null || allowedOrigins.isEmpty()) return new String[]{"*"};
        return allowedOrigins.toArray(new String[0]);
    }

    public Duration effectiveInactivityTimeout() {
        return inactivityTimeout == null ? Duration.ofMinutes(30) : inactivityTimeout;
    }

    public int effectiveSendTimeLimitMs() {
        return (int) (sendTimeLimit == null ? Duration.ofSeconds(10) : sendTimeLimit).toMillis();
    }

    public int effectiveSendBufferSizeLimit() {
        return sendBufferSizeLimit == null ? 512 * 1024 : sendBufferSizeLimit;
    }

    public int effectiveDispatchThreads() {
        return dispatchThreads == null || dispatchThreads < 1 ? Math.max(4, Runtime.getRuntime().availableProcessors() * 2) : dispatchThreads;
    }

    public int effectiveMaxPendingFrames() {
        return maxPendingFrames == null || maxPendingFrames < 1 ? ConnectionMailbox.DEFAULT_MAX_PENDING : maxPendingFrames;
    }
}
