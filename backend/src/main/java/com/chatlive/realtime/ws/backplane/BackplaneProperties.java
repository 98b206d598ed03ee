package com.chatlive.realtime.ws.backplane;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.backplane")
public record BackplaneProperties(
        boolean enabled,
        String channel,
        Duration connectTimeout
) {
    public String effectiveChannel() {
        return channel == null || channel.isBlank() ? "realtime:events" : channel;
    }

    public Duration effectiveConnectTimeout() {
        return connectTimeout == null ? Duration.ofSeconds(3) : connectTimeout;
    }
}
