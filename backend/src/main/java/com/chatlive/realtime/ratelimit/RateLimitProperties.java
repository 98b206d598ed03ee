package com.chatlive.realtime.ratelimit;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * {@code app.rate-limit.*}. Module entries override the built-in defaults field by field;
 * unset fields keep the default.
 */
@ConfigurationProperties(prefix = "app.rate-limit")
public record RateLimitProperties(
        String store,
        Map<String, ModuleOverride> modules
) {
    public record ModuleOverride(
            Integer maxRequests,
            Duration window,
            Duration block,
            Integer warnThreshold,
            Enforcement enforcement,
            Boolean enabled
    ) {
    }
}
