package com.chatlive.realtime.ratelimit;

import java.time.Duration;

public record ModuleConfig(
        String module,
        int maxRequests,
        Duration window,
        Duration block,
        int warnThreshold,
        Enforcement enforcement,
        boolean enabled
) {
    public ModuleConfig {
        if (maxRequests < 1) throw new IllegalArgumentException("max_requests_must_be_positive");
        if (window == null || window.isZero() || window.isNegative()) throw new IllegalArgumentException("window_must_be_positive");
        if (block == null || block.isNegative()) block = window;
        if (warnThreshold < 0) warnThreshold = 0;
        if (enforcement == null) enforcement = Enforcement.HARD;
    }
}
