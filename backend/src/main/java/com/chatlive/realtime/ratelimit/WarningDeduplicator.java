package com.chatlive.realtime.ratelimit;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lets at most one warning per (subject, module) through within the dedup interval.
 */
@Component
public class WarningDeduplicator {

    private final ConcurrentHashMap<String, Instant> lastEmitted = new ConcurrentHashMap<>();
    private final Duration interval;

    public WarningDeduplicator(@Value("${app.rate-limit.warning-dedup-interval:5m}") Duration interval) {
        this.interval = interval == null || interval.isNegative() ? Duration.ZERO : interval;
    }

    public boolean shouldEmit(String subjectKey, String module, Instant now) {
        var emit = new AtomicBoolean(false);
        lastEmitted.compute(module + ":" + subjectKey, (k, last) -> {
            if (last == null || !now.isBefore(last.plus(interval))) {
                emit.set(true);
                return now;
            }
            return last;
        });
        return emit.get();
    }

    public void evictOlderThan(Instant cutoff) {
        lastEmitted.values().removeIf(t -> t.isBefore(cutoff));
    }

    public Duration interval() {
        return interval;
    }
}
