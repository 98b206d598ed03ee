package com.chatlive.realtime.ratelimit;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-process store. Each (subject, module) pair has its own lock, so checks for
 * different subjects never contend.
 */
@Component
@ConditionalOnProperty(prefix = "app.rate-limit", name = "store", havingValue = "memory", matchIfMissing = true)
public class InMemoryRateLimitStore implements RateLimitStore {

    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryRateLimitStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public RateLimitResult consume(String subjectKey, ModuleConfig cfg, Instant now) {
        var c = counters.computeIfAbsent(key(subjectKey, cfg.module()), k -> new Counter());
        synchronized (c) {
            var decision = WindowPolicy.apply(c.state, cfg, now);
            c.state = decision.next();
            return decision.result();
        }
    }

    @Override
    public void reset(String subjectKey, String module) {
        counters.remove(key(subjectKey, module));
    }

    @Scheduled(fixedDelayString = "${app.rate-limit.eviction-interval-ms:600000}")
    public void evictStale() {
        evictStale(clock.instant());
    }

    int evictStale(Instant now) {
        var removed = 0;
        for (var e : counters.entrySet()) {
            var c = e.getValue();
            synchronized (c) {
                var s = c.state;
                var blocked = s != null && s.blockedUntil() != null && s.blockedUntil().isAfter(now);
                if (s == null || (!blocked && !s.windowEnd().isAfter(now))) {
                    if (counters.remove(e.getKey(), c)) removed++;
                }
            }
        }
        return removed;
    }

    int size() {
        return counters.size();
    }

    private static String key(String subjectKey, String module) {
        return module + ":" + subjectKey;
    }

    private static class Counter {
        RateLimitState state;
    }
}
