package com.chatlive.realtime.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Service
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final RateLimitModules modules;
    private final RateLimitStore store;
    private final WarningDeduplicator deduplicator;
    private final Clock clock;

    public RateLimiter(RateLimitModules modules, RateLimitStore store, WarningDeduplicator deduplicator, Clock clock) {
        this.modules = modules;
        this.store = store;
        this.deduplicator = deduplicator;
        this.clock = clock;
    }

    public RateLimitResult checkLimit(String subjectKey, String module, RateLimitContext ctx) {
        var now = clock.instant();
        var cfg = modules.find(module).orElse(null);
        if (cfg == null) {
            log.warn("rate_limit_unknown_module module={} subject={}", module, subjectKey);
            return RateLimitResult.unlimited(module, now);
        }
        if (!cfg.enabled() || subjectKey == null || subjectKey.isBlank()) {
            return RateLimitResult.unlimited(module, now);
        }

        RateLimitResult result;
        try {
            result = store.consume(subjectKey, cfg, now);
        } catch (RuntimeException ex) {
            log.warn("rate_limit_store_failed module={} subject={}", module, subjectKey, ex);
            return RateLimitResult.unlimited(module, now);
        }

        if (result.warning() != null && !deduplicator.shouldEmit(subjectKey, module, now)) {
            result = result.withoutWarning();
        }
        if (result.exceeded()) {
            var action = ctx == null ? null : ctx.action();
            var ip = ctx == null ? null : ctx.ip();
            if (result.allowed()) {
                log.info("rate_limit_soft_exceeded module={} subject={} action={} ip={}", module, subjectKey, action, ip);
            } else {
                log.info("rate_limit_denied module={} subject={} action={} ip={} blockedUntil={}",
                        module, subjectKey, action, ip, result.blockedUntil());
            }
        }
        return result;
    }

    /**
     * Like {@link #checkLimit} but throws when the request is denied.
     */
    public RateLimitResult enforce(String subjectKey, String module, RateLimitContext ctx) {
        var result = checkLimit(subjectKey, module, ctx);
        if (!result.allowed()) {
            throw new RateLimitExceededException(result);
        }
        return result;
    }

    public void reset(String subjectKey, String module) {
        store.reset(subjectKey, module);
    }

    @Scheduled(fixedDelayString = "${app.rate-limit.eviction-interval-ms:600000}")
    public void evictWarningMarks() {
        deduplicator.evictOlderThan(clock.instant().minus(deduplicator.interval()));
    }
}
