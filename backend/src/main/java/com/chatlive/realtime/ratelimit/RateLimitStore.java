package com.chatlive.realtime.ratelimit;

import java.time.Instant;

public interface RateLimitStore {

    /**
     * Atomically applies {@link WindowPolicy} to the state of {@code (subjectKey, module)}.
     */
    RateLimitResult consume(String subjectKey, ModuleConfig cfg, Instant now);

    void reset(String subjectKey, String module);
}
