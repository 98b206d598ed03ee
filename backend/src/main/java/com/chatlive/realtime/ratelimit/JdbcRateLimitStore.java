package com.chatlive.realtime.ratelimit;

import com.chatlive.realtime.ratelimit.repo.RateLimitStateRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Shared store for multi-process deployments; correctness comes from the row lock.
 */
@Component
@ConditionalOnProperty(prefix = "app.rate-limit", name = "store", havingValue = "jdbc")
public class JdbcRateLimitStore implements RateLimitStore {

    private final RateLimitStateRepository repository;

    public JdbcRateLimitStore(RateLimitStateRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public RateLimitResult consume(String subjectKey, ModuleConfig cfg, Instant now) {
        repository.ensureRow(subjectKey, cfg.module(), now);
        var current = repository.lockRow(subjectKey, cfg.module())
                .orElseThrow(() -> new IllegalStateException("rate_limit_row_missing"));
        var decision = WindowPolicy.apply(current, cfg, now);
        if (!decision.next().equals(current)) {
            repository.update(subjectKey, cfg.module(), decision.next(), now);
        }
        return decision.result();
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void reset(String subjectKey, String module) {
        repository.delete(subjectKey, module);
    }
}
