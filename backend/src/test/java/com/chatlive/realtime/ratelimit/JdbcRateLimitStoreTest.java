package com.chatlive.realtime.ratelimit;

import com.chatlive.realtime.bootstrap.RealtimeApplication;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = RealtimeApplication.class, properties = "app.rate-limit.store=jdbc")
@ActiveProfiles("dev")
class JdbcRateLimitStoreTest {

    @Autowired
    RateLimitStore store;

    private final ModuleConfig chat = new ModuleConfig("chat", 10, Duration.ofHours(1), Duration.ofHours(1), 2, Enforcement.HARD, true);

    @Test
    void jdbc_store_is_selected() {
        assertThat(store).isInstanceOf(JdbcRateLimitStore.class);
    }

    @Test
    void concurrent_checks_never_exceed_budget() throws Exception {
        var subject = "jdbc_" + UUID.randomUUID();
        var now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        assertThat(store.consume(subject, chat, now).allowed()).isTrue();

        var pool = Executors.newFixedThreadPool(4);
        try {
            var start = new CountDownLatch(1);
            var futures = new ArrayList<Future<RateLimitResult>>();
            for (int i = 0; i < 20; i++) {
                Callable<RateLimitResult> call = () -> {
                    start.await();
                    return store.consume(subject, chat, now);
                };
                futures.add(pool.submit(call));
            }
            start.countDown();

            var allowed = 0;
            for (var f : futures) {
                if (f.get(20, TimeUnit.SECONDS).allowed()) allowed++;
            }
            assertThat(allowed).isEqualTo(9);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void block_persists_and_reset_clears_it() {
        var subject = "jdbc_" + UUID.randomUUID();
        var now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        for (int i = 0; i < 10; i++) {
            store.consume(subject, chat, now);
        }

        var denied = store.consume(subject, chat, now.plusSeconds(1));
        var retry = store.consume(subject, chat, now.plusSeconds(120));
        assertThat(denied.allowed()).isFalse();
        assertThat(retry.blockedUntil()).isEqualTo(denied.blockedUntil());

        store.reset(subject, "chat");
        assertThat(store.consume(subject, chat, now.plusSeconds(121)).remaining()).isEqualTo(9);
    }
}
