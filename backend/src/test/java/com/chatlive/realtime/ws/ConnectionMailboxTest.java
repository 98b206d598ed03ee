package com.chatlive.realtime.ws;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionMailboxTest {

    @Test
    void tasks_run_in_submission_order_without_overlap() throws Exception {
        var pool = Executors.newFixedThreadPool(8);
        try {
            var mailbox = new ConnectionMailbox("c1", pool);
            var seen = Collections.synchronizedList(new ArrayList<Integer>());
            var running = new AtomicInteger();
            var maxRunning = new AtomicInteger();
            var done = new CountDownLatch(500);

            for (int i = 0; i < 500; i++) {
                var n = i;
                mailbox.submit(() -> {
                    maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                    seen.add(n);
                    running.decrementAndGet();
                    done.countDown();
                });
            }

            assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(maxRunning.get()).isEqualTo(1);
            var expected = new ArrayList<Integer>();
            for (int i = 0; i < 500; i++) expected.add(i);
            assertThat(seen).containsExactlyElementsOf(expected);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void failing_task_does_not_stop_the_queue() {
        var mailbox = new ConnectionMailbox("c2", Runnable::run);
        List<String> out = new ArrayList<>();

        mailbox.submit(() -> {
            throw new IllegalStateException("boom");
        });
        mailbox.submit(() -> out.add("after"));

        assertThat(out).containsExactly("after");
    }

    @Test
    void closed_mailbox_rejects_work() {
        var mailbox = new ConnectionMailbox("c3", Runnable::run);
        mailbox.close();

        assertThat(mailbox.submit(() -> {
        })).isFalse();
        assertThat(mailbox.pending()).isZero();
    }

    @Test
    void backlog_is_capped_until_it_drains() {
        var parked = new ArrayList<Runnable>();
        var mailbox = new ConnectionMailbox("c4", parked::add, 3);
        var ran = new AtomicInteger();

        for (int i = 0; i < 3; i++) {
            assertThat(mailbox.submit(ran::incrementAndGet)).isTrue();
        }
        assertThat(mailbox.submit(ran::incrementAndGet)).isFalse();
        assertThat(mailbox.pending()).isEqualTo(3);
        assertThat(mailbox.isClosed()).isFalse();

        parked.remove(0).run();

        assertThat(ran.get()).isEqualTo(3);
        assertThat(mailbox.pending()).isZero();
        assertThat(mailbox.submit(ran::incrementAndGet)).isTrue();
    }
}
