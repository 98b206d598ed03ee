package com.chatlive.realtime.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one connection's inbound work strictly in arrival order on a shared executor. At most
 * one task per mailbox runs at a time; different mailboxes drain concurrently. Work waiting to run
 * is capped; {@link #submit} refuses tasks beyond the cap until the backlog drains.
 */
public class ConnectionMailbox {

    public static final int DEFAULT_MAX_PENDING = 256;

    private static final Logger log = LoggerFactory.getLogger(ConnectionMailbox.class);

    private final String connectionId;
    private final Executor executor;
    private final int maxPending;
    private final AtomicInteger pending = new AtomicInteger();
    private final Queue<Runnable> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private volatile boolean closed;

    public ConnectionMailbox(String connectionId, Executor executor) {
        this(connectionId, executor, DEFAULT_MAX_PENDING);
    }

    public ConnectionMailbox(String connectionId, Executor executor, int maxPending) {
        this.connectionId = connectionId;
        this.executor = executor;
        this.maxPending = Math.max(1, maxPending);
    }

    /**
     * @return false when the mailbox is closed or already holds {@code maxPending} tasks
     */
    public boolean submit(Runnable task) {
        if (closed || task == null) return false;
        if (pending.incrementAndGet() > maxPending) {
            pending.decrementAndGet();
            return false;
        }
        queue.add(task);
        schedule();
        return true;
    }

    public void close() {
        closed = true;
        queue.clear();
        pending.set(0);
    }

    public boolean isClosed() {
        return closed;
    }

    public int pending() {
        return Math.max(0, pending.get());
    }

    private void schedule() {
        if (!draining.compareAndSet(false, true)) return;
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException ex) {
            draining.set(false);
            log.warn("mailbox_rejected connectionId={} pending={}", connectionId, pending(), ex);
        }
    }

    private void drain() {
        try {
            Runnable task;
            while (!closed && (task = queue.poll()) != null) {
                pending.decrementAndGet();
                try {
                    task.run();
                } catch (RuntimeException ex) {
                    log.warn("mailbox_task_failed connectionId={}", connectionId, ex);
                }
            }
        } finally {
            draining.set(false);
            if (!closed && !queue.isEmpty()) {
                schedule();
            }
        }
    }
}
