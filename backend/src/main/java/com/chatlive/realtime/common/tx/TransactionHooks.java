package com.chatlive.realtime.common.tx;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

public final class TransactionHooks {

    private static final Logger log = LoggerFactory.getLogger(TransactionHooks.class);

    private TransactionHooks() {
    }

    /**
     * Runs {@code r} once the surrounding transaction has committed, or immediately when
     * there is no transaction. Never runs on rollback.
     */
    public static void afterCommit(Runnable r) {
        if (r == null) return;
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    runLogged(r);
                }
            });
        } else {
            runLogged(r);
        }
    }

    private static void runLogged(Runnable r) {
        try {
            r.run();
        } catch (RuntimeException ex) {
            // The data is already committed; a failed fan-out must not surface as a failed write.
            log.warn("after_commit_hook_failed", ex);
        }
    }
}
