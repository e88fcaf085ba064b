package com.marginledger.core;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs every ledger and engine operation one at a time, each inside a single database
 * transaction.
 *
 * <p>The lock is taken before the transaction starts and released after it commits or
 * rolls back, so no operation can observe another one's uncommitted effects. Any runtime
 * exception escaping the operation rolls back everything it wrote: there is no partial
 * margin lock and no partial state transition.
 *
 * <p>Calls made from inside a running operation (the engine calling the custody ledger,
 * the relay dispatching to the engine) join the outer operation directly. They do not
 * start a nested transaction boundary, so an exception that the outer operation chooses to
 * handle (a skipped batch item) does not mark the whole transaction rollback-only.
 */
@Component
public class LedgerSequencer {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final TransactionTemplate transactionTemplate;

    public LedgerSequencer(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public <T> T execute(Supplier<T> operation) {
        if (lock.isHeldByCurrentThread()) {
            return operation.get();
        }
        lock.lock();
        try {
            return transactionTemplate.execute(status -> operation.get());
        } finally {
            lock.unlock();
        }
    }

    public void run(Runnable operation) {
        execute(() -> {
            operation.run();
            return null;
        });
    }

    /** True while the current thread is inside a sequenced operation. */
    public boolean inOperation() {
        return lock.isHeldByCurrentThread();
    }
}
