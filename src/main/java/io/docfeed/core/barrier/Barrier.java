package io.docfeed.core.barrier;

import io.docfeed.core.cancel.CancellationToken;
import io.docfeed.core.cancel.WaitResult;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Generation-counting wake-up point. Signals coalesce: a waiter that observed generation {@code g}
 * returns as soon as the generation moves past {@code g}, however many signals happened.
 */
public final class Barrier {
    private final Lock lock = new ReentrantLock();
    private final Condition condition = lock.newCondition();
    private long generation;

    public long generation() {
        lock.lock();
        try {
            return generation;
        } finally {
            lock.unlock();
        }
    }

    /** Called by producers to wake up every blocked waiter. */
    public void signal() {
        lock.lock();
        try {
            generation++;
            condition.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** Wakes waiters without advancing the generation (used for cancellation). */
    public void wake() {
        lock.lock();
        try {
            condition.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until the generation moves past {@code seen}, the timeout elapses or the token is cancelled.
     */
    public WaitResult awaitAfter(final long seen, final Duration timeout, final CancellationToken token) {
        try (final CancellationToken.Registration ignored = token.onCancel(this::wake)) {
            long remaining = timeout.toNanos();
            lock.lock();
            try {
                while (true) {
                    if (token.isCancelled()) return WaitResult.CANCELLED;
                    if (generation != seen) return WaitResult.SIGNALLED;
                    if (remaining <= 0L) return WaitResult.TIMED_OUT;
                    remaining = condition.awaitNanos(remaining);
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                return WaitResult.CANCELLED;
            } finally {
                lock.unlock();
            }
        }
    }
}
