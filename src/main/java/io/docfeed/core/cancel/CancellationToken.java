package io.docfeed.core.cancel;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One-shot cancellation signal handed to every blocking call of a lease worker.
 * Waiters register a wake-up hook instead of being interrupted.
 */
@Slf4j
public final class CancellationToken {

    private final AtomicReference<Object> reason = new AtomicReference<>();
    private final List<Runnable> hooks = new CopyOnWriteArrayList<>();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * Cancels the token. Only the first call wins; later reasons are ignored.
     *
     * @return true if this call cancelled the token
     */
    public boolean cancel(final Object why) {
        if (!reason.compareAndSet(null, why == null ? "cancelled" : why)) {
            return false;
        }
        for (final Runnable hook : hooks) {
            try {
                hook.run();
            } catch (final RuntimeException e) {
                log.warn("Cancellation hook failed", e);
            }
        }
        hooks.clear();
        return true;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public Object reason() {
        return reason.get();
    }

    /**
     * Runs {@code hook} once on cancellation, or immediately if already cancelled.
     * Close the returned registration when the wait is over.
     */
    public Registration onCancel(final Runnable hook) {
        hooks.add(hook);
        if (isCancelled() && hooks.remove(hook)) {
            hook.run();
        }
        return () -> hooks.remove(hook);
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
