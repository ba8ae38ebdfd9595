package io.docfeed.storage;

import io.docfeed.core.barrier.Barrier;
import io.docfeed.core.cancel.CancellationToken;
import io.docfeed.core.cancel.WaitResult;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-collection, coalescing "new document" broadcast. Bursts of writes collapse into a single wake-up
 * for each subscriber.
 */
public final class ChangeNotifier {

    private final Map<String, Barrier> barriers = new ConcurrentHashMap<>();

    public void notifyChanged(final String collection) {
        barrier(collection).signal();
    }

    public Subscription subscribe(final String collection) {
        return new Subscription(barrier(collection));
    }

    private Barrier barrier(final String collection) {
        return barriers.computeIfAbsent(collection, c -> new Barrier());
    }

    /**
     * A reader's view of one collection's signals. Call {@link #arm()} before scanning so that writes
     * racing with the scan still wake the following {@link #await}.
     */
    public static final class Subscription {
        private final Barrier barrier;
        private long seen;

        private Subscription(final Barrier barrier) {
            this.barrier = barrier;
            this.seen = barrier.generation();
        }

        public void arm() {
            seen = barrier.generation();
        }

        public WaitResult await(final Duration timeout, final CancellationToken token) {
            final WaitResult result = barrier.awaitAfter(seen, timeout, token);
            if (result == WaitResult.SIGNALLED) {
                seen = barrier.generation();
            }
            return result;
        }
    }
}
