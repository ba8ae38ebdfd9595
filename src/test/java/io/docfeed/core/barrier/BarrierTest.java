package io.docfeed.core.barrier;

import io.docfeed.core.cancel.CancellationToken;
import io.docfeed.core.cancel.WaitResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class BarrierTest {

    @Test
    void signalBeforeWaitIsNotLost() {
        final Barrier barrier = new Barrier();
        final long seen = barrier.generation();
        barrier.signal();
        barrier.signal();
        barrier.signal();

        assertEquals(WaitResult.SIGNALLED, barrier.awaitAfter(seen, Duration.ofSeconds(1), CancellationToken.create()));
        assertEquals(seen + 3, barrier.generation());
    }

    @Test
    void timesOutWithoutSignal() {
        final Barrier barrier = new Barrier();
        assertEquals(WaitResult.TIMED_OUT,
                barrier.awaitAfter(barrier.generation(), Duration.ofMillis(50), CancellationToken.create()));
    }

    @Test
    void wakesBlockedWaiter() throws Exception {
        final Barrier barrier = new Barrier();
        final long seen = barrier.generation();
        final CompletableFuture<WaitResult> waiter = CompletableFuture.supplyAsync(
                () -> barrier.awaitAfter(seen, Duration.ofSeconds(10), CancellationToken.create()));

        Thread.sleep(50);
        barrier.signal();
        assertEquals(WaitResult.SIGNALLED, waiter.get(5, TimeUnit.SECONDS));
    }

    @Test
    void cancellationEndsWaitWithoutException() throws Exception {
        final Barrier barrier = new Barrier();
        final CancellationToken token = CancellationToken.create();
        final CompletableFuture<WaitResult> waiter = CompletableFuture.supplyAsync(
                () -> barrier.awaitAfter(barrier.generation(), Duration.ofSeconds(10), token));

        Thread.sleep(50);
        token.cancel("test");
        assertEquals(WaitResult.CANCELLED, waiter.get(5, TimeUnit.SECONDS));
    }

    @Test
    void wakeDoesNotCountAsSignal() {
        final Barrier barrier = new Barrier();
        final long seen = barrier.generation();
        barrier.wake();
        assertEquals(seen, barrier.generation());
        assertEquals(WaitResult.TIMED_OUT, barrier.awaitAfter(seen, Duration.ofMillis(20), CancellationToken.create()));
    }
}
