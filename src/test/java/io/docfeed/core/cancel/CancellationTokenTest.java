package io.docfeed.core.cancel;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class CancellationTokenTest {

    @Test
    void firstReasonWins() {
        final CancellationToken token = CancellationToken.create();
        assertFalse(token.isCancelled());

        assertTrue(token.cancel("first"));
        assertFalse(token.cancel("second"));
        assertTrue(token.isCancelled());
        assertEquals("first", token.reason());
    }

    @Test
    void hooksRunOnceAndLateRegistrationRunsImmediately() {
        final CancellationToken token = CancellationToken.create();
        final AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        token.cancel(null);
        token.cancel(null);
        assertEquals(1, calls.get());
        assertEquals("cancelled", token.reason());

        token.onCancel(calls::incrementAndGet);
        assertEquals(2, calls.get());
    }

    @Test
    void closedRegistrationIsNotCalled() {
        final CancellationToken token = CancellationToken.create();
        final AtomicInteger calls = new AtomicInteger();
        try (final CancellationToken.Registration ignored = token.onCancel(calls::incrementAndGet)) {
            assertEquals(0, calls.get());
        }
        token.cancel("done");
        assertEquals(0, calls.get());
    }
}
