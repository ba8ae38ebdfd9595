package io.docfeed.subscription.admission;

import io.docfeed.subscription.exception.SubscriptionClosedException;
import io.docfeed.subscription.exception.SubscriptionDisabledException;
import io.docfeed.subscription.model.CloseReason;
import io.docfeed.subscription.model.SubscriptionConnectionOptions;
import io.docfeed.subscription.model.SubscriptionCriteria;
import io.docfeed.subscription.model.SubscriptionOpeningStrategy;
import io.docfeed.testing.InMemoryStateStore;
import io.docfeed.testing.MutableClock;
import io.docfeed.testing.RecordingChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class AdmissionControllerTest {

    private static final long SUB = 1L;
    private static final Duration WAIT = Duration.ofSeconds(2);

    private final InMemoryStateStore states = new InMemoryStateStore();
    private final MutableClock clock = new MutableClock(1_000_000L);
    private final List<String> events = new CopyOnWriteArrayList<>();
    private AdmissionController admission;

    @BeforeEach
    void setUp() {
        states.put(SUB, SubscriptionCriteria.forCollection("orders"), "A");
        admission = new AdmissionController(states, clock, new LeaseListener() {
            @Override
            public void onOpened(final ConnectionLease lease) {
                events.add("opened " + lease.getConnectionId());
            }

            @Override
            public void onReleased(final ConnectionLease lease, final CloseReason reason) {
                events.add("released " + lease.getConnectionId() + " " + reason);
            }
        });
    }

    private static SubscriptionConnectionOptions options(final String connectionId, final SubscriptionOpeningStrategy strategy) {
        return SubscriptionConnectionOptions.builder().connectionId(connectionId).strategy(strategy).build();
    }

    private AdmissionResult open(final String connectionId, final SubscriptionOpeningStrategy strategy, final RecordingChannel channel) {
        return admission.tryOpen(SUB, options(connectionId, strategy), channel);
    }

    @Test
    void openIfFreeRejectsSecondConnection() {
        final AdmissionResult first = open("c1", SubscriptionOpeningStrategy.OPEN_IF_FREE, new RecordingChannel());
        final AdmissionResult second = open("c2", SubscriptionOpeningStrategy.OPEN_IF_FREE, new RecordingChannel());

        assertEquals(AdmissionResult.Status.ACCEPTED, first.getStatus());
        assertEquals(AdmissionResult.Status.REJECTED, second.getStatus());
        assertEquals(CloseReason.IN_USE, second.getReason());
        assertEquals("c1", admission.current(SUB).orElseThrow().getConnectionId());
    }

    @Test
    void concurrentOpensAdmitExactlyOne() throws Exception {
        final int contenders = 16;
        final ExecutorService pool = Executors.newFixedThreadPool(contenders);
        try {
            final CountDownLatch start = new CountDownLatch(1);
            final List<Future<AdmissionResult>> results = new ArrayList<>();
            for (int i = 0; i < contenders; i++) {
                final String id = "c" + i;
                results.add(pool.submit(() -> {
                    start.await();
                    return open(id, SubscriptionOpeningStrategy.OPEN_IF_FREE, new RecordingChannel());
                }));
            }
            start.countDown();

            int accepted = 0;
            for (final Future<AdmissionResult> f : results) {
                final AdmissionResult r = f.get(5, TimeUnit.SECONDS);
                if (r.getStatus() == AdmissionResult.Status.ACCEPTED) accepted++;
                else assertEquals(CloseReason.IN_USE, r.getReason());
            }
            assertEquals(1, accepted);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void takeOverPreemptsAndSignalsOldHolder() throws Exception {
        final RecordingChannel oldChannel = new RecordingChannel();
        final ConnectionLease old = open("c1", SubscriptionOpeningStrategy.OPEN_IF_FREE, oldChannel).getLease();

        final AdmissionResult r = open("c2", SubscriptionOpeningStrategy.TAKE_OVER, new RecordingChannel());

        assertEquals(AdmissionResult.Status.ACCEPTED, r.getStatus());
        assertTrue(old.isClosed());
        assertTrue(old.getToken().isCancelled());
        assertEquals(CloseReason.SUPERSEDED, old.getCloseReason());
        final RecordingChannel.Frame closed = oldChannel.await(RecordingChannel.Kind.CLOSED, WAIT);
        assertNotNull(closed);
        assertEquals(CloseReason.SUPERSEDED, closed.reason());
        assertEquals("c2", admission.current(SUB).orElseThrow().getConnectionId());
        assertEquals(List.of("opened c1", "released c1 SUPERSEDED", "opened c2"), events);
    }

    @Test
    void forceAndKeepIsOnlyPreemptedByForceAndKeep() {
        open("keeper", SubscriptionOpeningStrategy.FORCE_AND_KEEP, new RecordingChannel());

        final AdmissionResult takeOver = open("c2", SubscriptionOpeningStrategy.TAKE_OVER, new RecordingChannel());
        assertEquals(CloseReason.IN_USE, takeOver.getReason());

        final AdmissionResult force = open("c3", SubscriptionOpeningStrategy.FORCE_AND_KEEP, new RecordingChannel());
        assertEquals(AdmissionResult.Status.ACCEPTED, force.getStatus());
        assertEquals("c3", admission.current(SUB).orElseThrow().getConnectionId());
    }

    @Test
    void waitForFreeIsGrantedInArrivalOrder() throws Exception {
        final ConnectionLease holder = open("c1", SubscriptionOpeningStrategy.OPEN_IF_FREE, new RecordingChannel()).getLease();
        final AdmissionResult second = open("c2", SubscriptionOpeningStrategy.WAIT_FOR_FREE, new RecordingChannel());
        final AdmissionResult third = open("c3", SubscriptionOpeningStrategy.WAIT_FOR_FREE, new RecordingChannel());

        assertEquals(AdmissionResult.Status.QUEUED, second.getStatus());
        assertEquals(AdmissionResult.Status.QUEUED, third.getStatus());
        assertEquals(List.of("c2", "c3"), admission.queued(SUB));
        // a waiter never preempts
        assertFalse(holder.isClosed());

        assertTrue(admission.release(holder, CloseReason.CLIENT_CLOSED, "done", null));
        final ConnectionLease granted = second.getGrant().get(2, TimeUnit.SECONDS);
        assertEquals("c2", granted.getConnectionId());
        assertFalse(third.getGrant().isDone());

        admission.close(SUB, "c2", false);
        assertEquals("c3", third.getGrant().get(2, TimeUnit.SECONDS).getConnectionId());
        assertTrue(admission.queued(SUB).isEmpty());
    }

    @Test
    void waiterWhoseStreamClosedIsSkipped() throws Exception {
        final ConnectionLease holder = open("c1", SubscriptionOpeningStrategy.OPEN_IF_FREE, new RecordingChannel()).getLease();
        final RecordingChannel gone = new RecordingChannel();
        final AdmissionResult dead = open("c2", SubscriptionOpeningStrategy.WAIT_FOR_FREE, gone);
        final AdmissionResult alive = open("c3", SubscriptionOpeningStrategy.WAIT_FOR_FREE, new RecordingChannel());

        gone.disconnect();
        admission.channelClosed(gone);
        assertTrue(dead.getGrant().isCompletedExceptionally());

        admission.release(holder, CloseReason.CLIENT_CLOSED, "done", null);
        assertEquals("c3", alive.getGrant().get(2, TimeUnit.SECONDS).getConnectionId());
    }

    @Test
    void evictionFailsWaiters() {
        open("c1", SubscriptionOpeningStrategy.OPEN_IF_FREE, new RecordingChannel());
        final AdmissionResult waiter = open("c2", SubscriptionOpeningStrategy.WAIT_FOR_FREE, new RecordingChannel());

        states.disable(SUB);
        admission.evict(SUB, CloseReason.DISABLED, "disabled", null);

        final ExecutionException e = assertThrows(ExecutionException.class, () -> waiter.getGrant().get(2, TimeUnit.SECONDS));
        assertInstanceOf(SubscriptionDisabledException.class, e.getCause());
        assertTrue(admission.current(SUB).isEmpty());
        assertEquals(CloseReason.DISABLED, open("c3", SubscriptionOpeningStrategy.OPEN_IF_FREE, new RecordingChannel()).getReason());
    }

    @Test
    void clientCloseDropsOnlyItsOwnQueueEntry() throws Exception {
        open("c1", SubscriptionOpeningStrategy.OPEN_IF_FREE, new RecordingChannel());
        final AdmissionResult waiter = open("c2", SubscriptionOpeningStrategy.WAIT_FOR_FREE, new RecordingChannel());

        assertTrue(admission.close(SUB, "c2", false));
        final ExecutionException e = assertThrows(ExecutionException.class, () -> waiter.getGrant().get(2, TimeUnit.SECONDS));
        assertInstanceOf(SubscriptionClosedException.class, e.getCause());
        assertEquals("c1", admission.current(SUB).orElseThrow().getConnectionId());
    }

    @Test
    void nonForcedCloseFromNonHolderIsNoOp() {
        open("c1", SubscriptionOpeningStrategy.OPEN_IF_FREE, new RecordingChannel());
        assertFalse(admission.close(SUB, "stranger", false));
        assertEquals("c1", admission.current(SUB).orElseThrow().getConnectionId());
    }

    @Test
    void forcedCloseBarsConnectionUntilDelete() {
        final RecordingChannel channel = new RecordingChannel();
        open("c1", SubscriptionOpeningStrategy.OPEN_IF_FREE, channel);

        assertTrue(admission.close(SUB, "admin", true));
        assertTrue(admission.current(SUB).isEmpty());

        final AdmissionResult again = open("c1", SubscriptionOpeningStrategy.OPEN_IF_FREE, new RecordingChannel());
        assertEquals(CloseReason.FORCIBLY_RELEASED, again.getReason());
        assertFalse(again.getReason().isRetryable());
        // other connections are unaffected
        assertEquals(AdmissionResult.Status.ACCEPTED, open("c2", SubscriptionOpeningStrategy.OPEN_IF_FREE, new RecordingChannel()).getStatus());

        admission.evict(SUB, CloseReason.DELETED, "deleted", null);
        assertEquals(AdmissionResult.Status.ACCEPTED, open("c1", SubscriptionOpeningStrategy.OPEN_IF_FREE, new RecordingChannel()).getStatus());
    }

    @Test
    void forciblyReleasedSetIsBounded() {
        for (int i = 0; i <= AdmissionController.FORCIBLY_RELEASED_CAPACITY; i++) {
            open("c" + i, SubscriptionOpeningStrategy.OPEN_IF_FREE, new RecordingChannel());
            admission.close(SUB, null, true);
        }
        // the oldest entry was evicted
        assertEquals(AdmissionResult.Status.ACCEPTED, open("c0", SubscriptionOpeningStrategy.OPEN_IF_FREE, new RecordingChannel()).getStatus());
        admission.close(SUB, "c0", false);
        assertEquals(CloseReason.FORCIBLY_RELEASED, open("c1", SubscriptionOpeningStrategy.OPEN_IF_FREE, new RecordingChannel()).getReason());
    }

    @Test
    void sameConnectionReopenReplacesStream() {
        final RecordingChannel first = new RecordingChannel();
        final ConnectionLease old = open("c1", SubscriptionOpeningStrategy.OPEN_IF_FREE, first).getLease();
        clock.advance(Duration.ofSeconds(5));

        final RecordingChannel second = new RecordingChannel();
        final AdmissionResult r = open("c1", SubscriptionOpeningStrategy.OPEN_IF_FREE, second);

        assertEquals(AdmissionResult.Status.ACCEPTED, r.getStatus());
        assertTrue(old.isClosed());
        assertSame(second, r.getLease().getChannel());
        assertEquals(clock.millis(), r.getLease().getLastActivityMillis());
    }

    @Test
    void staleLeaseIsReclaimed() throws Exception {
        final SubscriptionConnectionOptions o = SubscriptionConnectionOptions.builder()
                .connectionId("c1")
                .acknowledgmentTimeout(Duration.ofSeconds(10))
                .clientAliveNotificationInterval(Duration.ofSeconds(5))
                .build();
        final RecordingChannel channel = new RecordingChannel();
        final ConnectionLease old = admission.tryOpen(SUB, o, channel).getLease();
        old.batchSent(clock.millis());

        // batch overdue but the client was active recently: still in use
        clock.advance(Duration.ofSeconds(11));
        old.touch(clock.millis());
        assertEquals(CloseReason.IN_USE, open("c2", SubscriptionOpeningStrategy.OPEN_IF_FREE, new RecordingChannel()).getReason());

        clock.advance(Duration.ofSeconds(16));
        final AdmissionResult r = open("c2", SubscriptionOpeningStrategy.OPEN_IF_FREE, new RecordingChannel());
        assertEquals(AdmissionResult.Status.ACCEPTED, r.getStatus());
        assertEquals(CloseReason.ACK_TIMEOUT, old.getCloseReason());
        assertEquals(CloseReason.ACK_TIMEOUT, channel.await(RecordingChannel.Kind.CLOSED, WAIT).reason());
    }

    @Test
    void leaseWithoutBatchIsNeverStale() {
        open("c1", SubscriptionOpeningStrategy.OPEN_IF_FREE, new RecordingChannel());
        clock.advance(Duration.ofDays(1));
        assertEquals(CloseReason.IN_USE, open("c2", SubscriptionOpeningStrategy.OPEN_IF_FREE, new RecordingChannel()).getReason());
    }

    @Test
    void missingOrDisabledSubscriptionIsRejected() {
        assertEquals(CloseReason.NOT_FOUND,
                admission.tryOpen(99L, options("c1", SubscriptionOpeningStrategy.OPEN_IF_FREE), new RecordingChannel()).getReason());
        states.disable(SUB);
        assertEquals(CloseReason.DISABLED, open("c1", SubscriptionOpeningStrategy.OPEN_IF_FREE, new RecordingChannel()).getReason());
    }

    @Test
    void closedStreamReleasesLeaseAndGrantsWaiter() throws Exception {
        final RecordingChannel channel = new RecordingChannel();
        open("c1", SubscriptionOpeningStrategy.OPEN_IF_FREE, channel);
        final CompletableFuture<ConnectionLease> grant =
                open("c2", SubscriptionOpeningStrategy.WAIT_FOR_FREE, new RecordingChannel()).getGrant();

        channel.disconnect();
        admission.channelClosed(channel);

        assertEquals("c2", grant.get(2, TimeUnit.SECONDS).getConnectionId());
        assertTrue(events.contains("released c1 CLIENT_CLOSED"));
    }

    @Test
    void touchOnlyCountsForHolder() {
        final ConnectionLease lease = open("c1", SubscriptionOpeningStrategy.OPEN_IF_FREE, new RecordingChannel()).getLease();
        clock.advance(Duration.ofSeconds(1));

        assertFalse(admission.touch(SUB, "c2"));
        assertTrue(admission.touch(SUB, "c1"));
        assertEquals(clock.millis(), lease.getLastActivityMillis());
    }

    @Test
    void releaseOfSupersededLeaseDoesNotDisturbHolder() {
        final ConnectionLease old = open("c1", SubscriptionOpeningStrategy.OPEN_IF_FREE, new RecordingChannel()).getLease();
        open("c2", SubscriptionOpeningStrategy.TAKE_OVER, new RecordingChannel());

        assertFalse(admission.release(old, CloseReason.ACK_TIMEOUT, "late", null));
        assertEquals("c2", admission.current(SUB).orElseThrow().getConnectionId());
        assertFalse(admission.isCurrent(old));
    }
}
