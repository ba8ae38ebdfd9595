package io.docfeed.subscription.ack;

import io.docfeed.core.cancel.CancellationToken;
import io.docfeed.core.etag.Etag;
import io.docfeed.subscription.admission.AdmissionController;
import io.docfeed.subscription.admission.ConnectionLease;
import io.docfeed.subscription.exception.SubscriptionException;
import io.docfeed.subscription.model.CloseReason;
import io.docfeed.subscription.store.CursorStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Matches client acknowledgments to the batch in flight and commits the checkpoint. At most one batch per
 * subscription is pending; an ack is accepted only from the lease holder and only for the exact position
 * the batch ended at.
 */
@Slf4j
public final class AcknowledgmentTracker {

    private final Map<Long, PendingAck> pending = new ConcurrentHashMap<>();
    private final CursorStore cursorStore;
    private final AdmissionController admission;
    private final String nodeTag;
    private final Clock clock;

    public AcknowledgmentTracker(final CursorStore cursorStore,
                                 final AdmissionController admission,
                                 final String nodeTag,
                                 final Clock clock) {
        this.cursorStore = cursorStore;
        this.admission = admission;
        this.nodeTag = nodeTag;
        this.clock = clock;
    }

    /** Registers the batch just delivered on {@code lease}. */
    public PendingAck begin(final ConnectionLease lease, final Etag batchEnd, final int documentCount) {
        final PendingAck p = new PendingAck(lease, batchEnd, documentCount, clock.millis());
        final PendingAck previous = pending.put(lease.getSubscriptionId(), p);
        if (previous != null) {
            previous.getReply().complete(AckResult.rejected("superseded by a newer batch"));
        }
        return p;
    }

    /**
     * Client acknowledgment. The returned future completes once the checkpoint is committed, or immediately
     * when the ack is rejected.
     */
    public CompletableFuture<AckResult> acknowledge(final long subscriptionId, final String connectionId, final Etag etag) {
        final Optional<ConnectionLease> holder = admission.current(subscriptionId);
        if (holder.isEmpty() || !holder.get().getConnectionId().equals(connectionId)) {
            return rejected(subscriptionId, connectionId, "connection does not hold the subscription");
        }
        final ConnectionLease lease = holder.get();
        lease.touch(clock.millis());

        final PendingAck p = pending.get(subscriptionId);
        if (p == null || p.getLease() != lease) {
            return rejected(subscriptionId, connectionId, "no batch is awaiting acknowledgment");
        }
        if (!p.getBatchEnd().equals(etag)) {
            return rejected(subscriptionId, connectionId,
                    "acknowledged " + etag + " but the batch in flight ends at " + p.getBatchEnd());
        }
        if (!p.getOutcome().complete(AckOutcome.ACKNOWLEDGED)) {
            return rejected(subscriptionId, connectionId, "batch was already " + p.getOutcome().join());
        }
        return p.getReply();
    }

    /**
     * The client's own handler failed. Unless the lease ignores subscriber errors, the batch in flight is not
     * committed and the lease ends with {@link CloseReason#SUBSCRIBER_ERROR}.
     *
     * @return false if {@code connectionId} does not hold the subscription
     */
    public boolean reportFault(final long subscriptionId, final String connectionId, final String message) {
        final Optional<ConnectionLease> holder = admission.current(subscriptionId);
        if (holder.isEmpty() || !holder.get().getConnectionId().equals(connectionId)) {
            log.debug("Ignoring fault report from {} on subscription {}: not the holder", connectionId, subscriptionId);
            return false;
        }
        final ConnectionLease lease = holder.get();
        lease.touch(clock.millis());

        if (lease.getOptions().isIgnoreSubscribersErrors()) {
            log.warn("Subscriber error on subscription {} ({}), ignored by configuration: {}", subscriptionId, connectionId, message);
            return true;
        }
        log.warn("Subscriber error on subscription {} ({}): {}", subscriptionId, connectionId, message);
        final PendingAck p = pending.get(subscriptionId);
        if (p == null || p.getLease() != lease || !p.fault(message)) {
            admission.release(lease, CloseReason.SUBSCRIBER_ERROR, message, null);
        }
        return true;
    }

    /**
     * Blocks the batch loop until the pending batch is acknowledged, faulted, timed out or cancelled.
     */
    public AckOutcome await(final PendingAck p, final Duration timeout, final CancellationToken token) {
        try (final CancellationToken.Registration ignored =
                     token.onCancel(() -> p.getOutcome().complete(AckOutcome.CANCELLED))) {
            return p.getOutcome().get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (final TimeoutException e) {
            p.getOutcome().complete(AckOutcome.TIMED_OUT);
            return p.getOutcome().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            p.getOutcome().complete(AckOutcome.CANCELLED);
            return AckOutcome.CANCELLED;
        } catch (final ExecutionException e) {
            return AckOutcome.CANCELLED;
        }
    }

    /**
     * Commits the acknowledged position and answers the client.
     *
     * @throws SubscriptionException if the commit failed; the client is told the ack was rejected
     */
    public void commit(final PendingAck p) {
        final long subscriptionId = p.getLease().getSubscriptionId();
        try {
            cursorStore.acknowledge(subscriptionId, p.getBatchEnd(), nodeTag, clock.millis());
            p.getReply().complete(AckResult.COMMITTED);
        } catch (final SubscriptionException e) {
            p.getReply().complete(AckResult.rejected(e.getMessage()));
            throw e;
        } finally {
            pending.remove(subscriptionId, p);
        }
    }

    /** Drops the pending batch; it will be redelivered from the committed checkpoint. */
    public void discard(final PendingAck p, final String why) {
        pending.remove(p.getLease().getSubscriptionId(), p);
        p.getReply().complete(AckResult.rejected(why));
    }

    public Optional<PendingAck> pending(final long subscriptionId) {
        return Optional.ofNullable(pending.get(subscriptionId));
    }

    private static CompletableFuture<AckResult> rejected(final long subscriptionId, final String connectionId, final String why) {
        log.debug("Rejected ack from {} on subscription {}: {}", connectionId, subscriptionId, why);
        return CompletableFuture.completedFuture(AckResult.rejected(why));
    }
}
