package io.docfeed.subscription.admission;

import io.docfeed.cluster.metadata.SubscriptionState;
import io.docfeed.cluster.metadata.SubscriptionStateStore;
import io.docfeed.subscription.channel.SubscriptionChannel;
import io.docfeed.subscription.exception.SubscriptionException;
import io.docfeed.subscription.model.CloseReason;
import io.docfeed.subscription.model.SubscriptionConnectionOptions;
import io.docfeed.subscription.model.SubscriptionOpeningStrategy;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Decides which connection owns each subscription on this node. All transitions for one subscription run
 * under that subscription's lock; different subscriptions never contend.
 */
@Slf4j
public final class AdmissionController {

    static final int FORCIBLY_RELEASED_CAPACITY = 50;

    private final SubscriptionStateStore states;
    private final Clock clock;
    private final LeaseListener listener;
    private final Map<Long, Slot> slots = new ConcurrentHashMap<>();

    public AdmissionController(final SubscriptionStateStore states, final Clock clock, final LeaseListener listener) {
        this.states = states;
        this.clock = clock;
        this.listener = listener;
    }

    /**
     * Applies the opening strategy of {@code options} against the current holder.
     */
    public AdmissionResult tryOpen(final long subscriptionId,
                                   final SubscriptionConnectionOptions options,
                                   final SubscriptionChannel channel) {
        final Optional<SubscriptionState> state = states.current(subscriptionId);
        if (state.isEmpty()) {
            return AdmissionResult.rejected(CloseReason.NOT_FOUND, "subscription " + subscriptionId + " does not exist");
        }
        if (state.get().disabled()) {
            return AdmissionResult.rejected(CloseReason.DISABLED, "subscription " + subscriptionId + " is disabled");
        }

        final String connectionId = options.getConnectionId();
        final Slot slot = slot(subscriptionId);
        slot.lock.lock();
        try {
            if (slot.forciblyReleased.contains(connectionId)) {
                return AdmissionResult.rejected(CloseReason.FORCIBLY_RELEASED,
                        "connection " + connectionId + " was forcibly released from subscription " + subscriptionId);
            }

            final long now = clock.millis();
            ConnectionLease current = slot.lease;

            if (current != null && current.getConnectionId().equals(connectionId)) {
                log.debug("Connection {} reopened subscription {}, replacing its previous stream", connectionId, subscriptionId);
                end(slot, current, CloseReason.SUPERSEDED, "reopened by the same connection", null, false);
                return AdmissionResult.accepted(grant(slot, subscriptionId, options, channel, now));
            }

            if (current != null && current.isStale(now)) {
                log.info("Reclaiming stale {} on behalf of {}", current, connectionId);
                end(slot, current, CloseReason.ACK_TIMEOUT, "lease expired: no acknowledgment or client activity", null, true);
                grantNext(slot, now);
                current = slot.lease;
            }

            if (current == null) {
                return AdmissionResult.accepted(grant(slot, subscriptionId, options, channel, now));
            }

            final SubscriptionOpeningStrategy strategy = options.getStrategy();
            switch (strategy) {
                case OPEN_IF_FREE:
                    return inUse(subscriptionId, current);
                case WAIT_FOR_FREE: {
                    final CompletableFuture<ConnectionLease> grant = new CompletableFuture<>();
                    slot.waiters.addLast(new Waiter(options, channel, grant));
                    log.debug("Connection {} queued on subscription {} (position {})",
                            connectionId, subscriptionId, slot.waiters.size());
                    return AdmissionResult.queued(grant);
                }
                default:
                    if (!strategy.canPreempt(current.strategy())) {
                        return inUse(subscriptionId, current);
                    }
                    log.info("Connection {} ({}) takes subscription {} from {}", connectionId, strategy, subscriptionId, current);
                    end(slot, current, CloseReason.SUPERSEDED,
                            "subscription " + subscriptionId + " was taken over by connection " + connectionId, null, true);
                    return AdmissionResult.accepted(grant(slot, subscriptionId, options, channel, now));
            }
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Ends {@code lease} if it is still the holder and hands the subscription to the next live waiter.
     *
     * @return true if {@code lease} was the current holder
     */
    public boolean release(final ConnectionLease lease, final CloseReason reason, final String message, final String newNode) {
        final Slot slot = slots.get(lease.getSubscriptionId());
        if (slot == null) {
            lease.close(reason, message, newNode, true);
            return false;
        }
        slot.lock.lock();
        try {
            if (slot.lease != lease) {
                lease.close(reason, message, newNode, true);
                return false;
            }
            end(slot, lease, reason, message, newNode, true);
            if (reason.endsSubscription()) {
                failWaiters(slot, reason, message, newNode);
            } else {
                grantNext(slot, clock.millis());
            }
            return true;
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Client-requested close. With {@code force} the current holder is released whoever it is and its
     * connection id is barred from reopening; otherwise only {@code connectionId}'s own lease or queue
     * entry is dropped.
     */
    public boolean close(final long subscriptionId, final String connectionId, final boolean force) {
        final Slot slot = slots.get(subscriptionId);
        if (slot == null) return false;
        slot.lock.lock();
        try {
            final ConnectionLease current = slot.lease;
            if (force) {
                if (current == null) return false;
                remember(slot, current.getConnectionId());
                end(slot, current, CloseReason.FORCIBLY_RELEASED,
                        "connection " + current.getConnectionId() + " was forcibly released", null, true);
                grantNext(slot, clock.millis());
                return true;
            }

            boolean changed = removeWaiter(slot, connectionId);
            if (current != null && current.getConnectionId().equals(connectionId)) {
                end(slot, current, CloseReason.CLIENT_CLOSED, "closed by client", null, false);
                grantNext(slot, clock.millis());
                changed = true;
            }
            return changed;
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Ends the lease and every queued request, e.g. after a move, disable or delete.
     */
    public void evict(final long subscriptionId, final CloseReason reason, final String message, final String newNode) {
        final Slot slot = slots.get(subscriptionId);
        if (slot == null) return;
        slot.lock.lock();
        try {
            if (slot.lease != null) {
                end(slot, slot.lease, reason, message, newNode, true);
            }
            failWaiters(slot, reason, message, newNode);
            if (reason == CloseReason.DELETED) {
                slot.forciblyReleased.clear();
                slots.remove(subscriptionId, slot);
            }
        } finally {
            slot.lock.unlock();
        }
    }

    /** Drops every lease and queue entry bound to a stream that went away. */
    public void channelClosed(final SubscriptionChannel channel) {
        for (final Slot slot : slots.values()) {
            slot.lock.lock();
            try {
                slot.waiters.removeIf(w -> {
                    if (w.channel() != channel) return false;
                    w.grant().completeExceptionally(
                            SubscriptionException.fromReason(CloseReason.CLIENT_CLOSED, "stream closed", null));
                    return true;
                });
                final ConnectionLease current = slot.lease;
                if (current != null && current.getChannel() == channel) {
                    end(slot, current, CloseReason.CLIENT_CLOSED, "stream closed", null, false);
                    grantNext(slot, clock.millis());
                }
            } finally {
                slot.lock.unlock();
            }
        }
    }

    /** Records client activity. Returns false if {@code connectionId} does not hold the lease. */
    public boolean touch(final long subscriptionId, final String connectionId) {
        final ConnectionLease lease = current(subscriptionId).orElse(null);
        if (lease == null || !lease.getConnectionId().equals(connectionId)) return false;
        lease.touch(clock.millis());
        return true;
    }

    public Optional<ConnectionLease> current(final long subscriptionId) {
        final Slot slot = slots.get(subscriptionId);
        return slot == null ? Optional.empty() : Optional.ofNullable(slot.lease);
    }

    public boolean isCurrent(final ConnectionLease lease) {
        final Slot slot = slots.get(lease.getSubscriptionId());
        return slot != null && slot.lease == lease && !lease.isClosed();
    }

    /** Connection ids of queued requests, head first. */
    public List<String> queued(final long subscriptionId) {
        final Slot slot = slots.get(subscriptionId);
        if (slot == null) return List.of();
        slot.lock.lock();
        try {
            return slot.waiters.stream().map(w -> w.options().getConnectionId()).toList();
        } finally {
            slot.lock.unlock();
        }
    }

    /** Ends everything; used on shutdown. */
    public void closeAll(final CloseReason reason) {
        for (final Long id : List.copyOf(slots.keySet())) {
            evict(id, reason, "node is shutting down", null);
        }
    }

    private AdmissionResult inUse(final long subscriptionId, final ConnectionLease current) {
        return AdmissionResult.rejected(CloseReason.IN_USE,
                "subscription " + subscriptionId + " is in use by connection " + current.getConnectionId()
                        + " (" + current.strategy() + ")");
    }

    private ConnectionLease grant(final Slot slot,
                                  final long subscriptionId,
                                  final SubscriptionConnectionOptions options,
                                  final SubscriptionChannel channel,
                                  final long now) {
        final ConnectionLease lease = new ConnectionLease(subscriptionId, options, channel, now);
        slot.lease = lease;
        log.info("Subscription {} opened by connection {} ({})", subscriptionId, lease.getConnectionId(), lease.strategy());
        notifyOpened(lease);
        return lease;
    }

    private void grantNext(final Slot slot, final long now) {
        while (slot.lease == null && !slot.waiters.isEmpty()) {
            final Waiter w = slot.waiters.pollFirst();
            if (w.grant().isDone() || !w.channel().isOpen()) continue;
            final ConnectionLease lease = new ConnectionLease(slot.subscriptionId, w.options(), w.channel(), now);
            slot.lease = lease;
            log.info("Subscription {} granted to queued connection {}", lease.getSubscriptionId(), lease.getConnectionId());
            notifyOpened(lease);
            w.grant().complete(lease);
        }
    }

    private void end(final Slot slot,
                     final ConnectionLease lease,
                     final CloseReason reason,
                     final String message,
                     final String newNode,
                     final boolean notifyClient) {
        if (slot.lease == lease) slot.lease = null;
        if (lease.close(reason, message, newNode, notifyClient)) {
            log.info("Subscription {} released by connection {}: {}", lease.getSubscriptionId(), lease.getConnectionId(), reason);
            try {
                listener.onReleased(lease, reason);
            } catch (final RuntimeException e) {
                log.error("Lease listener failed on release of {}", lease, e);
            }
        }
    }

    private void notifyOpened(final ConnectionLease lease) {
        try {
            listener.onOpened(lease);
        } catch (final RuntimeException e) {
            log.error("Lease listener failed on open of {}", lease, e);
        }
    }

    private void failWaiters(final Slot slot, final CloseReason reason, final String message, final String newNode) {
        Waiter w;
        while ((w = slot.waiters.pollFirst()) != null) {
            w.grant().completeExceptionally(SubscriptionException.fromReason(reason, message, newNode));
        }
    }

    private static boolean removeWaiter(final Slot slot, final String connectionId) {
        final Iterator<Waiter> it = slot.waiters.iterator();
        while (it.hasNext()) {
            final Waiter w = it.next();
            if (w.options().getConnectionId().equals(connectionId)) {
                it.remove();
                w.grant().completeExceptionally(
                        SubscriptionException.fromReason(CloseReason.CLIENT_CLOSED, "closed by client", null));
                return true;
            }
        }
        return false;
    }

    private static void remember(final Slot slot, final String connectionId) {
        slot.forciblyReleased.remove(connectionId);
        slot.forciblyReleased.add(connectionId);
        while (slot.forciblyReleased.size() > FORCIBLY_RELEASED_CAPACITY) {
            final Iterator<String> it = slot.forciblyReleased.iterator();
            it.next();
            it.remove();
        }
    }

    private Slot slot(final long subscriptionId) {
        return slots.computeIfAbsent(subscriptionId, Slot::new);
    }

    private static final class Slot {
        final long subscriptionId;
        final ReentrantLock lock = new ReentrantLock();
        final Deque<Waiter> waiters = new ArrayDeque<>();
        final LinkedHashSet<String> forciblyReleased = new LinkedHashSet<>();
        volatile ConnectionLease lease;

        Slot(final long subscriptionId) {
            this.subscriptionId = subscriptionId;
        }
    }

    private record Waiter(SubscriptionConnectionOptions options,
                          SubscriptionChannel channel,
                          CompletableFuture<ConnectionLease> grant) {
    }
}
