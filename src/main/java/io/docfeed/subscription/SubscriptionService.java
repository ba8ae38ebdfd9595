package io.docfeed.subscription;

import io.docfeed.cluster.failover.ResponsibleNodeAssigner;
import io.docfeed.cluster.metadata.SubscriptionState;
import io.docfeed.cluster.metadata.SubscriptionStateListener;
import io.docfeed.core.etag.Etag;
import io.docfeed.storage.DocumentStore;
import io.docfeed.subscription.ack.AckResult;
import io.docfeed.subscription.ack.AcknowledgmentTracker;
import io.docfeed.subscription.admission.AdmissionController;
import io.docfeed.subscription.admission.AdmissionResult;
import io.docfeed.subscription.admission.ConnectionLease;
import io.docfeed.subscription.admission.LeaseListener;
import io.docfeed.subscription.channel.SubscriptionChannel;
import io.docfeed.subscription.delivery.BatchProducer;
import io.docfeed.subscription.exception.SubscriptionDoesNotExistException;
import io.docfeed.subscription.exception.SubscriptionException;
import io.docfeed.subscription.exception.SubscriptionUnavailableException;
import io.docfeed.subscription.model.CloseReason;
import io.docfeed.subscription.model.SubscriptionConnectionOptions;
import io.docfeed.subscription.model.SubscriptionCriteria;
import io.docfeed.subscription.store.CursorStore;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Node-local entry point of the subscription subsystem. Routes client operations to admission, delivery and
 * acknowledgment, runs one batch loop per active lease, and evicts local leases when the replicated state
 * says this node may no longer serve them.
 */
@Slf4j
public final class SubscriptionService implements AutoCloseable {

    public static final int MAX_PAGE_SIZE = 1024;

    @Getter
    private final String nodeTag;
    private final CursorStore cursorStore;
    private final DocumentStore documents;
    private final ResponsibleNodeAssigner assigner;
    private final Duration heartbeatInterval;
    private final Clock clock;
    @Getter
    private final AdmissionController admission;
    @Getter
    private final AcknowledgmentTracker tracker;
    private final List<SubscriptionEventListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicInteger workerIds = new AtomicInteger();
    private final ExecutorService workers = Executors.newCachedThreadPool(r -> {
        final Thread t = new Thread(r, "subscription-worker-" + workerIds.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public SubscriptionService(final String nodeTag,
                               final CursorStore cursorStore,
                               final DocumentStore documents,
                               final ResponsibleNodeAssigner assigner,
                               final Duration heartbeatInterval,
                               final Clock clock) {
        this.nodeTag = nodeTag;
        this.cursorStore = cursorStore;
        this.documents = documents;
        this.assigner = assigner;
        this.heartbeatInterval = heartbeatInterval;
        this.clock = clock;
        this.admission = new AdmissionController(cursorStore.getStates(), clock, new EventPublisher());
        this.tracker = new AcknowledgmentTracker(cursorStore, admission, nodeTag, clock);
        cursorStore.getStates().addListener(new StateWatcher());
    }

    public void addListener(final SubscriptionEventListener listener) {
        listeners.add(listener);
    }

    /** CREATE: registers the subscription and assigns its first responsible node. */
    public SubscriptionState create(final SubscriptionCriteria criteria, final String name, final String mentorNode) {
        final SubscriptionState state = cursorStore.create(criteria, name, mentorNode);
        log.info("Created subscription {} '{}' on {} from {}", state.id(), state.name(), criteria.collection(), state.checkpoint());
        try {
            assigner.assign(state.id());
        } catch (final SubscriptionException e) {
            log.warn("Subscription {} created without a responsible node: {}", state.id(), e.getMessage());
        }
        return cursorStore.get(state.id()).orElse(state);
    }

    /**
     * OPEN: admits the connection if this node is responsible for the subscription. An accepted lease starts
     * its batch loop immediately; a queued one starts when the grant completes.
     */
    public AdmissionResult open(final long subscriptionId,
                                final SubscriptionConnectionOptions options,
                                final SubscriptionChannel channel) {
        try {
            options.validate();
        } catch (final IllegalArgumentException e) {
            return AdmissionResult.rejected(CloseReason.INVALID_REQUEST, e.getMessage());
        }

        final String responsible;
        try {
            responsible = resolve(subscriptionId);
        } catch (final SubscriptionException e) {
            return AdmissionResult.rejected(e.getReason(), e.getMessage());
        }
        if (!nodeTag.equals(responsible)) {
            return AdmissionResult.rejected(CloseReason.MOVED,
                    "subscription " + subscriptionId + " is served by " + responsible, responsible);
        }

        final AdmissionResult result = admission.tryOpen(subscriptionId, options, channel);
        switch (result.getStatus()) {
            case ACCEPTED -> start(result.getLease());
            case QUEUED -> result.getGrant().thenAccept(lease -> {
                lease.getChannel().sendGranted(subscriptionId, lease.getConnectionId());
                start(lease);
            });
            case REJECTED -> log.debug("Open of subscription {} by {} rejected: {}",
                    subscriptionId, options.getConnectionId(), result.getReason());
        }
        return result;
    }

    public CompletableFuture<AckResult> acknowledge(final long subscriptionId, final String connectionId, final Etag etag) {
        return tracker.acknowledge(subscriptionId, connectionId, etag);
    }

    /** ALIVE: refreshes the holder's activity timestamp. */
    public boolean alive(final long subscriptionId, final String connectionId) {
        return admission.touch(subscriptionId, connectionId);
    }

    /** A client handler failed; published as {@link SubscriptionEvent.Type#FAULTED} when sent by the holder. */
    public void reportFault(final long subscriptionId, final String connectionId, final String message) {
        if (tracker.reportFault(subscriptionId, connectionId, message)) {
            publish(SubscriptionEvent.faulted(subscriptionId, connectionId));
        }
    }

    public boolean close(final long subscriptionId, final String connectionId, final boolean force) {
        return admission.close(subscriptionId, connectionId, force);
    }

    /** DELETE: the local lease is evicted once the deletion is applied. */
    public boolean delete(final long subscriptionId) {
        final boolean deleted = cursorStore.delete(subscriptionId);
        if (deleted) log.info("Deleted subscription {}", subscriptionId);
        return deleted;
    }

    public void setDisabled(final long subscriptionId, final boolean disabled) {
        cursorStore.require(subscriptionId);
        cursorStore.setDisabled(subscriptionId, disabled);
        log.info("Subscription {} {}", subscriptionId, disabled ? "disabled" : "enabled");
    }

    public List<SubscriptionSummary> list(final int start, final int pageSize) {
        final int size = pageSize <= 0 ? MAX_PAGE_SIZE : Math.min(pageSize, MAX_PAGE_SIZE);
        return cursorStore.list(Math.max(0, start), size).stream()
                .map(s -> SubscriptionSummary.of(s, admission.current(s.id()).orElse(null)))
                .toList();
    }

    /**
     * The node that serves {@code subscriptionId}, assigning one if the subscription has none.
     *
     * @throws SubscriptionDoesNotExistException if the subscription does not exist
     * @throws SubscriptionUnavailableException  if no member of the replica group is live
     */
    public String resolve(final long subscriptionId) {
        final SubscriptionState state = cursorStore.require(subscriptionId);
        String responsible = state.responsibleNode();
        if (responsible == null || !assigner.topology().isLive(responsible)) {
            responsible = assigner.assign(subscriptionId);
        }
        if (responsible == null) {
            throw new SubscriptionUnavailableException("no live node can serve subscription " + subscriptionId);
        }
        return responsible;
    }

    public Optional<ConnectionLease> lease(final long subscriptionId) {
        return admission.current(subscriptionId);
    }

    /** The transport lost a stream: drop its leases and queue entries. */
    public void channelClosed(final SubscriptionChannel channel) {
        admission.channelClosed(channel);
    }

    private void start(final ConnectionLease lease) {
        try {
            workers.execute(new BatchProducer(lease, documents, cursorStore, tracker, admission, nodeTag, heartbeatInterval, clock));
        } catch (final RejectedExecutionException e) {
            admission.release(lease, CloseReason.SHUTDOWN, "node is shutting down", null);
        }
    }

    private void publish(final SubscriptionEvent event) {
        for (final SubscriptionEventListener l : listeners) {
            try {
                l.onEvent(event);
            } catch (final RuntimeException e) {
                log.error("Subscription listener failed on {}", event, e);
            }
        }
    }

    @Override
    public void close() {
        admission.closeAll(CloseReason.SHUTDOWN);
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    private final class EventPublisher implements LeaseListener {
        @Override
        public void onOpened(final ConnectionLease lease) {
            publish(SubscriptionEvent.opened(lease.getSubscriptionId(), lease.getConnectionId()));
        }

        @Override
        public void onReleased(final ConnectionLease lease, final CloseReason reason) {
            publish(SubscriptionEvent.released(lease.getSubscriptionId(), lease.getConnectionId(), reason));
        }
    }

    /** Evicts local leases when the applied state no longer lets this node serve them. */
    private final class StateWatcher implements SubscriptionStateListener {
        @Override
        public void onStateChanged(final SubscriptionState before, final SubscriptionState after) {
            if (after == null) {
                if (before == null) return;
                admission.evict(before.id(), CloseReason.DELETED, "subscription " + before.id() + " was deleted", null);
                publish(SubscriptionEvent.deleted(before.id()));
                return;
            }
            if (after.disabled() && (before == null || !before.disabled())) {
                admission.evict(after.id(), CloseReason.DISABLED, "subscription " + after.id() + " was disabled", null);
                return;
            }
            if (before != null
                    && !Objects.equals(before.responsibleNode(), after.responsibleNode())
                    && !nodeTag.equals(after.responsibleNode())) {
                final String target = after.responsibleNode();
                if (target == null) {
                    admission.evict(after.id(), CloseReason.UNAVAILABLE,
                            "no live node can serve subscription " + after.id(), null);
                } else {
                    admission.evict(after.id(), CloseReason.MOVED,
                            "subscription " + after.id() + " moved to " + target, target);
                }
            }
        }
    }
}
