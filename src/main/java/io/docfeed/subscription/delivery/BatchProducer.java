package io.docfeed.subscription.delivery;

import io.docfeed.cluster.metadata.SubscriptionState;
import io.docfeed.core.cancel.CancellationToken;
import io.docfeed.core.cancel.WaitResult;
import io.docfeed.core.etag.Etag;
import io.docfeed.storage.ChangeNotifier;
import io.docfeed.storage.DocumentStore;
import io.docfeed.storage.StoredDocument;
import io.docfeed.subscription.ack.AckOutcome;
import io.docfeed.subscription.ack.AcknowledgmentTracker;
import io.docfeed.subscription.ack.PendingAck;
import io.docfeed.subscription.admission.AdmissionController;
import io.docfeed.subscription.admission.ConnectionLease;
import io.docfeed.subscription.channel.SubscriptionChannel;
import io.docfeed.subscription.criteria.CriteriaMatcher;
import io.docfeed.subscription.exception.SubscriptionException;
import io.docfeed.subscription.exception.SubscriptionMovedException;
import io.docfeed.subscription.model.CloseReason;
import io.docfeed.subscription.model.SubscriptionConnectionOptions;
import io.docfeed.subscription.store.CursorStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Batch loop serving one lease: scan after the checkpoint, filter, deliver, wait for the ack, commit, repeat.
 * Idles with heartbeats when nothing matches. Every blocking step observes the lease's cancellation token.
 */
@Slf4j
public final class BatchProducer implements Runnable {

    static final int SCAN_PAGE_SIZE = 1024;
    static final int MAX_PAGES_PER_PASS = 64;

    private final ConnectionLease lease;
    private final DocumentStore documents;
    private final CursorStore cursorStore;
    private final AcknowledgmentTracker tracker;
    private final AdmissionController admission;
    private final String nodeTag;
    private final Duration heartbeatInterval;
    private final Clock clock;

    public BatchProducer(final ConnectionLease lease,
                         final DocumentStore documents,
                         final CursorStore cursorStore,
                         final AcknowledgmentTracker tracker,
                         final AdmissionController admission,
                         final String nodeTag,
                         final Duration heartbeatInterval,
                         final Clock clock) {
        this.lease = lease;
        this.documents = documents;
        this.cursorStore = cursorStore;
        this.tracker = tracker;
        this.admission = admission;
        this.nodeTag = nodeTag;
        this.heartbeatInterval = heartbeatInterval;
        this.clock = clock;
    }

    @Override
    public void run() {
        final long id = lease.getSubscriptionId();
        final CancellationToken token = lease.getToken();
        try {
            final SubscriptionState state = cursorStore.require(id);
            final CriteriaMatcher matcher = new CriteriaMatcher(state.criteria());
            final String collection = state.criteria().collection();
            final ChangeNotifier.Subscription changes = documents.changes().subscribe(collection);

            recordConnection(id);
            Etag cursor = state.checkpoint();
            log.debug("Serving {} from {}", lease, cursor);

            while (!token.isCancelled()) {
                lease.setState(ProducerState.SCANNING);
                changes.arm();
                final Scan scan = scan(collection, cursor, matcher, token);
                if (token.isCancelled()) break;

                if (scan.documents().isEmpty()) {
                    if (scan.end().isAfter(cursor)) {
                        // nothing matched: advance without waiting for the client
                        cursorStore.acknowledge(id, scan.end(), nodeTag, 0L);
                        cursor = scan.end();
                        continue;
                    }
                    if (!idle(changes, token)) break;
                    continue;
                }

                lease.setState(ProducerState.DELIVERING);
                // registered before the end-of-batch frame so an immediate ack finds it
                final PendingAck pending = tracker.begin(lease, scan.end(), scan.documents().size());
                if (!deliver(scan, token)) {
                    tracker.discard(pending, "batch could not be delivered");
                    break;
                }
                lease.batchSent(clock.millis());

                lease.setState(ProducerState.AWAITING_ACK);
                final AckOutcome outcome = tracker.await(pending, lease.getOptions().getAcknowledgmentTimeout(), token);
                switch (outcome) {
                    case ACKNOWLEDGED -> {
                        tracker.commit(pending);
                        cursor = scan.end();
                    }
                    case FAULTED -> {
                        tracker.discard(pending, "subscriber error reported");
                        release(CloseReason.SUBSCRIBER_ERROR, pending.getFaultMessage(), null);
                        return;
                    }
                    case TIMED_OUT -> {
                        tracker.discard(pending, "acknowledgment timed out");
                        log.info("{} did not acknowledge {} documents within {}", lease,
                                pending.getDocumentCount(), lease.getOptions().getAcknowledgmentTimeout());
                        release(CloseReason.ACK_TIMEOUT, "no acknowledgment within "
                                + lease.getOptions().getAcknowledgmentTimeout(), null);
                        return;
                    }
                    case CANCELLED -> {
                        tracker.discard(pending, "lease closed");
                        return;
                    }
                }
            }
        } catch (final SubscriptionException e) {
            log.info("{} ended: {} ({})", lease, e.getReason(), e.getMessage());
            release(e.getReason(), e.getMessage(), e instanceof final SubscriptionMovedException m ? m.getNewNode() : null);
        } catch (final RuntimeException e) {
            log.error("Batch loop of {} failed", lease, e);
            release(CloseReason.UNAVAILABLE, "server error: " + e.getMessage(), null);
        } finally {
            lease.setState(ProducerState.CLOSED);
        }
    }

    /**
     * Reads forward from {@code from} until the batch is full or the head is reached. Non-matching documents
     * still move the scan position.
     */
    Scan scan(final String collection, final Etag from, final CriteriaMatcher matcher, final CancellationToken token) {
        final SubscriptionConnectionOptions options = lease.getOptions();
        final Long maxSize = options.getMaxSize();
        final List<StoredDocument> matched = new ArrayList<>();
        long bytes = 0L;
        Etag position = from;

        for (int page = 0; page < MAX_PAGES_PER_PASS && !token.isCancelled(); page++) {
            final List<StoredDocument> docs = documents.scanAfter(collection, position, SCAN_PAGE_SIZE);
            for (final StoredDocument doc : docs) {
                position = doc.etag();
                if (!matcher.matches(doc)) continue;
                matched.add(doc);
                bytes += doc.sizeInBytes();
                if (matched.size() >= options.getMaxDocCount() || (maxSize != null && bytes >= maxSize)) {
                    return new Scan(matched, position);
                }
            }
            if (docs.size() < SCAN_PAGE_SIZE) break;
        }
        return new Scan(matched, position);
    }

    private boolean idle(final ChangeNotifier.Subscription changes, final CancellationToken token) {
        lease.setState(ProducerState.IDLE);
        final long id = lease.getSubscriptionId();
        while (true) {
            final WaitResult r = changes.await(heartbeatInterval, token);
            if (r == WaitResult.SIGNALLED) return true;
            if (r == WaitResult.CANCELLED) return false;

            if (!assertClientAlive()) return false;
            if (!awaitSend(lease.getChannel().sendHeartbeat(id), heartbeatInterval, token)) {
                if (!token.isCancelled()) {
                    release(CloseReason.CLIENT_CLOSED, "heartbeat could not be sent", null);
                }
                return false;
            }
        }
    }

    private boolean assertClientAlive() {
        final SubscriptionChannel channel = lease.getChannel();
        if (!channel.isOpen()) {
            release(CloseReason.CLIENT_CLOSED, "stream closed", null);
            return false;
        }
        final long silentFor = clock.millis() - lease.getLastActivityMillis();
        final long limit = 3 * lease.getOptions().getClientAliveNotificationInterval().toMillis();
        if (silentFor > limit) {
            log.info("{} silent for {} ms, releasing", lease, silentFor);
            release(CloseReason.ACK_TIMEOUT, "client stopped sending alive notifications", null);
            return false;
        }
        return true;
    }

    private boolean deliver(final Scan scan, final CancellationToken token) {
        final long id = lease.getSubscriptionId();
        final SubscriptionChannel channel = lease.getChannel();
        for (final StoredDocument doc : scan.documents()) {
            channel.sendDocument(id, doc);
        }
        final CompletableFuture<Void> end = channel.sendEndOfBatch(id, scan.end(), scan.documents().size());
        if (awaitSend(end, lease.getOptions().getAcknowledgmentTimeout(), token)) {
            return true;
        }
        if (!token.isCancelled()) {
            release(CloseReason.CLIENT_CLOSED, "batch could not be delivered", null);
        }
        return false;
    }

    private static boolean awaitSend(final CompletableFuture<Void> send, final Duration timeout, final CancellationToken token) {
        final CompletableFuture<Void> cancelled = new CompletableFuture<>();
        try (final CancellationToken.Registration ignored = token.onCancel(() -> cancelled.complete(null))) {
            CompletableFuture.anyOf(send, cancelled).get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return send.isDone() && !send.isCompletedExceptionally();
        } catch (final TimeoutException | ExecutionException e) {
            log.debug("Send did not complete: {}", e.toString());
            return false;
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void recordConnection(final long id) {
        try {
            cursorStore.recordConnection(id);
        } catch (final SubscriptionException e) {
            if (e.getReason() != CloseReason.COMMIT_FAILED) throw e;
            log.warn("Could not record connection time of subscription {}: {}", id, e.getMessage());
        }
    }

    private void release(final CloseReason reason, final String message, final String newNode) {
        admission.release(lease, reason, message, newNode);
    }

    record Scan(List<StoredDocument> documents, Etag end) {
    }
}
