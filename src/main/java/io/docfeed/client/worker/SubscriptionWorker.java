package io.docfeed.client.worker;

import io.docfeed.api.SubscriptionApi;
import io.docfeed.client.DocFeedClient;
import io.docfeed.client.StreamListener;
import io.docfeed.core.cancel.CancellationToken;
import io.docfeed.core.etag.Etag;
import io.docfeed.subscription.exception.CommitFailedException;
import io.docfeed.subscription.exception.SubscriptionClosedException;
import io.docfeed.subscription.exception.SubscriptionException;
import io.docfeed.subscription.model.CloseReason;
import io.docfeed.subscription.model.ModelProtos;
import io.docfeed.subscription.model.SubscriptionConnectionOptions;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Client-side consumer loop for one subscription: discover the responsible node, open with the configured
 * strategy, run every handler on every document in order, acknowledge, and reconnect according to the
 * close reason.
 * <p>
 * Admission conflicts and {@link CloseReason#UNAVAILABLE} are retried indefinitely after
 * {@code timeToWaitBeforeConnectionRetry}; {@link CloseReason#MOVED} re-resolves at once; non-retryable
 * reasons end the worker; anything else counts towards {@code maxConsecutiveFailures}, reset by every
 * acknowledged batch.
 */
@Slf4j
public final class SubscriptionWorker implements AutoCloseable {

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final SubscriptionApi.Envelope CANCELLED =
            SubscriptionApi.Envelope.newBuilder().setCorrelationId(-2L).build();
    private static final SubscriptionApi.Envelope DISCONNECTED =
            SubscriptionApi.Envelope.newBuilder().setCorrelationId(-1L).build();

    @Getter
    private final long subscriptionId;
    @Getter
    private final SubscriptionConnectionOptions options;
    private final List<InetSocketAddress> seeds;
    private final ClientConnector connector;
    private final List<SubscriptionHandler> handlers;
    private final SubscriptionWorkerListener listener;

    private final CancellationToken token = CancellationToken.create();
    private final CompletableFuture<Void> stopped = new CompletableFuture<>();
    private final CompletableFuture<Void> completion = new CompletableFuture<>();
    @Getter
    private volatile int consecutiveFailures;
    private Thread thread;

    @Builder
    private SubscriptionWorker(final long subscriptionId,
                               final SubscriptionConnectionOptions options,
                               @Singular final List<InetSocketAddress> seeds,
                               final ClientConnector connector,
                               @Singular final List<SubscriptionHandler> handlers,
                               final SubscriptionWorkerListener listener) {
        if (seeds.isEmpty()) throw new IllegalArgumentException("at least one seed node is required");
        if (handlers.isEmpty()) throw new IllegalArgumentException("at least one handler is required");
        this.subscriptionId = subscriptionId;
        this.options = options == null ? SubscriptionConnectionOptions.defaults() : options;
        this.options.validate();
        this.seeds = List.copyOf(seeds);
        this.connector = connector == null ? ClientConnector.netty() : connector;
        this.handlers = List.copyOf(handlers);
        this.listener = listener == null ? SubscriptionWorkerListener.NONE : listener;
        token.onCancel(() -> stopped.complete(null));
    }

    /**
     * Starts the worker thread. The returned future completes when the worker is closed, or exceptionally
     * with a {@link SubscriptionException} when it gives up.
     */
    public synchronized CompletableFuture<Void> start() {
        if (thread != null) return completion;
        thread = new Thread(this::runLoop, "subscription-client-" + subscriptionId);
        thread.setDaemon(true);
        thread.start();
        return completion;
    }

    private void runLoop() {
        try {
            while (!token.isCancelled()) {
                try {
                    final InetSocketAddress node = resolve();
                    session(node);
                } catch (final SubscriptionException e) {
                    if (token.isCancelled()) break;
                    if (!retry(e)) return;
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (final Exception e) {
                    if (token.isCancelled()) break;
                    if (!retry(new SubscriptionClosedException(CloseReason.UNAVAILABLE, "connection failed: " + e, e), true)) {
                        return;
                    }
                }
            }
            completion.complete(null);
        } catch (final RuntimeException e) {
            log.error("Subscription worker {} failed", subscriptionId, e);
            completion.completeExceptionally(e);
        }
    }

    private boolean retry(final SubscriptionException e) {
        return retry(e, false);
    }

    /**
     * @param transport the failure was a connection problem rather than a server close signal
     * @return false if the worker has ended
     */
    private boolean retry(final SubscriptionException e, final boolean transport) {
        final CloseReason reason = e.getReason();
        if (!transport && reason == CloseReason.MOVED) {
            log.info("Subscription {} moved: {}", subscriptionId, e.getMessage());
            listener.onConnectionRetry(e);
            return true;
        }
        if (!transport && !reason.isRetryable()) {
            log.warn("Subscription {} worker stopping: {} ({})", subscriptionId, reason, e.getMessage());
            completion.completeExceptionally(e);
            return false;
        }
        if (transport || !(reason.isAdmissionConflict() || reason == CloseReason.UNAVAILABLE)) {
            consecutiveFailures++;
            if (consecutiveFailures >= options.getMaxConsecutiveFailures()) {
                log.warn("Subscription {} worker giving up after {} consecutive failures", subscriptionId, consecutiveFailures);
                completion.completeExceptionally(new SubscriptionClosedException(reason,
                        "gave up after " + consecutiveFailures + " consecutive failures: " + e.getMessage(), e));
                return false;
            }
        }
        log.info("Subscription {} will reconnect in {}: {} ({})",
                subscriptionId, options.getTimeToWaitBeforeConnectionRetry(), reason, e.getMessage());
        listener.onConnectionRetry(e);
        pause(options.getTimeToWaitBeforeConnectionRetry());
        return true;
    }

    /**
     * Asks the seeds which node serves the subscription.
     *
     * @throws IOException if no seed could be reached
     */
    private InetSocketAddress resolve() throws InterruptedException, IOException {
        Exception last = null;
        for (final InetSocketAddress seed : seeds) {
            try (final DocFeedClient client = connector.connect(seed)) {
                final SubscriptionApi.TopologyReply t = await(client.topology(subscriptionId), REQUEST_TIMEOUT);
                if (t.getHost().isEmpty()) return seed;
                log.debug("Subscription {} is served by {} at {}:{}", subscriptionId, t.getNodeTag(), t.getHost(), t.getPort());
                return InetSocketAddress.createUnresolved(t.getHost(), t.getPort());
            } catch (final SubscriptionException e) {
                throw e;
            } catch (final InterruptedException e) {
                throw e;
            } catch (final Exception e) {
                log.debug("Seed {} did not answer: {}", seed, e.toString());
                last = e;
            }
        }
        throw new IOException("no seed node answered", last);
    }

    private void session(final InetSocketAddress node) throws InterruptedException {
        final BlockingQueue<SubscriptionApi.Envelope> inbox = new LinkedBlockingQueue<>();
        try (final DocFeedClient client = connector.connect(node);
             final CancellationToken.Registration ignored = token.onCancel(() -> inbox.add(CANCELLED))) {
            client.setStreamListener(new StreamListener() {
                @Override
                public void onPush(final SubscriptionApi.Envelope envelope) {
                    inbox.add(envelope);
                }

                @Override
                public void onDisconnected(final Throwable cause) {
                    inbox.add(DISCONNECTED);
                }
            });

            final String connectionId = options.getConnectionId();
            final SubscriptionApi.OpenReply opened = await(client.open(subscriptionId, options), REQUEST_TIMEOUT);
            boolean granted = opened.getStatus() == SubscriptionApi.OpenReply.Status.ACCEPTED;
            log.info("Subscription {} {} on {} as {}", subscriptionId, granted ? "opened" : "queued", node, connectionId);

            final List<ReceivedDocument> batch = new ArrayList<>();
            // ALIVE is due once per interval whatever else arrives
            final long aliveNanos = options.getClientAliveNotificationInterval().toNanos();
            long lastAlive = System.nanoTime();
            while (true) {
                final long untilAlive = aliveNanos - (System.nanoTime() - lastAlive);
                final SubscriptionApi.Envelope e = inbox.poll(Math.max(0L, untilAlive), TimeUnit.NANOSECONDS);
                if (System.nanoTime() - lastAlive >= aliveNanos) {
                    if (granted && client.isOpen()) client.alive(subscriptionId, connectionId);
                    lastAlive = System.nanoTime();
                }
                if (e == null) continue;
                if (e == CANCELLED) {
                    closeQuietly(client, connectionId);
                    return;
                }
                if (e == DISCONNECTED) {
                    throw new SubscriptionClosedException(CloseReason.CLIENT_CLOSED, "connection to " + node + " lost");
                }
                switch (e.getKindCase()) {
                    case OPEN_REPLY -> granted = true;
                    case DOCUMENT -> batch.add(ReceivedDocument.fromProto(e.getDocument()));
                    case END_OF_BATCH -> {
                        process(client, connectionId, batch, Etag.of(e.getEndOfBatch().getLastEtag()));
                        batch.clear();
                    }
                    case HEARTBEAT -> log.trace("Heartbeat on subscription {}", subscriptionId);
                    case SUBSCRIPTION_CLOSED -> {
                        final SubscriptionApi.SubscriptionClosed c = e.getSubscriptionClosed();
                        throw SubscriptionException.fromReason(ModelProtos.fromProto(c.getReason()), c.getMessage(),
                                c.getNewNode().isEmpty() ? null : c.getNewNode());
                    }
                    default -> log.debug("Ignoring {} push on subscription {}", e.getKindCase(), subscriptionId);
                }
            }
        }
    }

    private void process(final DocFeedClient client,
                         final String connectionId,
                         final List<ReceivedDocument> batch,
                         final Etag lastEtag) throws InterruptedException {
        listener.beforeBatch(batch.size());
        for (final ReceivedDocument doc : batch) {
            for (final SubscriptionHandler handler : handlers) {
                final HandlerResult r = invoke(handler, doc);
                if (r.ok()) continue;
                client.reportFault(subscriptionId, connectionId, "document " + doc.id() + ": " + r.error());
                if (options.isIgnoreSubscribersErrors()) {
                    log.warn("Handler failed on {} (subscription {}), continuing: {}", doc.id(), subscriptionId, r.error());
                    continue;
                }
                throw new SubscriptionClosedException(CloseReason.SUBSCRIBER_ERROR,
                        "handler failed on document " + doc.id() + ": " + r.error(), r.cause());
            }
        }
        listener.afterBatch(batch.size());

        final SubscriptionApi.AckReply ack = await(client.acknowledge(subscriptionId, connectionId, lastEtag), REQUEST_TIMEOUT);
        if (!ack.getCommitted()) {
            throw new CommitFailedException("acknowledgment of " + lastEtag + " not committed: " + ack.getError(), null);
        }
        consecutiveFailures = 0;
        listener.afterAcknowledgment(lastEtag);
    }

    private static HandlerResult invoke(final SubscriptionHandler handler, final ReceivedDocument doc) {
        try {
            final HandlerResult r = handler.handle(doc);
            return r == null ? HandlerResult.OK : r;
        } catch (final RuntimeException e) {
            return HandlerResult.failed(e);
        }
    }

    private <T> T await(final CompletableFuture<T> future, final Duration timeout) throws InterruptedException {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final ExecutionException e) {
            if (e.getCause() instanceof final SubscriptionException se) throw se;
            throw new SubscriptionClosedException(CloseReason.CLIENT_CLOSED, "request failed: " + e.getCause(), e.getCause());
        } catch (final TimeoutException e) {
            throw new SubscriptionClosedException(CloseReason.CLIENT_CLOSED, "no reply within " + timeout, e);
        }
    }

    private void closeQuietly(final DocFeedClient client, final String connectionId) {
        if (!client.isOpen()) return;
        try {
            client.close(subscriptionId, connectionId, false).get(2, TimeUnit.SECONDS);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (final ExecutionException | TimeoutException e) {
            log.debug("CLOSE of subscription {} not confirmed: {}", subscriptionId, e.toString());
        }
    }

    private void pause(final Duration d) {
        try {
            stopped.get(d.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final TimeoutException e) {
            log.trace("Retry wait of {} elapsed", d);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel("interrupted");
        } catch (final ExecutionException e) {
            throw new IllegalStateException(e);
        }
    }

    /** Stops the loop and closes the current connection. */
    @Override
    public void close() {
        token.cancel("closed");
        final Thread t;
        synchronized (this) {
            t = thread;
        }
        if (t != null && t != Thread.currentThread()) {
            try {
                t.join(TimeUnit.SECONDS.toMillis(5));
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        completion.complete(null);
    }
}
