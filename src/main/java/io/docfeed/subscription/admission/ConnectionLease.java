package io.docfeed.subscription.admission;

import io.docfeed.core.cancel.CancellationToken;
import io.docfeed.subscription.channel.SubscriptionChannel;
import io.docfeed.subscription.delivery.ProducerState;
import io.docfeed.subscription.model.CloseReason;
import io.docfeed.subscription.model.SubscriptionConnectionOptions;
import io.docfeed.subscription.model.SubscriptionOpeningStrategy;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The connection that currently owns delivery rights for a subscription on this node. Never persisted.
 */
@Slf4j
@Getter
public final class ConnectionLease {

    private final long subscriptionId;
    private final String connectionId;
    private final SubscriptionConnectionOptions options;
    private final SubscriptionChannel channel;
    private final CancellationToken token = CancellationToken.create();
    private final long grantedAtMillis;

    private volatile long lastActivityMillis;
    private volatile long lastBatchSentMillis;
    @Setter
    private volatile ProducerState state = ProducerState.IDLE;
    private volatile CloseReason closeReason;

    @Getter(AccessLevel.NONE)
    private final AtomicBoolean closed = new AtomicBoolean(false);

    ConnectionLease(final long subscriptionId,
                    final SubscriptionConnectionOptions options,
                    final SubscriptionChannel channel,
                    final long nowMillis) {
        this.subscriptionId = subscriptionId;
        this.connectionId = options.getConnectionId();
        this.options = options;
        this.channel = channel;
        this.grantedAtMillis = nowMillis;
        this.lastActivityMillis = nowMillis;
    }

    public SubscriptionOpeningStrategy strategy() {
        return options.getStrategy();
    }

    public void touch(final long nowMillis) {
        lastActivityMillis = nowMillis;
    }

    public void batchSent(final long nowMillis) {
        lastBatchSentMillis = nowMillis;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Dead when the last batch went unacknowledged past the ack timeout and the client has been silent
     * for three alive intervals.
     */
    boolean isStale(final long nowMillis) {
        final long sent = lastBatchSentMillis;
        return sent > 0
                && nowMillis - sent > options.getAcknowledgmentTimeout().toMillis()
                && nowMillis - lastActivityMillis > 3 * options.getClientAliveNotificationInterval().toMillis();
    }

    /**
     * Cancels the lease's worker and, if requested, signals the client.
     *
     * @return false if the lease was already closed
     */
    boolean close(final CloseReason reason, final String message, final String newNode, final boolean notifyClient) {
        if (!closed.compareAndSet(false, true)) return false;
        closeReason = reason;
        token.cancel(reason);
        if (notifyClient && channel.isOpen()) {
            try {
                channel.sendClosed(subscriptionId, connectionId, reason, message, newNode);
            } catch (final RuntimeException e) {
                log.debug("Could not signal close to {} on subscription {}: {}", connectionId, subscriptionId, e.toString());
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "lease[" + subscriptionId + "/" + connectionId + " " + options.getStrategy() + "]";
    }
}
