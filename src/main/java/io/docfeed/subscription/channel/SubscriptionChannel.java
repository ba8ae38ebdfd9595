package io.docfeed.subscription.channel;

import io.docfeed.core.etag.Etag;
import io.docfeed.storage.StoredDocument;
import io.docfeed.subscription.model.CloseReason;

import java.util.concurrent.CompletableFuture;

/**
 * Server side of a client's duplex stream. Sends are ordered; the returned futures complete once the
 * frame has been handed to the network.
 */
public interface SubscriptionChannel {

    /** Stable identity for logs and connection-loss matching. */
    String id();

    CompletableFuture<Void> sendDocument(long subscriptionId, StoredDocument document);

    CompletableFuture<Void> sendEndOfBatch(long subscriptionId, Etag lastEtag, int count);

    CompletableFuture<Void> sendHeartbeat(long subscriptionId);

    /** Tells a queued connection that it now holds the lease. */
    void sendGranted(long subscriptionId, String connectionId);

    /** Out-of-band close signal; does not close the underlying stream. */
    void sendClosed(long subscriptionId, String connectionId, CloseReason reason, String message, String newNode);

    boolean isOpen();
}
