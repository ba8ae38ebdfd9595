package io.docfeed.subscription.ack;

import io.docfeed.core.etag.Etag;
import io.docfeed.subscription.admission.ConnectionLease;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.concurrent.CompletableFuture;

/**
 * The batch in flight for a lease: the position it advances the checkpoint to once acknowledged.
 */
@Getter
public final class PendingAck {

    private final ConnectionLease lease;
    private final Etag batchEnd;
    private final int documentCount;
    private final long sentAtMillis;

    @Getter(AccessLevel.PACKAGE)
    private final CompletableFuture<AckOutcome> outcome = new CompletableFuture<>();
    @Getter(AccessLevel.PACKAGE)
    private final CompletableFuture<AckResult> reply = new CompletableFuture<>();
    private volatile String faultMessage;

    PendingAck(final ConnectionLease lease, final Etag batchEnd, final int documentCount, final long sentAtMillis) {
        this.lease = lease;
        this.batchEnd = batchEnd;
        this.documentCount = documentCount;
        this.sentAtMillis = sentAtMillis;
    }

    boolean fault(final String message) {
        faultMessage = message;
        return outcome.complete(AckOutcome.FAULTED);
    }
}
