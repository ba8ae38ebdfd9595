package io.docfeed.subscription.admission;

import io.docfeed.subscription.model.CloseReason;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.concurrent.CompletableFuture;

/**
 * Outcome of {@link AdmissionController#tryOpen}: accepted with a lease, queued with a future grant,
 * or rejected with a reason.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class AdmissionResult {

    public enum Status { ACCEPTED, QUEUED, REJECTED }

    private final Status status;
    private final ConnectionLease lease;
    private final CompletableFuture<ConnectionLease> grant;
    private final CloseReason reason;
    private final String message;
    private final String newNode;

    static AdmissionResult accepted(final ConnectionLease lease) {
        return new AdmissionResult(Status.ACCEPTED, lease, null, null, null, null);
    }

    static AdmissionResult queued(final CompletableFuture<ConnectionLease> grant) {
        return new AdmissionResult(Status.QUEUED, null, grant, null, null, null);
    }

    public static AdmissionResult rejected(final CloseReason reason, final String message) {
        return rejected(reason, message, null);
    }

    public static AdmissionResult rejected(final CloseReason reason, final String message, final String newNode) {
        return new AdmissionResult(Status.REJECTED, null, null, reason, message, newNode);
    }
}
