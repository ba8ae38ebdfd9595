package io.docfeed.subscription.model;

/**
 * Why a connection was rejected or its lease ended. Sent to clients in {@code SubscriptionClosed} frames.
 */
public enum CloseReason {
    IN_USE,
    SUPERSEDED,
    NOT_FOUND,
    DISABLED,
    UNAVAILABLE,
    MOVED,
    FORCIBLY_RELEASED,
    ACK_TIMEOUT,
    SUBSCRIBER_ERROR,
    COMMIT_FAILED,
    CLIENT_CLOSED,
    DELETED,
    SHUTDOWN,
    INVALID_REQUEST;

    /** Another connection holds the lease. */
    public boolean isAdmissionConflict() {
        return this == IN_USE || this == SUPERSEDED;
    }

    /** Client may reconnect after this reason, possibly after waiting. */
    public boolean isRetryable() {
        return switch (this) {
            case NOT_FOUND, DISABLED, FORCIBLY_RELEASED, SUBSCRIBER_ERROR, DELETED, INVALID_REQUEST -> false;
            default -> true;
        };
    }

    /** Queued waiters cannot be granted after the lease ends for this reason. */
    public boolean endsSubscription() {
        return switch (this) {
            case NOT_FOUND, DISABLED, UNAVAILABLE, MOVED, DELETED, SHUTDOWN -> true;
            default -> false;
        };
    }
}
