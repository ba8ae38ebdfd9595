package io.docfeed.subscription.exception;

import io.docfeed.subscription.model.CloseReason;
import lombok.Getter;

/**
 * Root of the subscription error taxonomy. Every failure carries the {@link CloseReason} that a client
 * would receive on the wire.
 */
@Getter
public class SubscriptionException extends RuntimeException {

    private final CloseReason reason;

    public SubscriptionException(final CloseReason reason, final String message) {
        super(message);
        this.reason = reason;
    }

    public SubscriptionException(final CloseReason reason, final String message, final Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    /**
     * Maps a wire-level close reason back to the matching exception type.
     */
    public static SubscriptionException fromReason(final CloseReason reason, final String message, final String newNode) {
        return switch (reason) {
            case IN_USE, SUPERSEDED -> new SubscriptionInUseException(reason, message);
            case NOT_FOUND, DELETED -> new SubscriptionDoesNotExistException(message);
            case DISABLED -> new SubscriptionDisabledException(message);
            case UNAVAILABLE -> new SubscriptionUnavailableException(message);
            case MOVED -> new SubscriptionMovedException(newNode, message);
            case COMMIT_FAILED -> new CommitFailedException(message, null);
            default -> new SubscriptionClosedException(reason, message);
        };
    }
}
