package io.docfeed.subscription.exception;

import io.docfeed.subscription.model.CloseReason;

/** No live node of the replica group can serve the subscription right now. */
public final class SubscriptionUnavailableException extends SubscriptionException {
    public SubscriptionUnavailableException(final String message) {
        super(CloseReason.UNAVAILABLE, message);
    }
}
