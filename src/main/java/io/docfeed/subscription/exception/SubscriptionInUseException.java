package io.docfeed.subscription.exception;

import io.docfeed.subscription.model.CloseReason;

/** Another connection holds, or has just taken, the lease. */
public final class SubscriptionInUseException extends SubscriptionException {
    public SubscriptionInUseException(final CloseReason reason, final String message) {
        super(reason, message);
    }
}
