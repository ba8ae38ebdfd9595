package io.docfeed.subscription.exception;

import io.docfeed.subscription.model.CloseReason;

/** The lease ended for a reason other than admission or topology. */
public final class SubscriptionClosedException extends SubscriptionException {
    public SubscriptionClosedException(final CloseReason reason, final String message) {
        super(reason, message);
    }

    public SubscriptionClosedException(final CloseReason reason, final String message, final Throwable cause) {
        super(reason, message, cause);
    }
}
