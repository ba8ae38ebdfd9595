package io.docfeed.subscription.exception;

import io.docfeed.subscription.model.CloseReason;

public final class SubscriptionDisabledException extends SubscriptionException {
    public SubscriptionDisabledException(final String message) {
        super(CloseReason.DISABLED, message);
    }
}
