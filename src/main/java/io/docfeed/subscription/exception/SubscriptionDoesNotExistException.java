package io.docfeed.subscription.exception;

import io.docfeed.subscription.model.CloseReason;

public final class SubscriptionDoesNotExistException extends SubscriptionException {
    public SubscriptionDoesNotExistException(final String message) {
        super(CloseReason.NOT_FOUND, message);
    }
}
