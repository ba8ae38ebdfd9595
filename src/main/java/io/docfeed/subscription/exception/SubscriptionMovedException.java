package io.docfeed.subscription.exception;

import io.docfeed.subscription.model.CloseReason;
import lombok.Getter;

/** The subscription is now served by {@link #getNewNode()}. */
@Getter
public final class SubscriptionMovedException extends SubscriptionException {

    private final String newNode;

    public SubscriptionMovedException(final String newNode, final String message) {
        super(CloseReason.MOVED, message);
        this.newNode = newNode == null || newNode.isEmpty() ? null : newNode;
    }
}
