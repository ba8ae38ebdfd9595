package io.docfeed.subscription;

import io.docfeed.subscription.model.CloseReason;

/**
 * Lifecycle notification published by {@link SubscriptionService}. {@code connectionId} is null for
 * {@link Type#DELETED}; {@code reason} is set only for {@link Type#RELEASED} and {@link Type#FAULTED}.
 */
public record SubscriptionEvent(Type type, long subscriptionId, String connectionId, CloseReason reason) {

    public enum Type { OPENED, RELEASED, DELETED, FAULTED }

    static SubscriptionEvent opened(final long subscriptionId, final String connectionId) {
        return new SubscriptionEvent(Type.OPENED, subscriptionId, connectionId, null);
    }

    static SubscriptionEvent released(final long subscriptionId, final String connectionId, final CloseReason reason) {
        return new SubscriptionEvent(Type.RELEASED, subscriptionId, connectionId, reason);
    }

    static SubscriptionEvent faulted(final long subscriptionId, final String connectionId) {
        return new SubscriptionEvent(Type.FAULTED, subscriptionId, connectionId, CloseReason.SUBSCRIBER_ERROR);
    }

    static SubscriptionEvent deleted(final long subscriptionId) {
        return new SubscriptionEvent(Type.DELETED, subscriptionId, null, null);
    }
}
