package io.docfeed.subscription.model;

/**
 * How a connection competes for a subscription lease that may already be held.
 */
public enum SubscriptionOpeningStrategy {
    /** Accepted only when no lease exists. */
    OPEN_IF_FREE,
    /** Queued FIFO behind the holder, granted on release. */
    WAIT_FOR_FREE,
    /** Preempts any holder except one using {@link #FORCE_AND_KEEP}. */
    TAKE_OVER,
    /** Preempts any holder; only another {@code FORCE_AND_KEEP} can preempt it. */
    FORCE_AND_KEEP;

    public boolean canPreempt(final SubscriptionOpeningStrategy holder) {
        return switch (this) {
            case FORCE_AND_KEEP -> true;
            case TAKE_OVER -> holder != FORCE_AND_KEEP;
            default -> false;
        };
    }
}
