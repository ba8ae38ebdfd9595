package io.docfeed.cluster.metadata;

/**
 * Notified on the applier thread after each committed change. {@code before} is null for creations,
 * {@code after} is null for deletions.
 */
@FunctionalInterface
public interface SubscriptionStateListener {
    void onStateChanged(SubscriptionState before, SubscriptionState after);
}
