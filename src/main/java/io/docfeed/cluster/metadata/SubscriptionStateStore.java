package io.docfeed.cluster.metadata;

import java.util.List;
import java.util.Optional;

/**
 * Read side of the replicated subscription state. Mutations only happen by applying committed commands.
 */
public interface SubscriptionStateStore {

    Optional<SubscriptionState> current(long subscriptionId);

    Optional<SubscriptionState> byName(String name);

    /** Page of subscriptions ordered by id. */
    List<SubscriptionState> list(int start, int pageSize);

    List<SubscriptionState> all();

    void addListener(SubscriptionStateListener listener);
}
