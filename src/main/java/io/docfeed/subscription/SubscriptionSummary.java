package io.docfeed.subscription;

import io.docfeed.cluster.metadata.SubscriptionState;
import io.docfeed.subscription.admission.ConnectionLease;
import io.docfeed.subscription.model.SubscriptionOpeningStrategy;

/**
 * One LIST entry: the replicated state plus the lease held on the answering node, if any.
 */
public record SubscriptionSummary(SubscriptionState state,
                                  boolean connected,
                                  String connectionId,
                                  SubscriptionOpeningStrategy strategy) {

    static SubscriptionSummary of(final SubscriptionState state, final ConnectionLease lease) {
        if (lease == null || lease.isClosed()) {
            return new SubscriptionSummary(state, false, null, null);
        }
        return new SubscriptionSummary(state, true, lease.getConnectionId(), lease.strategy());
    }
}
