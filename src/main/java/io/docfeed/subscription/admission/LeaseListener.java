package io.docfeed.subscription.admission;

import io.docfeed.subscription.model.CloseReason;

/** Callbacks fired while the subscription's slot is locked; implementations must not block. */
public interface LeaseListener {

    default void onOpened(final ConnectionLease lease) {
    }

    default void onReleased(final ConnectionLease lease, final CloseReason reason) {
    }
}
