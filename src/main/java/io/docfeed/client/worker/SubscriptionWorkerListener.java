package io.docfeed.client.worker;

import io.docfeed.core.etag.Etag;

/** Optional lifecycle hooks, called on the worker thread. */
public interface SubscriptionWorkerListener {

    SubscriptionWorkerListener NONE = new SubscriptionWorkerListener() {
    };

    default void beforeBatch(final int documentCount) {
    }

    default void afterBatch(final int documentCount) {
    }

    default void afterAcknowledgment(final Etag lastEtag) {
    }

    default void onConnectionRetry(final Throwable error) {
    }
}
