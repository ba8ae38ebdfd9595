package io.docfeed.client;

import io.docfeed.api.SubscriptionApi;

/** Receives frames the server pushes without a correlation id, on the client's I/O thread. */
public interface StreamListener {

    void onPush(SubscriptionApi.Envelope envelope);

    default void onDisconnected(final Throwable cause) {
    }
}
