package io.docfeed.client;

import io.docfeed.api.SubscriptionApi;
import io.docfeed.core.etag.Etag;
import io.docfeed.subscription.model.SubscriptionConnectionOptions;
import io.docfeed.subscription.model.SubscriptionCriteria;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * One connection to a DocFeed node. Replies are matched by correlation id; futures fail with a
 * {@link io.docfeed.subscription.exception.SubscriptionException} when the server answers with an error or a
 * close signal. Server pushes go to the {@link StreamListener}.
 */
public interface DocFeedClient extends AutoCloseable {

    CompletableFuture<SubscriptionApi.CreateReply> create(SubscriptionCriteria criteria, String name, String mentorNode);

    CompletableFuture<SubscriptionApi.OpenReply> open(long subscriptionId, SubscriptionConnectionOptions options);

    CompletableFuture<SubscriptionApi.AckReply> acknowledge(long subscriptionId, String connectionId, Etag lastEtag);

    /** Fire and forget. */
    void alive(long subscriptionId, String connectionId);

    /** Fire and forget. */
    void reportFault(long subscriptionId, String connectionId, String message);

    CompletableFuture<Boolean> close(long subscriptionId, String connectionId, boolean force);

    CompletableFuture<Boolean> delete(long subscriptionId);

    CompletableFuture<Boolean> setDisabled(long subscriptionId, boolean disabled);

    CompletableFuture<List<SubscriptionApi.SubscriptionSummary>> list(int start, int pageSize);

    CompletableFuture<SubscriptionApi.TopologyReply> topology(long subscriptionId);

    void setStreamListener(StreamListener listener);

    boolean isOpen();

    @Override
    void close();
}
