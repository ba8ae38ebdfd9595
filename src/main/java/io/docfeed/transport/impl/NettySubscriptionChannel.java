package io.docfeed.transport.impl;

import io.docfeed.api.SubscriptionApi;
import io.docfeed.core.etag.Etag;
import io.docfeed.storage.StoredDocument;
import io.docfeed.subscription.channel.SubscriptionChannel;
import io.docfeed.subscription.model.CloseReason;
import io.docfeed.subscription.model.ModelProtos;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;

import java.util.concurrent.CompletableFuture;

/**
 * {@link SubscriptionChannel} over one client socket. Documents are written without flushing; the end of
 * batch frame flushes the whole batch.
 */
public final class NettySubscriptionChannel implements SubscriptionChannel {

    private final Channel channel;

    public NettySubscriptionChannel(final Channel channel) {
        this.channel = channel;
    }

    @Override
    public String id() {
        return channel.id().asShortText() + "@" + channel.remoteAddress();
    }

    @Override
    public CompletableFuture<Void> sendDocument(final long subscriptionId, final StoredDocument document) {
        return toFuture(channel.write(push().setDocument(SubscriptionApi.Document.newBuilder()
                .setSubscriptionId(subscriptionId)
                .setId(document.id())
                .setCollection(document.collection())
                .setEtag(document.etag().value())
                .setBody(document.body())).build()));
    }

    @Override
    public CompletableFuture<Void> sendEndOfBatch(final long subscriptionId, final Etag lastEtag, final int count) {
        return toFuture(channel.writeAndFlush(push().setEndOfBatch(SubscriptionApi.EndOfBatch.newBuilder()
                .setSubscriptionId(subscriptionId)
                .setLastEtag(lastEtag.value())
                .setCount(count)).build()));
    }

    @Override
    public CompletableFuture<Void> sendHeartbeat(final long subscriptionId) {
        return toFuture(channel.writeAndFlush(push().setHeartbeat(SubscriptionApi.Heartbeat.newBuilder()
                .setSubscriptionId(subscriptionId)).build()));
    }

    @Override
    public void sendGranted(final long subscriptionId, final String connectionId) {
        channel.writeAndFlush(push().setOpenReply(SubscriptionApi.OpenReply.newBuilder()
                .setStatus(SubscriptionApi.OpenReply.Status.ACCEPTED)
                .setSubscriptionId(subscriptionId)
                .setConnectionId(connectionId)).build());
    }

    @Override
    public void sendClosed(final long subscriptionId,
                           final String connectionId,
                           final CloseReason reason,
                           final String message,
                           final String newNode) {
        channel.writeAndFlush(push().setSubscriptionClosed(closedFrame(subscriptionId, connectionId, reason, message, newNode)).build());
    }

    @Override
    public boolean isOpen() {
        return channel.isActive();
    }

    static SubscriptionApi.SubscriptionClosed closedFrame(final long subscriptionId,
                                                          final String connectionId,
                                                          final CloseReason reason,
                                                          final String message,
                                                          final String newNode) {
        final SubscriptionApi.SubscriptionClosed.Builder b = SubscriptionApi.SubscriptionClosed.newBuilder()
                .setSubscriptionId(subscriptionId)
                .setReason(ModelProtos.toProto(reason));
        if (connectionId != null) b.setConnectionId(connectionId);
        if (message != null) b.setMessage(message);
        if (newNode != null) b.setNewNode(newNode);
        return b.build();
    }

    private static SubscriptionApi.Envelope.Builder push() {
        return SubscriptionApi.Envelope.newBuilder().setCorrelationId(0L);
    }

    private static CompletableFuture<Void> toFuture(final ChannelFuture cf) {
        final CompletableFuture<Void> f = new CompletableFuture<>();
        cf.addListener(done -> {
            if (done.isSuccess()) f.complete(null);
            else f.completeExceptionally(done.cause());
        });
        return f;
    }

    @Override
    public String toString() {
        return "channel[" + id() + "]";
    }
}
