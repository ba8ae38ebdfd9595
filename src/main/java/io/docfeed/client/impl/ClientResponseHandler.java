package io.docfeed.client.impl;

import io.docfeed.api.SubscriptionApi;
import io.docfeed.client.StreamListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import lombok.extern.slf4j.Slf4j;

import java.nio.channels.ClosedChannelException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Completes pending request futures keyed by correlationId and hands everything else to the stream listener.
 */
@Slf4j
public final class ClientResponseHandler extends SimpleChannelInboundHandler<SubscriptionApi.Envelope> {

    private final ConcurrentMap<Long, CompletableFuture<SubscriptionApi.Envelope>> pending;
    private final Supplier<StreamListener> listener;

    public ClientResponseHandler(final ConcurrentMap<Long, CompletableFuture<SubscriptionApi.Envelope>> pending,
                                 final Supplier<StreamListener> listener) {
        this.pending = pending;
        this.listener = listener;
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final SubscriptionApi.Envelope envelope) {
        final long corrId = envelope.getCorrelationId();

        if (corrId != 0L) {
            final CompletableFuture<SubscriptionApi.Envelope> fut = pending.remove(corrId);
            if (fut != null) {
                fut.complete(envelope);
            } else {
                log.warn("{} for unknown corrId {}", envelope.getKindCase(), corrId);
            }
            return;
        }

        final StreamListener l = listener.get();
        if (l != null) {
            l.onPush(envelope);
        } else {
            log.debug("Dropping {} push: no stream listener", envelope.getKindCase());
        }
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        final ClosedChannelException ex = new ClosedChannelException();
        failAll(ex);
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        failAll(cause);
        ctx.close();
    }

    private void failAll(final Throwable cause) {
        pending.forEach((id, f) -> f.completeExceptionally(cause));
        pending.clear();
        final StreamListener l = listener.get();
        if (l != null) {
            l.onDisconnected(cause);
        }
    }
}
