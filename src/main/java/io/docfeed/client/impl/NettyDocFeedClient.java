package io.docfeed.client.impl;

import io.docfeed.api.SubscriptionApi;
import io.docfeed.client.DocFeedClient;
import io.docfeed.client.StreamListener;
import io.docfeed.core.etag.Etag;
import io.docfeed.subscription.exception.SubscriptionException;
import io.docfeed.subscription.model.ModelProtos;
import io.docfeed.subscription.model.SubscriptionConnectionOptions;
import io.docfeed.subscription.model.SubscriptionCriteria;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.protobuf.ProtobufDecoder;
import io.netty.handler.codec.protobuf.ProtobufEncoder;
import io.netty.handler.codec.protobuf.ProtobufVarint32FrameDecoder;
import io.netty.handler.codec.protobuf.ProtobufVarint32LengthFieldPrepender;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

@Slf4j
public final class NettyDocFeedClient implements DocFeedClient {

    private final Channel channel;
    private final EventLoopGroup group;

    private final ConcurrentMap<Long, CompletableFuture<SubscriptionApi.Envelope>> pending = new ConcurrentHashMap<>();

    private final AtomicLong corrSeq = new AtomicLong(1L);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile StreamListener listener;

    public NettyDocFeedClient(final String host, final int port) throws InterruptedException {
        this.group = new NioEventLoopGroup(1);

        final Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new ProtobufVarint32FrameDecoder())
                                .addLast(new ProtobufDecoder(SubscriptionApi.Envelope.getDefaultInstance()))
                                .addLast(new ClientResponseHandler(pending, () -> listener))
                                .addLast(new ProtobufVarint32LengthFieldPrepender())
                                .addLast(new ProtobufEncoder());
                    }
                });

        try {
            this.channel = bootstrap.connect(new InetSocketAddress(host, port))
                    .sync()
                    .channel();
        } catch (final Exception e) {
            group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
            throw e;
        }

        log.info("NettyDocFeedClient connected to {}:{}", host, port);
    }

    @Override
    public CompletableFuture<SubscriptionApi.CreateReply> create(final SubscriptionCriteria criteria,
                                                                 final String name,
                                                                 final String mentorNode) {
        final SubscriptionApi.CreateRequest.Builder req = SubscriptionApi.CreateRequest.newBuilder()
                .setCriteria(ModelProtos.toProto(criteria));
        if (name != null) req.setName(name);
        if (mentorNode != null) req.setMentorNode(mentorNode);
        return request(SubscriptionApi.Envelope.newBuilder().setCreate(req),
                SubscriptionApi.Envelope.KindCase.CREATE_REPLY, SubscriptionApi.Envelope::getCreateReply);
    }

    @Override
    public CompletableFuture<SubscriptionApi.OpenReply> open(final long subscriptionId, final SubscriptionConnectionOptions options) {
        return request(SubscriptionApi.Envelope.newBuilder().setOpen(SubscriptionApi.OpenRequest.newBuilder()
                        .setSubscriptionId(subscriptionId)
                        .setOptions(ModelProtos.toProto(options))),
                SubscriptionApi.Envelope.KindCase.OPEN_REPLY, SubscriptionApi.Envelope::getOpenReply);
    }

    @Override
    public CompletableFuture<SubscriptionApi.AckReply> acknowledge(final long subscriptionId,
                                                                   final String connectionId,
                                                                   final Etag lastEtag) {
        return request(SubscriptionApi.Envelope.newBuilder().setAck(SubscriptionApi.AckRequest.newBuilder()
                        .setSubscriptionId(subscriptionId)
                        .setConnectionId(connectionId)
                        .setLastEtag(lastEtag.value())),
                SubscriptionApi.Envelope.KindCase.ACK_REPLY, SubscriptionApi.Envelope::getAckReply);
    }

    @Override
    public void alive(final long subscriptionId, final String connectionId) {
        send(SubscriptionApi.Envelope.newBuilder().setAlive(SubscriptionApi.AliveRequest.newBuilder()
                .setSubscriptionId(subscriptionId)
                .setConnectionId(connectionId)).build());
    }

    @Override
    public void reportFault(final long subscriptionId, final String connectionId, final String message) {
        send(SubscriptionApi.Envelope.newBuilder().setClientFault(SubscriptionApi.ClientFault.newBuilder()
                .setSubscriptionId(subscriptionId)
                .setConnectionId(connectionId)
                .setMessage(message == null ? "" : message)).build());
    }

    @Override
    public CompletableFuture<Boolean> close(final long subscriptionId, final String connectionId, final boolean force) {
        return request(SubscriptionApi.Envelope.newBuilder().setClose(SubscriptionApi.CloseRequest.newBuilder()
                        .setSubscriptionId(subscriptionId)
                        .setConnectionId(connectionId)
                        .setForce(force)),
                SubscriptionApi.Envelope.KindCase.SIMPLE_REPLY, e -> e.getSimpleReply().getSuccess());
    }

    @Override
    public CompletableFuture<Boolean> delete(final long subscriptionId) {
        return request(SubscriptionApi.Envelope.newBuilder().setDelete(SubscriptionApi.DeleteRequest.newBuilder()
                        .setSubscriptionId(subscriptionId)),
                SubscriptionApi.Envelope.KindCase.SIMPLE_REPLY, e -> e.getSimpleReply().getSuccess());
    }

    @Override
    public CompletableFuture<Boolean> setDisabled(final long subscriptionId, final boolean disabled) {
        return request(SubscriptionApi.Envelope.newBuilder().setToggle(SubscriptionApi.ToggleRequest.newBuilder()
                        .setSubscriptionId(subscriptionId)
                        .setDisabled(disabled)),
                SubscriptionApi.Envelope.KindCase.SIMPLE_REPLY, e -> e.getSimpleReply().getSuccess());
    }

    @Override
    public CompletableFuture<List<SubscriptionApi.SubscriptionSummary>> list(final int start, final int pageSize) {
        return request(SubscriptionApi.Envelope.newBuilder().setList(SubscriptionApi.ListRequest.newBuilder()
                        .setStart(start)
                        .setPageSize(pageSize)),
                SubscriptionApi.Envelope.KindCase.LIST_REPLY, e -> e.getListReply().getSubscriptionsList());
    }

    @Override
    public CompletableFuture<SubscriptionApi.TopologyReply> topology(final long subscriptionId) {
        return request(SubscriptionApi.Envelope.newBuilder().setTopology(SubscriptionApi.TopologyRequest.newBuilder()
                        .setSubscriptionId(subscriptionId)),
                SubscriptionApi.Envelope.KindCase.TOPOLOGY_REPLY, SubscriptionApi.Envelope::getTopologyReply);
    }

    @Override
    public void setStreamListener(final StreamListener listener) {
        this.listener = listener;
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && channel.isActive();
    }

    private <T> CompletableFuture<T> request(final SubscriptionApi.Envelope.Builder envelope,
                                             final SubscriptionApi.Envelope.KindCase expected,
                                             final Function<SubscriptionApi.Envelope, T> extract) {
        if (closed.get()) return CompletableFuture.failedFuture(new ClosedChannelException());

        final long corrId = corrSeq.getAndIncrement();
        final SubscriptionApi.Envelope toSend = envelope.setCorrelationId(corrId).build();

        final CompletableFuture<SubscriptionApi.Envelope> future = new CompletableFuture<>();
        pending.put(corrId, future);
        future.whenComplete((res, ex) -> pending.remove(corrId));

        channel.writeAndFlush(toSend).addListener(f -> {
            if (!f.isSuccess()) {
                future.completeExceptionally(f.cause());
                log.error("Failed to send {} corrId {}: {}", toSend.getKindCase(), corrId, f.cause().getMessage());
            }
        });

        return future.thenApply(reply -> unwrap(reply, expected, extract));
    }

    private static <T> T unwrap(final SubscriptionApi.Envelope reply,
                                final SubscriptionApi.Envelope.KindCase expected,
                                final Function<SubscriptionApi.Envelope, T> extract) {
        if (reply.getKindCase() == expected) {
            return extract.apply(reply);
        }
        if (reply.hasErrorReply()) {
            final SubscriptionApi.ErrorReply e = reply.getErrorReply();
            throw SubscriptionException.fromReason(ModelProtos.fromProto(e.getReason()), e.getMessage(), emptyToNull(e.getNewNode()));
        }
        if (reply.hasSubscriptionClosed()) {
            final SubscriptionApi.SubscriptionClosed c = reply.getSubscriptionClosed();
            throw SubscriptionException.fromReason(ModelProtos.fromProto(c.getReason()), c.getMessage(), emptyToNull(c.getNewNode()));
        }
        throw new IllegalStateException("expected " + expected + " but got " + reply.getKindCase());
    }

    private void send(final SubscriptionApi.Envelope envelope) {
        if (closed.get()) throw new IllegalStateException("NettyDocFeedClient is closed");

        channel.writeAndFlush(envelope).addListener(f -> {
            if (!f.isSuccess()) {
                log.error("send {} failed: {}", envelope.getKindCase(), f.cause().getMessage(), f.cause());
            }
        });
    }

    private static String emptyToNull(final String s) {
        return s == null || s.isEmpty() ? null : s;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;

        final ClosedChannelException ex = new ClosedChannelException();
        pending.forEach((id, f) -> f.completeExceptionally(ex));
        pending.clear();

        try {
            if (channel != null) channel.close().syncUninterruptibly();
        } finally {
            if (group != null) group.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        }

        log.info("NettyDocFeedClient closed.");
    }
}
