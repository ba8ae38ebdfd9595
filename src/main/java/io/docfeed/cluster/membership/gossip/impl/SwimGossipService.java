package io.docfeed.cluster.membership.gossip.impl;

import io.docfeed.cluster.membership.gossip.type.GossipService;
import io.docfeed.cluster.membership.member.Member;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Lightweight SWIM-style gossip. Every received heartbeat is forwarded to {@code onHeartbeat}.
 */
@Slf4j
public final class SwimGossipService implements GossipService {

    private static final long MEMBER_TIMEOUT_MS = 3_000;
    private static final int MAX_TAG_BYTES = 255;

    private final ConcurrentMap<String, Member> view = new ConcurrentHashMap<>();

    private final String selfTag;
    private final Member selfMember;
    private final EventLoopGroup group;
    private final InetSocketAddress bind;
    private final List<InetSocketAddress> seeds;
    private final Consumer<String> onHeartbeat;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        final Thread t = new Thread(r, "gossip-flusher");
        t.setDaemon(true);
        return t;
    });

    private volatile Channel channel;

    public SwimGossipService(final String selfTag,
                             final InetSocketAddress bind,
                             final List<InetSocketAddress> seeds,
                             final Consumer<String> onHeartbeat) {
        if (selfTag.getBytes(StandardCharsets.UTF_8).length > MAX_TAG_BYTES) {
            throw new IllegalArgumentException("node tag too long: " + selfTag);
        }
        this.selfTag = selfTag;
        this.selfMember = new Member(selfTag, bind, System.currentTimeMillis());
        this.bind = bind;
        this.seeds = seeds;
        this.onHeartbeat = onHeartbeat;
        this.group = new NioEventLoopGroup(1);
    }

    /** Packet layout: [tagLen:u8][tag:utf8][timestamp:long]. */
    static ByteBuf encode(final String tag, final long timestampMillis) {
        final byte[] tagBytes = tag.getBytes(StandardCharsets.UTF_8);
        final ByteBuf b = Unpooled.buffer(1 + tagBytes.length + 8);
        b.writeByte(tagBytes.length);
        b.writeBytes(tagBytes);
        b.writeLong(timestampMillis);
        return b;
    }

    /** Returns null for malformed or expired packets. */
    static Member decode(final ByteBuf b, final InetSocketAddress sender, final long nowMillis) {
        if (b.readableBytes() < 1) return null;
        final int len = b.readUnsignedByte();
        if (len == 0 || b.readableBytes() != len + 8) return null;
        final String tag = b.readCharSequence(len, StandardCharsets.UTF_8).toString();
        final long ts = b.readLong();
        if (nowMillis - ts > MEMBER_TIMEOUT_MS) return null;
        return new Member(tag, sender, ts);
    }

    @Override
    public Map<String, Member> view() {
        return Collections.unmodifiableMap(view);
    }

    @Override
    public void start() {
        try {
            channel = new Bootstrap()
                    .group(group)
                    .channel(NioDatagramChannel.class)
                    .option(ChannelOption.SO_BROADCAST, false)
                    .handler(new SimpleChannelInboundHandler<DatagramPacket>() {
                        @Override
                        protected void channelRead0(final ChannelHandlerContext ctx,
                                                    final DatagramPacket pkt) {
                            receive(pkt);
                        }
                    })
                    .bind(bind)
                    .sync()
                    .channel();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Cannot start gossip", e);
        }

        view.put(selfTag, selfMember);

        scheduler.scheduleAtFixedRate(this::flush, 0, 1, TimeUnit.SECONDS);
        scheduler.scheduleAtFixedRate(this::sweep, 3, 3, TimeUnit.SECONDS);
    }

    private void flush() {
        final ByteBuf payload = encode(selfTag, System.currentTimeMillis());

        for (final InetSocketAddress seed : seeds) {
            channel.writeAndFlush(new DatagramPacket(payload.retainedDuplicate(), seed));
        }

        for (final Member m : view.values()) {
            if (m.nodeTag().equals(selfTag) || seeds.contains(m.address())) continue;
            channel.writeAndFlush(new DatagramPacket(payload.retainedDuplicate(), m.address()));
        }

        payload.release();
    }

    private void receive(final DatagramPacket pkt) {
        final Member m = decode(pkt.content(), pkt.sender(), System.currentTimeMillis());
        if (m == null || m.nodeTag().equals(selfTag)) return;

        view.merge(m.nodeTag(), m, (old, neu) -> neu.timestampMillis() > old.timestampMillis() ? neu : old);
        try {
            onHeartbeat.accept(m.nodeTag());
        } catch (final RuntimeException e) {
            log.warn("Heartbeat callback failed for {}", m.nodeTag(), e);
        }
    }

    private void sweep() {
        final long now = System.currentTimeMillis();
        view.values().removeIf(mem -> !mem.nodeTag().equals(selfTag) && (now - mem.timestampMillis()) > MEMBER_TIMEOUT_MS);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        try {
            if (channel != null) {
                channel.close().syncUninterruptibly();
            }
        } finally {
            group.shutdownGracefully().syncUninterruptibly();
        }
    }
}
