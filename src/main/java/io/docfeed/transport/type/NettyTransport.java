package io.docfeed.transport.type;

import io.docfeed.api.SubscriptionApi;
import io.docfeed.cluster.manager.ClusterManager;
import io.docfeed.subscription.SubscriptionService;
import io.docfeed.subscription.model.SubscriptionConnectionOptions;
import io.docfeed.transport.impl.NettyServerRequestHandler;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.protobuf.ProtobufDecoder;
import io.netty.handler.codec.protobuf.ProtobufEncoder;
import io.netty.handler.codec.protobuf.ProtobufVarint32FrameDecoder;
import io.netty.handler.codec.protobuf.ProtobufVarint32LengthFieldPrepender;
import io.netty.handler.flush.FlushConsolidationHandler;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
public class NettyTransport implements AutoCloseable {
    @Getter private int port;
    private final SubscriptionService service;
    private final ClusterManager cluster;
    private final SubscriptionConnectionOptions defaults;

    private final AtomicInteger adminIds = new AtomicInteger();
    private final ExecutorService admin = Executors.newFixedThreadPool(4, r -> {
        final Thread t = new Thread(r, "docfeed-admin-" + adminIds.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;

    public NettyTransport(final int port,
                          final SubscriptionService service,
                          final ClusterManager cluster,
                          final SubscriptionConnectionOptions defaults) {
        this.port = port;
        this.service = service;
        this.cluster = cluster;
        this.defaults = defaults;
    }

    public void start() throws InterruptedException {
        /*
         * Netty Threading Model:
         * 1 Boss thread for accepting connections.
         * 0 (Default) Worker threads for IO processing (defaults to NettyRuntime.availableProcessors() * 2).
         */
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(0);

        final ServerBootstrap b = new ServerBootstrap();
        b.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        final ChannelPipeline p = ch.pipeline();

                        /* Documents are written unflushed; the end-of-batch frame flushes. */
                        p.addLast(new FlushConsolidationHandler(256, true));

                        /* Protocol Buffers Framing (Varint32 Length Prefix) */
                        p.addLast(new ProtobufVarint32FrameDecoder());
                        p.addLast(new ProtobufDecoder(SubscriptionApi.Envelope.getDefaultInstance()));
                        p.addLast(new ProtobufVarint32LengthFieldPrepender());
                        p.addLast(new ProtobufEncoder());

                        p.addLast(new NettyServerRequestHandler(service, cluster, admin, defaults));
                    }
                })

                /*
                 * TCP_NODELAY: heartbeats and acks are tiny and latency bound.
                 * SO_KEEPALIVE: Detect dead peers at TCP level.
                 */
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true);

        final ChannelFuture f = b.bind(port).sync();
        port = ((InetSocketAddress) f.channel().localAddress()).getPort();
        log.info("Netty Transport started on port {}", port);

        f.channel().closeFuture().addListener(cf -> stop());
    }

    public void stop() {
        if (bossGroup != null) bossGroup.shutdownGracefully();
        if (workerGroup != null) workerGroup.shutdownGracefully();
        admin.shutdown();
    }

    @Override
    public void close() {
        stop();
        if (bossGroup != null) bossGroup.terminationFuture().syncUninterruptibly();
        if (workerGroup != null) workerGroup.terminationFuture().syncUninterruptibly();
    }
}
