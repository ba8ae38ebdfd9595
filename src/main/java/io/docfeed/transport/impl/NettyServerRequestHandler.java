package io.docfeed.transport.impl;

import com.google.protobuf.GeneratedMessageV3;
import io.docfeed.api.SubscriptionApi;
import io.docfeed.cluster.manager.ClusterManager;
import io.docfeed.cluster.metadata.SubscriptionState;
import io.docfeed.core.etag.Etag;
import io.docfeed.subscription.SubscriptionService;
import io.docfeed.subscription.SubscriptionSummary;
import io.docfeed.subscription.admission.AdmissionResult;
import io.docfeed.subscription.exception.SubscriptionException;
import io.docfeed.subscription.exception.SubscriptionMovedException;
import io.docfeed.subscription.model.CloseReason;
import io.docfeed.subscription.model.ModelProtos;
import io.docfeed.subscription.model.SubscriptionConnectionOptions;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * One instance per client socket. Admission and ack frames are handled on the event loop; operations that
 * wait for a cluster commit run on the admin executor and reply when done.
 */
@Slf4j
public class NettyServerRequestHandler extends SimpleChannelInboundHandler<SubscriptionApi.Envelope> {

    private final SubscriptionService service;
    private final ClusterManager cluster;
    private final Executor admin;
    private final SubscriptionConnectionOptions defaults;

    private NettySubscriptionChannel stream;

    public NettyServerRequestHandler(final SubscriptionService service,
                                     final ClusterManager cluster,
                                     final Executor admin,
                                     final SubscriptionConnectionOptions defaults) {
        this.service = service;
        this.cluster = cluster;
        this.admin = admin;
        this.defaults = defaults;
    }

    @Override
    public void handlerAdded(final ChannelHandlerContext ctx) {
        stream = new NettySubscriptionChannel(ctx.channel());
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        log.debug("Client stream {} closed", stream);
        service.channelClosed(stream);
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.warn("Closing client stream {}: {}", stream, cause.toString());
        ctx.close();
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final SubscriptionApi.Envelope env) {
        final long corrId = env.getCorrelationId();

        try {
            switch (env.getKindCase()) {
                case CREATE -> {
                    final var req = env.getCreate();
                    async(ctx, corrId, () -> {
                        final SubscriptionState s = service.create(
                                ModelProtos.fromProto(req.getCriteria()), req.getName(), req.getMentorNode());
                        return SubscriptionApi.CreateReply.newBuilder()
                                .setSubscriptionId(s.id())
                                .setName(s.name())
                                .build();
                    });
                }

                case OPEN -> {
                    final var req = env.getOpen();
                    final SubscriptionConnectionOptions options = ModelProtos.fromProto(req.getOptions(), defaults);
                    async(ctx, corrId, () -> open(req.getSubscriptionId(), options));
                }

                case ACK -> {
                    final var req = env.getAck();
                    service.acknowledge(req.getSubscriptionId(), req.getConnectionId(), Etag.of(req.getLastEtag()))
                            .whenComplete((r, ex) -> {
                                final SubscriptionApi.AckReply.Builder b = SubscriptionApi.AckReply.newBuilder();
                                if (ex != null) {
                                    b.setCommitted(false).setError(String.valueOf(ex.getMessage()));
                                } else {
                                    b.setCommitted(r.committed());
                                    if (r.error() != null) b.setError(r.error());
                                }
                                writeReply(ctx, corrId, b.build());
                            });
                }

                case ALIVE -> {
                    final var req = env.getAlive();
                    if (!service.alive(req.getSubscriptionId(), req.getConnectionId())) {
                        log.debug("ALIVE from {} on subscription {} ignored: not the holder",
                                req.getConnectionId(), req.getSubscriptionId());
                    }
                }

                case CLIENT_FAULT -> {
                    final var req = env.getClientFault();
                    service.reportFault(req.getSubscriptionId(), req.getConnectionId(), req.getMessage());
                }

                case CLOSE -> {
                    final var req = env.getClose();
                    final boolean closed = service.close(req.getSubscriptionId(), req.getConnectionId(), req.getForce());
                    writeReply(ctx, corrId, SubscriptionApi.SimpleReply.newBuilder().setSuccess(closed).build());
                }

                case DELETE -> {
                    final long id = env.getDelete().getSubscriptionId();
                    async(ctx, corrId, () -> SubscriptionApi.SimpleReply.newBuilder().setSuccess(service.delete(id)).build());
                }

                case TOGGLE -> {
                    final var req = env.getToggle();
                    async(ctx, corrId, () -> {
                        service.setDisabled(req.getSubscriptionId(), req.getDisabled());
                        return SubscriptionApi.SimpleReply.newBuilder().setSuccess(true).build();
                    });
                }

                case LIST -> {
                    final var req = env.getList();
                    async(ctx, corrId, () -> {
                        final SubscriptionApi.ListReply.Builder b = SubscriptionApi.ListReply.newBuilder();
                        for (final SubscriptionSummary s : service.list(req.getStart(), req.getPageSize())) {
                            b.addSubscriptions(toProto(s));
                        }
                        return b.build();
                    });
                }

                case TOPOLOGY -> {
                    final long id = env.getTopology().getSubscriptionId();
                    async(ctx, corrId, () -> {
                        final String node = service.resolve(id);
                        final SubscriptionApi.TopologyReply.Builder b = SubscriptionApi.TopologyReply.newBuilder().setNodeTag(node);
                        cluster.addressOf(node).ifPresent(a -> b.setHost(a.getHostString()).setPort(a.getPort()));
                        return b.build();
                    });
                }

                default -> {
                    log.warn("Unexpected envelope kind from client: {}", env.getKindCase());
                    writeReply(ctx, corrId, error(CloseReason.INVALID_REQUEST, "unsupported frame " + env.getKindCase(), null));
                }
            }
        } catch (final SubscriptionException ex) {
            writeReply(ctx, corrId, error(ex));
        } catch (final RuntimeException ex) {
            log.error("Handler error (corrId: {})", corrId, ex);
            writeReply(ctx, corrId, error(CloseReason.UNAVAILABLE, String.valueOf(ex.getMessage()), null));
        }
    }

    private GeneratedMessageV3 open(final long subscriptionId,
                                    final SubscriptionConnectionOptions options) {
        final AdmissionResult r = service.open(subscriptionId, options, stream);
        return switch (r.getStatus()) {
            case ACCEPTED -> openReply(SubscriptionApi.OpenReply.Status.ACCEPTED, subscriptionId, options);
            case QUEUED -> {
                r.getGrant().whenComplete((lease, ex) -> {
                    if (ex == null) return;
                    final Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                    final SubscriptionException se = cause instanceof final SubscriptionException s ? s
                            : SubscriptionException.fromReason(CloseReason.UNAVAILABLE, cause.getMessage(), null);
                    if (stream.isOpen()) {
                        stream.sendClosed(subscriptionId, options.getConnectionId(), se.getReason(), se.getMessage(), newNode(se));
                    }
                });
                yield openReply(SubscriptionApi.OpenReply.Status.QUEUED, subscriptionId, options);
            }
            case REJECTED -> NettySubscriptionChannel.closedFrame(subscriptionId, options.getConnectionId(),
                    r.getReason(), r.getMessage(), r.getNewNode());
        };
    }

    private void async(final ChannelHandlerContext ctx, final long corrId, final Supplier<GeneratedMessageV3> work) {
        CompletableFuture.supplyAsync(work, admin).whenComplete((reply, ex) -> {
            if (ex == null) {
                writeReply(ctx, corrId, reply);
                return;
            }
            final Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
            if (cause instanceof final SubscriptionException se) {
                writeReply(ctx, corrId, error(se));
            } else if (cause instanceof IllegalArgumentException) {
                writeReply(ctx, corrId, error(CloseReason.INVALID_REQUEST, cause.getMessage(), null));
            } else {
                log.error("Request failed (corrId: {})", corrId, cause);
                writeReply(ctx, corrId, error(CloseReason.UNAVAILABLE, String.valueOf(cause.getMessage()), null));
            }
        });
    }

    private static SubscriptionApi.OpenReply openReply(final SubscriptionApi.OpenReply.Status status,
                                                       final long subscriptionId,
                                                       final SubscriptionConnectionOptions options) {
        return SubscriptionApi.OpenReply.newBuilder()
                .setStatus(status)
                .setSubscriptionId(subscriptionId)
                .setConnectionId(options.getConnectionId())
                .build();
    }

    private static SubscriptionApi.SubscriptionSummary toProto(final SubscriptionSummary s) {
        final SubscriptionState st = s.state();
        final SubscriptionApi.SubscriptionSummary.Builder b = SubscriptionApi.SubscriptionSummary.newBuilder()
                .setSubscriptionId(st.id())
                .setName(st.name())
                .setCriteria(ModelProtos.toProto(st.criteria()))
                .setCheckpointEtag(st.checkpoint().value())
                .setDisabled(st.disabled())
                .setLastBatchAckTimeMillis(st.lastBatchAckTimeMillis())
                .setLastClientConnectionTimeMillis(st.lastClientConnectionTimeMillis())
                .setConnected(s.connected());
        if (st.mentorNode() != null) b.setMentorNode(st.mentorNode());
        if (st.responsibleNode() != null) b.setResponsibleNode(st.responsibleNode());
        if (s.connected()) {
            b.setConnectionId(s.connectionId()).setStrategy(ModelProtos.toProto(s.strategy()));
        }
        return b.build();
    }

    private static SubscriptionApi.ErrorReply error(final SubscriptionException e) {
        return error(e.getReason(), e.getMessage(), newNode(e));
    }

    private static SubscriptionApi.ErrorReply error(final CloseReason reason, final String message, final String newNode) {
        final SubscriptionApi.ErrorReply.Builder b = SubscriptionApi.ErrorReply.newBuilder()
                .setReason(ModelProtos.toProto(reason));
        if (message != null) b.setMessage(message);
        if (newNode != null) b.setNewNode(newNode);
        return b.build();
    }

    private static String newNode(final SubscriptionException e) {
        return e instanceof final SubscriptionMovedException m ? m.getNewNode() : null;
    }

    private void writeReply(final ChannelHandlerContext ctx,
                            final long corrId,
                            final GeneratedMessageV3 reply) {
        final SubscriptionApi.Envelope.Builder b = SubscriptionApi.Envelope.newBuilder().setCorrelationId(corrId);

        if (reply instanceof final SubscriptionApi.CreateReply r) b.setCreateReply(r);
        else if (reply instanceof final SubscriptionApi.OpenReply r) b.setOpenReply(r);
        else if (reply instanceof final SubscriptionApi.AckReply r) b.setAckReply(r);
        else if (reply instanceof final SubscriptionApi.SimpleReply r) b.setSimpleReply(r);
        else if (reply instanceof final SubscriptionApi.ErrorReply r) b.setErrorReply(r);
        else if (reply instanceof final SubscriptionApi.ListReply r) b.setListReply(r);
        else if (reply instanceof final SubscriptionApi.TopologyReply r) b.setTopologyReply(r);
        else if (reply instanceof final SubscriptionApi.SubscriptionClosed r) b.setSubscriptionClosed(r);
        else {
            log.warn("Unknown reply type: {}", reply.getClass().getName());
            return;
        }

        ctx.writeAndFlush(b.build());
    }
}
