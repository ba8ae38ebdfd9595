package io.docfeed.subscription.model;

import io.docfeed.api.SubscriptionApi;
import io.docfeed.core.etag.Etag;
import lombok.experimental.UtilityClass;

import java.time.Duration;

/** Conversions between model types and their wire messages. */
@UtilityClass
public class ModelProtos {

    public SubscriptionApi.Criteria toProto(final SubscriptionCriteria c) {
        final SubscriptionApi.Criteria.Builder b = SubscriptionApi.Criteria.newBuilder()
                .setCollection(c.collection())
                .putAllPropertiesMatch(c.propertiesMatch())
                .putAllPropertiesNotMatch(c.propertiesNotMatch())
                .setStartEtag(c.startEtag().value());
        if (c.keyStartsWith() != null) b.setKeyStartsWith(c.keyStartsWith());
        return b.build();
    }

    public SubscriptionCriteria fromProto(final SubscriptionApi.Criteria p) {
        return SubscriptionCriteria.builder()
                .collection(p.getCollection())
                .keyStartsWith(p.getKeyStartsWith())
                .propertiesMatch(p.getPropertiesMatchMap())
                .propertiesNotMatch(p.getPropertiesNotMatchMap())
                .startEtag(Etag.of(p.getStartEtag()))
                .build();
    }

    public SubscriptionApi.ConnectionOptions toProto(final SubscriptionConnectionOptions o) {
        return SubscriptionApi.ConnectionOptions.newBuilder()
                .setConnectionId(o.getConnectionId())
                .setStrategy(toProto(o.getStrategy()))
                .setMaxDocCount(o.getMaxDocCount())
                .setMaxSizeBytes(o.getMaxSize() == null ? 0L : o.getMaxSize())
                .setAckTimeoutMillis(o.getAcknowledgmentTimeout().toMillis())
                .setClientAliveIntervalMillis(o.getClientAliveNotificationInterval().toMillis())
                .setIgnoreSubscribersErrors(o.isIgnoreSubscribersErrors())
                .build();
    }

    /** Zero-valued fields fall back to the defaults. */
    public SubscriptionConnectionOptions fromProto(final SubscriptionApi.ConnectionOptions p) {
        return fromProto(p, SubscriptionConnectionOptions.defaults());
    }

    /** Zero-valued fields fall back to {@code defaults}; a missing connection id gets a fresh one. */
    public SubscriptionConnectionOptions fromProto(final SubscriptionApi.ConnectionOptions p,
                                                   final SubscriptionConnectionOptions defaults) {
        final SubscriptionConnectionOptions.SubscriptionConnectionOptionsBuilder b = defaults.toBuilder()
                .connectionId(p.getConnectionId().isEmpty() ? SubscriptionConnectionOptions.newConnectionId() : p.getConnectionId())
                .strategy(fromProto(p.getStrategy()))
                .ignoreSubscribersErrors(p.getIgnoreSubscribersErrors() || defaults.isIgnoreSubscribersErrors());
        if (p.getMaxDocCount() > 0) b.maxDocCount(p.getMaxDocCount());
        if (p.getMaxSizeBytes() > 0) b.maxSize(p.getMaxSizeBytes());
        if (p.getAckTimeoutMillis() > 0) b.acknowledgmentTimeout(Duration.ofMillis(p.getAckTimeoutMillis()));
        if (p.getClientAliveIntervalMillis() > 0) {
            b.clientAliveNotificationInterval(Duration.ofMillis(p.getClientAliveIntervalMillis()));
        }
        return b.build();
    }

    public SubscriptionApi.OpeningStrategy toProto(final SubscriptionOpeningStrategy s) {
        return switch (s) {
            case OPEN_IF_FREE -> SubscriptionApi.OpeningStrategy.OPEN_IF_FREE;
            case WAIT_FOR_FREE -> SubscriptionApi.OpeningStrategy.WAIT_FOR_FREE;
            case TAKE_OVER -> SubscriptionApi.OpeningStrategy.TAKE_OVER;
            case FORCE_AND_KEEP -> SubscriptionApi.OpeningStrategy.FORCE_AND_KEEP;
        };
    }

    public SubscriptionOpeningStrategy fromProto(final SubscriptionApi.OpeningStrategy s) {
        return switch (s) {
            case WAIT_FOR_FREE -> SubscriptionOpeningStrategy.WAIT_FOR_FREE;
            case TAKE_OVER -> SubscriptionOpeningStrategy.TAKE_OVER;
            case FORCE_AND_KEEP -> SubscriptionOpeningStrategy.FORCE_AND_KEEP;
            default -> SubscriptionOpeningStrategy.OPEN_IF_FREE;
        };
    }

    public SubscriptionApi.CloseReason toProto(final CloseReason r) {
        return SubscriptionApi.CloseReason.valueOf("REASON_" + r.name());
    }

    public CloseReason fromProto(final SubscriptionApi.CloseReason r) {
        if (r == SubscriptionApi.CloseReason.REASON_UNSPECIFIED || r == SubscriptionApi.CloseReason.UNRECOGNIZED) {
            return CloseReason.CLIENT_CLOSED;
        }
        return CloseReason.valueOf(r.name().substring("REASON_".length()));
    }
}
