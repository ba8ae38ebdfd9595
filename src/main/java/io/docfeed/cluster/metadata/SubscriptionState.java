package io.docfeed.cluster.metadata;

import io.docfeed.core.etag.Etag;
import io.docfeed.subscription.model.SubscriptionCriteria;

/**
 * Replicated, durable view of one subscription: definition, checkpoint and responsible node.
 */
public record SubscriptionState(long id,
                                String name,
                                SubscriptionCriteria criteria,
                                Etag checkpoint,
                                String mentorNode,
                                String responsibleNode,
                                boolean disabled,
                                long lastBatchAckTimeMillis,
                                long lastClientConnectionTimeMillis,
                                long createdAtMillis) {

    public SubscriptionState withCheckpoint(final Etag etag, final long ackTimeMillis) {
        return new SubscriptionState(id, name, criteria, etag, mentorNode, responsibleNode, disabled,
                ackTimeMillis > 0 ? ackTimeMillis : lastBatchAckTimeMillis, lastClientConnectionTimeMillis, createdAtMillis);
    }

    public SubscriptionState withResponsibleNode(final String node) {
        return new SubscriptionState(id, name, criteria, checkpoint, mentorNode, node, disabled,
                lastBatchAckTimeMillis, lastClientConnectionTimeMillis, createdAtMillis);
    }

    public SubscriptionState withDisabled(final boolean flag) {
        return new SubscriptionState(id, name, criteria, checkpoint, mentorNode, responsibleNode, flag,
                lastBatchAckTimeMillis, lastClientConnectionTimeMillis, createdAtMillis);
    }

    public SubscriptionState withLastClientConnectionTime(final long millis) {
        return new SubscriptionState(id, name, criteria, checkpoint, mentorNode, responsibleNode, disabled,
                lastBatchAckTimeMillis, millis, createdAtMillis);
    }
}
