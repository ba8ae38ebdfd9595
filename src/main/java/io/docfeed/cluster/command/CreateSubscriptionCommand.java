package io.docfeed.cluster.command;

import io.docfeed.subscription.model.SubscriptionCriteria;

/** Registers a subscription; {@code name} and {@code mentorNode} may be null. */
public record CreateSubscriptionCommand(String name,
                                        SubscriptionCriteria criteria,
                                        String mentorNode,
                                        long timestampMillis) implements ClusterCommand {
}
