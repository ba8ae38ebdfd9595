package io.docfeed.cluster.command;

public record DeleteSubscriptionCommand(long subscriptionId) implements ClusterCommand {
}
