package io.docfeed.cluster.command;

public record ToggleSubscriptionCommand(long subscriptionId, boolean disabled) implements ClusterCommand {
}
