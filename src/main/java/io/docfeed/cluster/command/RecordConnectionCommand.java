package io.docfeed.cluster.command;

/** Stores the time a client last obtained the lease. */
public record RecordConnectionCommand(long subscriptionId, long timestampMillis) implements ClusterCommand {
}
