package io.docfeed.cluster.command;

/**
 * A replicated state change. Every command must be safe to apply more than once.
 */
public sealed interface ClusterCommand permits AcknowledgeBatchCommand,
        CreateSubscriptionCommand,
        DeleteSubscriptionCommand,
        RecordConnectionCommand,
        ToggleSubscriptionCommand,
        UpdateResponsibleNodeCommand {
}
