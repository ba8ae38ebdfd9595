package io.docfeed.cluster.command;

/**
 * Compare-and-set of the responsible node: applied only while the current assignment is still
 * {@code expectedNode}. {@code newNode} null means no node can serve the subscription.
 */
public record UpdateResponsibleNodeCommand(long subscriptionId,
                                           String expectedNode,
                                           String newNode) implements ClusterCommand {
}
