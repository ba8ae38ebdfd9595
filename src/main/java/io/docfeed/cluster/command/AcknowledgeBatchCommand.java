package io.docfeed.cluster.command;

import io.docfeed.core.etag.Etag;

/**
 * Advances the checkpoint. Ignored when {@code etag} is behind the stored checkpoint; rejected when
 * {@code nodeTag} is set and no longer the responsible node. {@code ackTimeMillis} is 0 for silent acks.
 */
public record AcknowledgeBatchCommand(long subscriptionId,
                                      Etag etag,
                                      String nodeTag,
                                      long ackTimeMillis) implements ClusterCommand {
}
