package io.docfeed.cluster.consensus;

import io.docfeed.cluster.command.ClusterCommand;

/** Deterministic consumer of committed commands, applied in log order. */
public interface StateMachine {
    ApplyResult apply(long index, ClusterCommand command);
}
