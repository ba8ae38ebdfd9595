package io.docfeed.cluster.failover;

import io.docfeed.cluster.consensus.ConsensusLog;
import io.docfeed.cluster.manager.TopologyListener;
import io.docfeed.cluster.manager.TopologySnapshot;
import io.docfeed.cluster.metadata.SubscriptionState;
import io.docfeed.cluster.metadata.SubscriptionStateStore;
import io.docfeed.subscription.exception.SubscriptionException;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Reacts to topology changes by reassigning every subscription whose responsible node is no longer the
 * selected one. Only the consensus leader proposes; the assignment is a compare-and-set so concurrent
 * coordinators cannot overwrite each other.
 */
@Slf4j
public final class FailoverCoordinator implements TopologyListener {

    private final ConsensusLog consensus;
    private final ResponsibleNodeAssigner assigner;
    private final SubscriptionStateStore states;

    public FailoverCoordinator(final ConsensusLog consensus,
                               final ResponsibleNodeAssigner assigner,
                               final SubscriptionStateStore states) {
        this.consensus = consensus;
        this.assigner = assigner;
        this.states = states;
    }

    @Override
    public void onTopologyChanged(final TopologySnapshot topology) {
        if (!consensus.isLeader()) return;
        log.info("Topology v{}: live {} of {}", topology.version(), topology.liveMembers(), topology.replicaGroup());
        int moved = 0;
        for (final SubscriptionState s : states.all()) {
            try {
                final String before = s.responsibleNode();
                final String after = assigner.assign(s.id(), topology);
                if (!Objects.equals(before, after)) moved++;
            } catch (final SubscriptionException e) {
                log.warn("Could not reassign subscription {}: {}", s.id(), e.getMessage());
            }
        }
        if (moved > 0) {
            log.info("Topology v{}: reassigned {} subscription(s)", topology.version(), moved);
        }
    }
}
