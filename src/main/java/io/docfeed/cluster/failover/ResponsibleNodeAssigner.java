package io.docfeed.cluster.failover;

import io.docfeed.cluster.manager.ClusterManager;
import io.docfeed.cluster.manager.TopologySnapshot;
import io.docfeed.cluster.metadata.SubscriptionState;
import io.docfeed.subscription.store.CursorStore;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Brings one subscription's responsible node in line with the current topology through a committed
 * compare-and-set.
 */
@Slf4j
public final class ResponsibleNodeAssigner {

    private final CursorStore cursorStore;
    private final ClusterManager cluster;

    public ResponsibleNodeAssigner(final CursorStore cursorStore, final ClusterManager cluster) {
        this.cursorStore = cursorStore;
        this.cluster = cluster;
    }

    public String assign(final long subscriptionId) {
        return assign(subscriptionId, cluster.snapshot());
    }

    /**
     * @return the responsible node after the attempt, possibly null when no replica is live
     */
    public String assign(final long subscriptionId, final TopologySnapshot topology) {
        final SubscriptionState state = cursorStore.require(subscriptionId);
        final String target = ResponsibleNodeSelector.select(subscriptionId, state.mentorNode(), state.responsibleNode(), topology);
        if (Objects.equals(target, state.responsibleNode())) {
            return target;
        }
        if (cursorStore.updateResponsibleNode(subscriptionId, state.responsibleNode(), target)) {
            if (target == null) {
                log.warn("Subscription {} has no live responsible node (topology v{})", subscriptionId, topology.version());
            } else {
                log.info("Subscription {} responsible node {} -> {} (topology v{})",
                        subscriptionId, state.responsibleNode(), target, topology.version());
            }
            return target;
        }
        // lost a race with another assignment; report what was committed
        return cursorStore.get(subscriptionId).map(SubscriptionState::responsibleNode).orElse(null);
    }

    public TopologySnapshot topology() {
        return cluster.snapshot();
    }
}
