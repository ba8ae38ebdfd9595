package io.docfeed.cluster.failover;

import io.docfeed.cluster.manager.TopologySnapshot;
import io.docfeed.cluster.membership.hash.HashingProvider;
import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * Pure choice of the node that should serve a subscription, given the current assignment, the live
 * replica group and the mentor hint.
 */
@UtilityClass
public class ResponsibleNodeSelector {

    /**
     * The mentor if it is live, else the current node if it is still live, else the highest-weight live
     * member for this subscription id. Null when no member of the replica group is live.
     */
    public String select(final long subscriptionId,
                         final String mentorNode,
                         final String currentNode,
                         final TopologySnapshot topology) {
        if (topology.isLive(mentorNode)) return mentorNode;
        if (topology.isLive(currentNode)) return currentNode;
        final List<String> live = topology.liveMembers();
        return live.isEmpty() ? null : HashingProvider.primary(subscriptionId, live);
    }
}
