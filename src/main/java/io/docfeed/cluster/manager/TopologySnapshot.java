package io.docfeed.cluster.manager;

import java.util.List;
import java.util.Set;

/**
 * Membership as seen at one topology version: the ordered replica group of the database and which of
 * its members are currently live.
 */
public record TopologySnapshot(long version, List<String> replicaGroup, Set<String> liveNodes) {

    public TopologySnapshot {
        replicaGroup = List.copyOf(replicaGroup);
        liveNodes = Set.copyOf(liveNodes);
    }

    /** Live members of the replica group, in group order. */
    public List<String> liveMembers() {
        return replicaGroup.stream().filter(liveNodes::contains).toList();
    }

    public boolean isLive(final String nodeTag) {
        return nodeTag != null && liveNodes.contains(nodeTag) && replicaGroup.contains(nodeTag);
    }
}
