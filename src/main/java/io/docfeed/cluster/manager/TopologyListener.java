package io.docfeed.cluster.manager;

/** Receives topology changes one at a time, in version order. */
@FunctionalInterface
public interface TopologyListener {
    void onTopologyChanged(TopologySnapshot topology);
}
