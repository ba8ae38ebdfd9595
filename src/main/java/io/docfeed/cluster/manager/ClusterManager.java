package io.docfeed.cluster.manager;

import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Tracks which nodes of the database's replica group are live and publishes a single ordered stream of
 * topology changes. Nodes are marked up/down explicitly or through heartbeats.
 */
@Slf4j
public final class ClusterManager implements AutoCloseable {
    private final List<String> replicaGroup;
    private final Map<String, InetSocketAddress> addresses;
    private final Set<String> activeNodes = new HashSet<>();
    private final Map<String, Long> lastHeartbeat = new HashMap<>();
    private final long heartbeatTimeoutMillis;
    private final List<TopologyListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService events = Executors.newSingleThreadExecutor(r -> {
        final Thread t = new Thread(r, "topology-events");
        t.setDaemon(true);
        return t;
    });
    private long version;

    public ClusterManager(final Map<String, InetSocketAddress> members, final long heartbeatTimeoutMillis) {
        this.addresses = new LinkedHashMap<>(members);
        this.replicaGroup = new ArrayList<>(members.keySet());
        this.activeNodes.addAll(this.replicaGroup);
        this.heartbeatTimeoutMillis = heartbeatTimeoutMillis;
        final long now = System.currentTimeMillis();
        for (final String n : this.replicaGroup) {
            lastHeartbeat.put(n, now);
        }
    }

    public void addListener(final TopologyListener listener) {
        listeners.add(listener);
    }

    /** Mark a node as failed/inactive. */
    public synchronized CompletableFuture<Void> nodeDown(final String nodeTag) {
        if (!activeNodes.remove(nodeTag)) return CompletableFuture.completedFuture(null);
        log.warn("Node {} marked down", nodeTag);
        return publish();
    }

    /** Mark a node as alive/active. */
    public synchronized CompletableFuture<Void> nodeUp(final String nodeTag) {
        return nodeUp(nodeTag, System.currentTimeMillis());
    }

    /** Record a heartbeat from the given node. */
    public synchronized void handleHeartbeat(final String nodeTag) {
        nodeUp(nodeTag, System.currentTimeMillis());
    }

    synchronized CompletableFuture<Void> nodeUp(final String nodeTag, final long now) {
        if (!replicaGroup.contains(nodeTag)) return CompletableFuture.completedFuture(null);
        lastHeartbeat.put(nodeTag, now);
        if (!activeNodes.add(nodeTag)) return CompletableFuture.completedFuture(null);
        log.info("Node {} is up", nodeTag);
        return publish();
    }

    /** Remove nodes whose heartbeat timed out. */
    public synchronized CompletableFuture<Void> checkHeartbeats() {
        return checkHeartbeats(System.currentTimeMillis());
    }

    synchronized CompletableFuture<Void> checkHeartbeats(final long now) {
        boolean changed = false;
        final Iterator<String> it = activeNodes.iterator();
        while (it.hasNext()) {
            final String n = it.next();
            final long last = lastHeartbeat.getOrDefault(n, 0L);
            if (now - last > heartbeatTimeoutMillis) {
                log.warn("Node {} missed heartbeats for {} ms, marking down", n, now - last);
                it.remove();
                changed = true;
            }
        }
        return changed ? publish() : CompletableFuture.completedFuture(null);
    }

    /** Takes a node out of the database's replica group. */
    public synchronized CompletableFuture<Void> removeFromGroup(final String nodeTag) {
        if (!replicaGroup.remove(nodeTag)) return CompletableFuture.completedFuture(null);
        activeNodes.remove(nodeTag);
        log.info("Node {} removed from the replica group", nodeTag);
        return publish();
    }

    /** Adds a node back to the end of the replica group. */
    public synchronized CompletableFuture<Void> addToGroup(final String nodeTag, final InetSocketAddress address) {
        if (replicaGroup.contains(nodeTag)) return CompletableFuture.completedFuture(null);
        replicaGroup.add(nodeTag);
        addresses.put(nodeTag, address);
        activeNodes.add(nodeTag);
        lastHeartbeat.put(nodeTag, System.currentTimeMillis());
        log.info("Node {} added to the replica group", nodeTag);
        return publish();
    }

    public synchronized TopologySnapshot snapshot() {
        return new TopologySnapshot(version, replicaGroup, activeNodes);
    }

    public synchronized Optional<InetSocketAddress> addressOf(final String nodeTag) {
        return Optional.ofNullable(addresses.get(nodeTag));
    }

    private CompletableFuture<Void> publish() {
        version++;
        final TopologySnapshot snapshot = snapshot();
        return CompletableFuture.runAsync(() -> {
            for (final TopologyListener l : listeners) {
                try {
                    l.onTopologyChanged(snapshot);
                } catch (final RuntimeException e) {
                    log.error("Topology listener failed at version {}", snapshot.version(), e);
                }
            }
        }, events);
    }

    @Override
    public void close() {
        events.shutdown();
        try {
            if (!events.awaitTermination(5, TimeUnit.SECONDS)) {
                events.shutdownNow();
            }
        } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
