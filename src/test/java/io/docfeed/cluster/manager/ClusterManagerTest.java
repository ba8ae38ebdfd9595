package io.docfeed.cluster.manager;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class ClusterManagerTest {

    private ClusterManager manager;
    private final List<TopologySnapshot> published = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        final Map<String, InetSocketAddress> members = new LinkedHashMap<>();
        members.put("A", new InetSocketAddress("localhost", 9001));
        members.put("B", new InetSocketAddress("localhost", 9002));
        manager = new ClusterManager(members, 100L);
        manager.addListener(published::add);
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    @Test
    void nodeDownAndUpPublishSnapshots() throws Exception {
        manager.nodeDown("A").get(5, TimeUnit.SECONDS);
        assertEquals(List.of("B"), manager.snapshot().liveMembers());
        assertEquals(1, published.size());
        assertFalse(published.get(0).isLive("A"));

        // repeated transitions are not published
        manager.nodeDown("A").get(5, TimeUnit.SECONDS);
        assertEquals(1, published.size());

        manager.nodeUp("A").get(5, TimeUnit.SECONDS);
        assertEquals(List.of("A", "B"), manager.snapshot().liveMembers());
        assertEquals(2, published.size());
        assertTrue(published.get(1).version() > published.get(0).version());
    }

    @Test
    void missedHeartbeatsMarkNodeDown() throws Exception {
        final long now = System.currentTimeMillis();
        manager.nodeUp("B", now + 1_000).get(5, TimeUnit.SECONDS);

        manager.checkHeartbeats(now + 1_050).get(5, TimeUnit.SECONDS);
        assertEquals(Set.of("B"), manager.snapshot().liveNodes());
        assertEquals(1, published.size());
    }

    @Test
    void heartbeatRevivesNode() throws Exception {
        manager.nodeDown("B").get(5, TimeUnit.SECONDS);
        manager.handleHeartbeat("B");
        manager.checkHeartbeats().get(5, TimeUnit.SECONDS);
        assertTrue(manager.snapshot().isLive("B"));
    }

    @Test
    void unknownNodesAreIgnored() throws Exception {
        manager.nodeUp("Z").get(5, TimeUnit.SECONDS);
        manager.handleHeartbeat("Z");
        assertFalse(manager.snapshot().isLive("Z"));
        assertTrue(published.isEmpty());
    }

    @Test
    void groupMembershipChanges() throws Exception {
        manager.removeFromGroup("A").get(5, TimeUnit.SECONDS);
        assertEquals(List.of("B"), manager.snapshot().replicaGroup());

        final InetSocketAddress c = new InetSocketAddress("localhost", 9003);
        manager.addToGroup("C", c).get(5, TimeUnit.SECONDS);
        assertEquals(List.of("B", "C"), manager.snapshot().liveMembers());
        assertEquals(c, manager.addressOf("C").orElseThrow());
        assertEquals(2, published.size());
    }

    @Test
    void failingListenerDoesNotBlockOthers() throws Exception {
        final List<Long> seen = new CopyOnWriteArrayList<>();
        manager.addListener(t -> {
            throw new IllegalStateException("boom");
        });
        manager.addListener(t -> seen.add(t.version()));

        manager.nodeDown("B").get(5, TimeUnit.SECONDS);
        assertEquals(1, seen.size());
    }
}
