package io.docfeed.cluster.failover;

import io.docfeed.cluster.command.ClusterCommand;
import io.docfeed.cluster.consensus.ApplyResult;
import io.docfeed.cluster.consensus.ConsensusLog;
import io.docfeed.cluster.manager.TopologySnapshot;
import io.docfeed.core.etag.Etag;
import io.docfeed.storage.StoredDocument;
import io.docfeed.subscription.SubscriptionService;
import io.docfeed.subscription.admission.AdmissionResult;
import io.docfeed.subscription.model.CloseReason;
import io.docfeed.subscription.model.SubscriptionConnectionOptions;
import io.docfeed.subscription.model.SubscriptionCriteria;
import io.docfeed.subscription.store.CursorStore;
import io.docfeed.testing.RecordingChannel;
import io.docfeed.testing.TestCluster;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static io.docfeed.testing.TestCluster.body;
import static org.junit.jupiter.api.Assertions.*;

final class FailoverCoordinatorTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    @TempDir
    Path tmp;

    private TestCluster cluster;
    private CursorStore cursorStore;

    @BeforeEach
    void setUp() throws Exception {
        cluster = TestCluster.of(tmp, "A", "B");
        cursorStore = cluster.cursorStore();
    }

    @AfterEach
    void tearDown() {
        cluster.close();
    }

    private StoredDocument order(final String id) {
        return cluster.documents().put("orders", id, body("status", "open"));
    }

    private static SubscriptionConnectionOptions options(final String connectionId) {
        return SubscriptionConnectionOptions.builder()
                .connectionId(connectionId)
                .acknowledgmentTimeout(WAIT)
                .build();
    }

    @Test
    void newNodeResumesStrictlyAfterCommittedCheckpoint() throws Exception {
        final SubscriptionService a = cluster.service("A");
        final SubscriptionService b = cluster.service("B");
        order("o/1");
        order("o/2");
        final long id = a.create(SubscriptionCriteria.forCollection("orders"), null, "A").id();
        assertEquals("A", cursorStore.require(id).responsibleNode());

        // B refuses and points at A
        final AdmissionResult wrongNode = b.open(id, options("c0"), new RecordingChannel());
        assertEquals(CloseReason.MOVED, wrongNode.getReason());
        assertEquals("A", wrongNode.getNewNode());

        final RecordingChannel onA = new RecordingChannel();
        a.open(id, options("c1"), onA);
        final RecordingChannel.Batch first = onA.nextBatch(WAIT);
        assertEquals(List.of("o/1", "o/2"), first.ids());
        assertTrue(a.acknowledge(id, "c1", first.end()).get(5, TimeUnit.SECONDS).committed());
        final Etag committed = cursorStore.checkpoint(id);

        order("o/3");
        final RecordingChannel.Batch inFlight = onA.nextBatch(WAIT);
        assertEquals(List.of("o/3"), inFlight.ids());

        cluster.cluster().nodeDown("A").get(5, TimeUnit.SECONDS);

        assertEquals("B", cursorStore.require(id).responsibleNode());
        final RecordingChannel.Frame moved = onA.await(RecordingChannel.Kind.CLOSED, WAIT);
        assertEquals(CloseReason.MOVED, moved.reason());
        assertEquals("B", moved.newNode());
        assertEquals(committed, cursorStore.checkpoint(id));
        // a late ack on the old node is fenced
        assertFalse(a.acknowledge(id, "c1", inFlight.end()).get(5, TimeUnit.SECONDS).committed());

        final RecordingChannel onB = new RecordingChannel();
        assertEquals(AdmissionResult.Status.ACCEPTED, b.open(id, options("c1"), onB).getStatus());
        final RecordingChannel.Batch resumed = onB.nextBatch(WAIT);
        assertEquals(List.of("o/3"), resumed.ids());
        assertTrue(b.acknowledge(id, "c1", resumed.end()).get(5, TimeUnit.SECONDS).committed());
        assertEquals(resumed.end(), cursorStore.checkpoint(id));
    }

    @Test
    void mentorTakesSubscriptionBackWhenItReturns() throws Exception {
        final SubscriptionService b = cluster.service("B");
        final long id = cluster.service("A").create(SubscriptionCriteria.forCollection("orders"), null, "A").id();

        cluster.cluster().nodeDown("A").get(5, TimeUnit.SECONDS);
        final RecordingChannel onB = new RecordingChannel();
        assertEquals(AdmissionResult.Status.ACCEPTED, b.open(id, options("c1"), onB).getStatus());

        cluster.cluster().nodeUp("A").get(5, TimeUnit.SECONDS);
        assertEquals("A", cursorStore.require(id).responsibleNode());
        final RecordingChannel.Frame moved = onB.await(RecordingChannel.Kind.CLOSED, WAIT);
        assertEquals(CloseReason.MOVED, moved.reason());
        assertEquals("A", moved.newNode());
    }

    @Test
    void noLiveNodeMakesSubscriptionUnavailable() throws Exception {
        final SubscriptionService a = cluster.service("A");
        final long id = a.create(SubscriptionCriteria.forCollection("orders"), null, null).id();
        final String owner = cursorStore.require(id).responsibleNode();
        final RecordingChannel channel = new RecordingChannel();
        cluster.service(owner).open(id, options("c1"), channel);

        cluster.cluster().nodeDown("A").get(5, TimeUnit.SECONDS);
        cluster.cluster().nodeDown("B").get(5, TimeUnit.SECONDS);

        assertNull(cursorStore.require(id).responsibleNode());
        final CloseReason reason = channel.await(RecordingChannel.Kind.CLOSED, WAIT).reason();
        assertTrue(reason == CloseReason.UNAVAILABLE || reason == CloseReason.MOVED, "closed with " + reason);
        assertEquals(CloseReason.UNAVAILABLE, a.open(id, options("c2"), new RecordingChannel()).getReason());

        cluster.cluster().nodeUp("B").get(5, TimeUnit.SECONDS);
        assertEquals("B", cursorStore.require(id).responsibleNode());
    }

    @Test
    void followerDoesNotReassign() {
        final ResponsibleNodeAssigner assigner = new ResponsibleNodeAssigner(cursorStore, cluster.cluster());
        final ConsensusLog follower = new ConsensusLog() {
            @Override
            public long propose(final ClusterCommand command) {
                throw new AssertionError("follower must not propose");
            }

            @Override
            public ApplyResult waitForCommit(final long index, final Duration timeout) {
                throw new AssertionError("follower must not propose");
            }

            @Override
            public boolean isLeader() {
                return false;
            }

            @Override
            public void close() {
            }
        };
        final long id = cluster.service("A").create(SubscriptionCriteria.forCollection("orders"), null, "A").id();

        new FailoverCoordinator(follower, assigner, cluster.states())
                .onTopologyChanged(new TopologySnapshot(99L, List.of("A", "B"), Set.of("B")));
        assertEquals("A", cursorStore.require(id).responsibleNode());
    }
}
