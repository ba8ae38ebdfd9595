package io.docfeed;

import io.docfeed.cluster.consensus.impl.LocalConsensusLog;
import io.docfeed.cluster.failover.FailoverCoordinator;
import io.docfeed.cluster.failover.ResponsibleNodeAssigner;
import io.docfeed.cluster.manager.ClusterManager;
import io.docfeed.cluster.membership.gossip.impl.SwimGossipService;
import io.docfeed.cluster.metadata.JournaledSubscriptionStateMachine;
import io.docfeed.config.impl.NodeConfig;
import io.docfeed.config.type.ConfigLoader;
import io.docfeed.storage.impl.InMemoryDocumentStore;
import io.docfeed.subscription.SubscriptionService;
import io.docfeed.subscription.store.CursorStore;
import io.docfeed.transport.type.NettyTransport;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Comparator;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Main class to start a DocFeed node.
 */
@Slf4j
public class Application {
    public static void main(final String[] args) throws Exception {
        if (args.length < 1) {
            System.err.println("Usage: java -jar docfeed.jar <node-config.yaml>");
            System.exit(1);
        }

        final NodeConfig cfg = ConfigLoader.load(args[0]);

        /* Prepare the data directory */
        final Path dataDir = Paths.get(cfg.getDataPath()).toAbsolutePath();
        final Path subscriptionsDir = dataDir.resolve(cfg.getDatabase()).resolve("subscriptions");

        final boolean wipeOnStart = Boolean.parseBoolean(
                System.getProperty("docfeed.wipeDataOnStart",
                        System.getenv().getOrDefault("DOCFEED_WIPE_DATA_ON_START", "false"))
        );

        if (wipeOnStart && Files.exists(dataDir)) {
            log.warn("docfeed.wipeDataOnStart=true -> wiping data directory at {}", dataDir);
            try (final Stream<Path> stream = Files.walk(dataDir)) {
                stream.sorted(Comparator.reverseOrder())
                        .map(Path::toFile)
                        .forEach(file -> {
                            if (!file.delete()) {
                                log.warn("Failed to delete file: {}", file.getAbsolutePath());
                            }
                        });
            }
        } else if (Files.exists(dataDir)) {
            log.info("Reusing existing data directory at {}", dataDir);
        }
        Files.createDirectories(subscriptionsDir);

        final Clock clock = Clock.systemUTC();
        final InMemoryDocumentStore documents = new InMemoryDocumentStore();
        final JournaledSubscriptionStateMachine states = new JournaledSubscriptionStateMachine(subscriptionsDir);
        final LocalConsensusLog consensus = new LocalConsensusLog(states);
        final CursorStore cursorStore = new CursorStore(consensus, states, cfg.getCommitTimeout(), cfg.getCommitRetries(), clock);

        final ClusterManager cluster = new ClusterManager(cfg.replicaGroupAddresses(), cfg.getHeartbeatTimeoutMillis());
        final ResponsibleNodeAssigner assigner = new ResponsibleNodeAssigner(cursorStore, cluster);
        cluster.addListener(new FailoverCoordinator(consensus, assigner, states));

        final SubscriptionService service = new SubscriptionService(
                cfg.getNodeTag(), cursorStore, documents, assigner, cfg.getHeartbeatInterval(), clock);

        /* Membership: gossip heartbeats feed the cluster manager; a sweeper marks silent nodes down */
        final SwimGossipService gossip = cfg.getGossipBind() == null ? null
                : new SwimGossipService(cfg.getNodeTag(), cfg.getGossipBind(), cfg.getGossipSeeds(), cluster::handleHeartbeat);
        if (gossip != null) gossip.start();

        final ScheduledExecutorService heartbeats = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "heartbeat-checker");
            t.setDaemon(true);
            return t;
        });
        heartbeats.scheduleAtFixedRate(() -> {
            try {
                cluster.handleHeartbeat(cfg.getNodeTag());
                if (gossip != null) cluster.checkHeartbeats();
            } catch (final RuntimeException e) {
                log.error("Heartbeat check failed", e);
            }
        }, cfg.getHeartbeatIntervalMillis(), cfg.getHeartbeatIntervalMillis(), TimeUnit.MILLISECONDS);

        /* Start transport */
        final NettyTransport transport = new NettyTransport(cfg.getPort(), service, cluster, cfg.getSubscriptionDefaults());
        transport.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down DocFeed node {}...", cfg.getNodeTag());
                heartbeats.shutdownNow();
                service.close();
                transport.close();
                if (gossip != null) gossip.close();
                cluster.close();
                consensus.close();
                log.info("Shutdown complete.");
            } catch (final Exception e) {
                log.error("Error during shutdown", e);
            }
        }));

        log.info("DocFeed node {} started on port {} (database {}, replica group {})",
                cfg.getNodeTag(), transport.getPort(), cfg.getDatabase(), cfg.getReplicaGroup());
    }
}
