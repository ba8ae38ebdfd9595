package io.docfeed.config.impl;

import io.docfeed.subscription.model.SubscriptionConnectionOptions;
import io.docfeed.subscription.model.SubscriptionOpeningStrategy;
import lombok.Getter;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable config holder loaded from node.yaml
 */
@Getter
public final class NodeConfig {

    private String nodeTag;
    private int port;
    private String database;
    private String dataPath;

    /** Every known node, in declaration order. */
    private Map<String, InetSocketAddress> clusterNodes;
    /** Nodes holding a replica of {@link #database}, in preference order. */
    private List<String> replicaGroup;

    private InetSocketAddress gossipBind;
    private List<InetSocketAddress> gossipSeeds;

    private long heartbeatTimeoutMillis;
    private long heartbeatIntervalMillis;
    private long commitTimeoutMillis;
    private int commitRetries;

    private SubscriptionConnectionOptions subscriptionDefaults;

    @SuppressWarnings("unchecked")
    public static NodeConfig load(final String path) throws IOException {
        final Yaml yaml = new Yaml();

        try (InputStream in = Files.newInputStream(Paths.get(path))) {
            final Map<String, Object> m = yaml.load(in);
            if (m == null) throw new IOException("empty configuration: " + path);
            final NodeConfig cfg = new NodeConfig();

            cfg.nodeTag  = required(m, "nodeTag");
            cfg.port     = (Integer) m.getOrDefault("port", 9090);
            cfg.database = (String)  m.getOrDefault("database", "default");
            cfg.dataPath = (String)  m.getOrDefault("dataPath", "data");

            cfg.clusterNodes = new LinkedHashMap<>();
            final List<Map<String, Object>> nodes = (List<Map<String, Object>>) m.get("clusterNodes");
            if (nodes != null) {
                for (final Map<String, Object> n : nodes) {
                    cfg.clusterNodes.put(required(n, "tag"),
                            new InetSocketAddress((String) n.get("host"), (Integer) n.get("port")));
                }
            }
            cfg.clusterNodes.putIfAbsent(cfg.nodeTag, new InetSocketAddress("localhost", cfg.port));

            final List<String> group = (List<String>) m.get("replicaGroup");
            cfg.replicaGroup = group == null ? List.copyOf(cfg.clusterNodes.keySet()) : List.copyOf(group);
            for (final String tag : cfg.replicaGroup) {
                if (!cfg.clusterNodes.containsKey(tag)) {
                    throw new IOException("replicaGroup member " + tag + " is not listed in clusterNodes");
                }
            }

            final Map<String, Object> gossip = (Map<String, Object>) m.get("gossip");
            if (gossip != null) {
                final Map<String, Object> bind = (Map<String, Object>) gossip.get("bind");
                cfg.gossipBind = new InetSocketAddress((String) bind.get("host"), (Integer) bind.get("port"));
                final List<Map<String, Object>> seeds = (List<Map<String, Object>>) gossip.getOrDefault("seeds", List.of());
                cfg.gossipSeeds = seeds.stream()
                        .map(s -> new InetSocketAddress((String) s.get("host"), (Integer) s.get("port")))
                        .toList();
            } else {
                cfg.gossipSeeds = List.of();
            }

            cfg.heartbeatTimeoutMillis  = number(m, "heartbeatTimeoutMillis", 10_000L);
            cfg.heartbeatIntervalMillis = number(m, "heartbeatIntervalMillis", 1_000L);
            cfg.commitTimeoutMillis     = number(m, "commitTimeoutMillis", 5_000L);
            cfg.commitRetries           = (int) number(m, "commitRetries", 3L);

            cfg.subscriptionDefaults = subscriptionDefaults(
                    (Map<String, Object>) m.getOrDefault("subscriptionDefaults", Map.of()));
            try {
                cfg.subscriptionDefaults.validate();
            } catch (final IllegalArgumentException e) {
                throw new IOException("invalid subscriptionDefaults: " + e.getMessage(), e);
            }

            return cfg;
        }
    }

    public Duration getCommitTimeout() {
        return Duration.ofMillis(commitTimeoutMillis);
    }

    public Duration getHeartbeatInterval() {
        return Duration.ofMillis(heartbeatIntervalMillis);
    }

    /** Addresses of the replica group, in group order. */
    public Map<String, InetSocketAddress> replicaGroupAddresses() {
        final Map<String, InetSocketAddress> out = new LinkedHashMap<>();
        for (final String tag : replicaGroup) {
            out.put(tag, clusterNodes.get(tag));
        }
        return out;
    }

    private static SubscriptionConnectionOptions subscriptionDefaults(final Map<String, Object> m) {
        final SubscriptionConnectionOptions.SubscriptionConnectionOptionsBuilder b = SubscriptionConnectionOptions.builder();
        if (m.containsKey("strategy")) {
            b.strategy(SubscriptionOpeningStrategy.valueOf(((String) m.get("strategy")).toUpperCase()));
        }
        if (m.containsKey("maxDocCount")) b.maxDocCount((Integer) m.get("maxDocCount"));
        if (m.containsKey("maxSizeBytes")) b.maxSize(((Number) m.get("maxSizeBytes")).longValue());
        if (m.containsKey("acknowledgmentTimeoutMillis")) {
            b.acknowledgmentTimeout(Duration.ofMillis(((Number) m.get("acknowledgmentTimeoutMillis")).longValue()));
        }
        if (m.containsKey("clientAliveNotificationIntervalMillis")) {
            b.clientAliveNotificationInterval(Duration.ofMillis(((Number) m.get("clientAliveNotificationIntervalMillis")).longValue()));
        }
        if (m.containsKey("timeToWaitBeforeConnectionRetryMillis")) {
            b.timeToWaitBeforeConnectionRetry(Duration.ofMillis(((Number) m.get("timeToWaitBeforeConnectionRetryMillis")).longValue()));
        }
        if (m.containsKey("ignoreSubscribersErrors")) b.ignoreSubscribersErrors((Boolean) m.get("ignoreSubscribersErrors"));
        if (m.containsKey("maxConsecutiveFailures")) b.maxConsecutiveFailures((Integer) m.get("maxConsecutiveFailures"));
        return b.build();
    }

    private static String required(final Map<String, Object> m, final String key) throws IOException {
        final Object v = m.get(key);
        if (!(v instanceof final String s) || s.isBlank()) {
            throw new IOException("missing required key '" + key + "'");
        }
        return s;
    }

    private static long number(final Map<String, Object> m, final String key, final long def) {
        final Object v = m.get(key);
        return v == null ? def : ((Number) v).longValue();
    }
}
