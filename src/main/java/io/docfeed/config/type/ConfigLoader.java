package io.docfeed.config.type;

import io.docfeed.config.impl.NodeConfig;

import java.io.IOException;

public final class ConfigLoader {

    private ConfigLoader() {
    }

    /**
     * Loads node configuration from a YAML file by delegating to {@link NodeConfig#load(String)}.
     * <p>
     * Expected structure:
     * <pre>
     * nodeTag: A
     * port: 9090
     * database: orders
     * dataPath: data
     * clusterNodes:
     *   - { tag: A, host: localhost, port: 9090 }
     *   - { tag: B, host: localhost, port: 9091 }
     * replicaGroup: [A, B]
     * gossip:
     *   bind: { host: localhost, port: 7946 }
     *   seeds:
     *     - { host: localhost, port: 7947 }
     * subscriptionDefaults:
     *   maxDocCount: 4096
     *   acknowledgmentTimeoutMillis: 60000
     * </pre>
     *
     * @param path the path to the node YAML configuration file
     * @return a populated {@link NodeConfig} instance
     * @throws IOException if the file cannot be read, or a required key is missing
     */
    public static NodeConfig load(final String path) throws IOException {
        return NodeConfig.load(path);
    }
}
