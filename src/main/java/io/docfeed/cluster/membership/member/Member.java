package io.docfeed.cluster.membership.member;

import java.net.InetSocketAddress;

/**
 * Immutable membership entry, updated on each valid heartbeat.
 */
public record Member(String nodeTag,
                     InetSocketAddress address,
                     long timestampMillis) {
}
