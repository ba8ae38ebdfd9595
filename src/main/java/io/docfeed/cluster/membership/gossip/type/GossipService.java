package io.docfeed.cluster.membership.gossip.type;

import io.docfeed.cluster.membership.member.Member;

import java.util.Map;

/**
 * Contract for a background membership service (SWIM, etc.).
 */
public interface GossipService extends AutoCloseable {

    /**
     * Live immutable view keyed by node tag.
     */
    Map<String, Member> view();

    /**
     * Starts network I/O and schedulers.
     */
    void start();

    @Override
    void close();
}
