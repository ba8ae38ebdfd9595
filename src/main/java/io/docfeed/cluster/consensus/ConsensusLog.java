package io.docfeed.cluster.consensus;

import io.docfeed.cluster.command.ClusterCommand;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * The replicated log as seen by the subscription subsystem: propose a command, then wait for it to
 * be committed and applied.
 */
public interface ConsensusLog extends AutoCloseable {

    /**
     * Appends a command and returns its log index.
     *
     * @throws IllegalStateException if the log no longer accepts proposals
     */
    long propose(ClusterCommand command);

    /**
     * Blocks until the entry at {@code index} is applied locally.
     *
     * @throws TimeoutException if it is not applied within {@code timeout}
     */
    ApplyResult waitForCommit(long index, Duration timeout) throws TimeoutException, InterruptedException;

    /** Only the leader drives cluster-wide reassignment. */
    boolean isLeader();

    @Override
    void close();
}
