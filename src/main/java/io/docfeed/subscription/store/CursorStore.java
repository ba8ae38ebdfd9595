package io.docfeed.subscription.store;

import io.docfeed.cluster.command.AcknowledgeBatchCommand;
import io.docfeed.cluster.command.ClusterCommand;
import io.docfeed.cluster.command.CreateSubscriptionCommand;
import io.docfeed.cluster.command.DeleteSubscriptionCommand;
import io.docfeed.cluster.command.RecordConnectionCommand;
import io.docfeed.cluster.command.ToggleSubscriptionCommand;
import io.docfeed.cluster.command.UpdateResponsibleNodeCommand;
import io.docfeed.cluster.consensus.ApplyResult;
import io.docfeed.cluster.consensus.ConsensusLog;
import io.docfeed.cluster.metadata.SubscriptionState;
import io.docfeed.cluster.metadata.SubscriptionStateStore;
import io.docfeed.core.etag.Etag;
import io.docfeed.subscription.exception.CommitFailedException;
import io.docfeed.subscription.exception.SubscriptionDoesNotExistException;
import io.docfeed.subscription.exception.SubscriptionException;
import io.docfeed.subscription.model.CloseReason;
import io.docfeed.subscription.model.SubscriptionCriteria;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Per-subscription durable state. Reads come from the local replica; every mutation is proposed to the
 * consensus log and returns only once committed.
 */
@Slf4j
public final class CursorStore {

    private final ConsensusLog consensus;
    @Getter
    private final SubscriptionStateStore states;
    private final Duration commitTimeout;
    private final int commitRetries;
    private final Clock clock;

    public CursorStore(final ConsensusLog consensus,
                       final SubscriptionStateStore states,
                       final Duration commitTimeout,
                       final int commitRetries,
                       final Clock clock) {
        this.consensus = consensus;
        this.states = states;
        this.commitTimeout = commitTimeout;
        this.commitRetries = Math.max(0, commitRetries);
        this.clock = clock;
    }

    /**
     * Registers a new subscription. Not retried on timeout: a create is not idempotent without a name.
     */
    public SubscriptionState create(final SubscriptionCriteria criteria, final String name, final String mentorNode) {
        criteria.validate();
        final ApplyResult r = commit(new CreateSubscriptionCommand(blankToNull(name), criteria,
                blankToNull(mentorNode), clock.millis()), 0);
        return require(r.subscriptionId());
    }

    public Optional<SubscriptionState> get(final long subscriptionId) {
        return states.current(subscriptionId);
    }

    public SubscriptionState require(final long subscriptionId) {
        return states.current(subscriptionId)
                .orElseThrow(() -> new SubscriptionDoesNotExistException("subscription " + subscriptionId + " does not exist"));
    }

    public Etag checkpoint(final long subscriptionId) {
        return require(subscriptionId).checkpoint();
    }

    /**
     * Advances the checkpoint to {@code etag} on behalf of {@code nodeTag}.
     *
     * @param ackTimeMillis client acknowledgment time, 0 for silent acknowledgments
     * @return false if the checkpoint was already at or past {@code etag}
     * @throws SubscriptionException if the node is no longer responsible, or the subscription is gone or disabled
     */
    public boolean acknowledge(final long subscriptionId, final Etag etag, final String nodeTag, final long ackTimeMillis) {
        return commit(new AcknowledgeBatchCommand(subscriptionId, etag, nodeTag, ackTimeMillis), commitRetries).applied();
    }

    public void recordConnection(final long subscriptionId) {
        commit(new RecordConnectionCommand(subscriptionId, clock.millis()), commitRetries);
    }

    /**
     * Compare-and-set of the responsible node.
     *
     * @return true if the assignment now equals {@code newNode}
     */
    public boolean updateResponsibleNode(final long subscriptionId, final String expectedNode, final String newNode) {
        final ApplyResult r = consensusCommit(new UpdateResponsibleNodeCommand(subscriptionId, expectedNode, newNode), commitRetries);
        if (r.isRejected()) {
            log.debug("Reassignment of subscription {} not applied: {}", subscriptionId, r.message());
            return false;
        }
        return true;
    }

    public void setDisabled(final long subscriptionId, final boolean disabled) {
        commit(new ToggleSubscriptionCommand(subscriptionId, disabled), commitRetries);
    }

    public boolean delete(final long subscriptionId) {
        return commit(new DeleteSubscriptionCommand(subscriptionId), commitRetries).applied();
    }

    public List<SubscriptionState> list(final int start, final int pageSize) {
        return states.list(start, pageSize);
    }

    public long now() {
        return clock.millis();
    }

    private ApplyResult commit(final ClusterCommand command, final int retries) {
        final ApplyResult r = consensusCommit(command, retries);
        if (r.isRejected()) {
            throw SubscriptionException.fromReason(r.rejection(), r.message(), r.newNode());
        }
        return r;
    }

    private ApplyResult consensusCommit(final ClusterCommand command, final int retries) {
        CommitFailedException last = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            try {
                final long index = consensus.propose(command);
                final ApplyResult r = consensus.waitForCommit(index, commitTimeout);
                if (r.rejection() != CloseReason.COMMIT_FAILED || attempt == retries) {
                    return r;
                }
                last = new CommitFailedException(r.message(), null);
            } catch (final TimeoutException e) {
                last = new CommitFailedException(command.getClass().getSimpleName() + " did not commit within " + commitTimeout, e);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CommitFailedException("interrupted while waiting for " + command.getClass().getSimpleName(), e);
            } catch (final IllegalStateException e) {
                last = new CommitFailedException(e.getMessage(), e);
            }
            if (attempt < retries) {
                log.warn("Commit of {} failed (attempt {}/{}): {}",
                        command.getClass().getSimpleName(), attempt + 1, retries + 1, last.getMessage());
            }
        }
        throw last;
    }

    private static String blankToNull(final String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
