package io.docfeed.cluster.consensus.impl;

import io.docfeed.cluster.command.ClusterCommand;
import io.docfeed.cluster.consensus.ApplyResult;
import io.docfeed.cluster.consensus.ConsensusLog;
import io.docfeed.cluster.consensus.StateMachine;
import io.docfeed.subscription.model.CloseReason;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-node log: proposals are queued and applied in index order by one applier thread.
 * Stands in for the replicated log when the node is its own quorum.
 */
@Slf4j
public final class LocalConsensusLog implements ConsensusLog {

    private static final long POLL_MILLIS = 100L;

    private final StateMachine stateMachine;
    private final BlockingQueue<Entry> queue = new LinkedBlockingQueue<>();
    private final ConcurrentMap<Long, CompletableFuture<ApplyResult>> results = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(true);

    private final ExecutorService applier = Executors.newSingleThreadExecutor(r -> {
        final Thread t = new Thread(r, "consensus-applier");
        t.setDaemon(true);
        return t;
    });

    private long lastIndex;

    public LocalConsensusLog(final StateMachine stateMachine) {
        this.stateMachine = stateMachine;
        applier.submit(this::applyLoop);
    }

    @Override
    public synchronized long propose(final ClusterCommand command) {
        if (!running.get()) {
            throw new IllegalStateException("consensus log is closed");
        }
        final long index = ++lastIndex;
        results.put(index, new CompletableFuture<>());
        queue.add(new Entry(index, command));
        return index;
    }

    @Override
    public ApplyResult waitForCommit(final long index, final Duration timeout) throws TimeoutException, InterruptedException {
        final CompletableFuture<ApplyResult> f = results.get(index);
        if (f == null) {
            throw new IllegalArgumentException("unknown or already consumed index " + index);
        }
        try {
            return f.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (final ExecutionException | CancellationException e) {
            return ApplyResult.rejected(-1L, CloseReason.COMMIT_FAILED, "entry " + index + " was not applied: " + e);
        } finally {
            // a caller that timed out re-proposes; the index is never waited on again
            results.remove(index);
        }
    }

    /** Proposals whose result has not been consumed yet. */
    int inFlight() {
        return results.size();
    }

    @Override
    public boolean isLeader() {
        return true;
    }

    private void applyLoop() {
        while (running.get() || !queue.isEmpty()) {
            final Entry e;
            try {
                e = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (final InterruptedException ie) {
                Thread.currentThread().interrupt();
                return;
            }
            if (e == null) continue;

            ApplyResult result;
            try {
                result = stateMachine.apply(e.index(), e.command());
            } catch (final RuntimeException ex) {
                log.error("Failed to apply entry {} ({})", e.index(), e.command().getClass().getSimpleName(), ex);
                result = ApplyResult.rejected(-1L, CloseReason.COMMIT_FAILED, ex.getMessage());
            }
            final CompletableFuture<ApplyResult> f = results.get(e.index());
            if (f != null) f.complete(result);
        }
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) return;
        applier.shutdown();
        try {
            if (!applier.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Consensus applier did not terminate within 5s");
                applier.shutdownNow();
            }
        } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
        results.values().forEach(f -> f.cancel(false));
        results.clear();
    }

    private record Entry(long index, ClusterCommand command) {
    }
}
