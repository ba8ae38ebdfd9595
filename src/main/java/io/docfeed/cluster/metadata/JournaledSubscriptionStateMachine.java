package io.docfeed.cluster.metadata;

import io.docfeed.api.SubscriptionApi;
import io.docfeed.cluster.command.AcknowledgeBatchCommand;
import io.docfeed.cluster.command.ClusterCommand;
import io.docfeed.cluster.command.CreateSubscriptionCommand;
import io.docfeed.cluster.command.DeleteSubscriptionCommand;
import io.docfeed.cluster.command.RecordConnectionCommand;
import io.docfeed.cluster.command.ToggleSubscriptionCommand;
import io.docfeed.cluster.command.UpdateResponsibleNodeCommand;
import io.docfeed.cluster.consensus.ApplyResult;
import io.docfeed.cluster.consensus.StateMachine;
import io.docfeed.core.etag.Etag;
import io.docfeed.subscription.model.CloseReason;
import io.docfeed.subscription.model.ModelProtos;
import io.docfeed.subscription.model.SubscriptionCriteria;
import lombok.extern.slf4j.Slf4j;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Durable subscription state backed by one file per subscription, rewritten atomically on each change.
 * Commands are applied by a single writer; reads are lock-free.
 */
@Slf4j
public final class JournaledSubscriptionStateMachine implements StateMachine, SubscriptionStateStore {
    private static final String FILE_PREFIX = "subscription-";
    private static final String FILE_SUFFIX = ".meta";
    private static final String SEQUENCE_FILE = "sequence.meta";
    private static final int FORMAT_VERSION = 1;

    private final Path dir;
    private final ConcurrentNavigableMap<Long, SubscriptionState> byId = new ConcurrentSkipListMap<>();
    private final ConcurrentMap<String, Long> idByName = new ConcurrentHashMap<>();
    private final List<SubscriptionStateListener> listeners = new CopyOnWriteArrayList<>();
    private final ReentrantLock writeLock = new ReentrantLock();
    private long lastId;

    public JournaledSubscriptionStateMachine(final Path dir) throws IOException {
        this.dir = dir;
        Files.createDirectories(dir);
        recover();
    }

    @Override
    public Optional<SubscriptionState> current(final long subscriptionId) {
        return Optional.ofNullable(byId.get(subscriptionId));
    }

    @Override
    public Optional<SubscriptionState> byName(final String name) {
        final Long id = idByName.get(name);
        return id == null ? Optional.empty() : current(id);
    }

    @Override
    public List<SubscriptionState> list(final int start, final int pageSize) {
        return byId.values().stream()
                .skip(Math.max(0, start))
                .limit(Math.max(0, pageSize))
                .toList();
    }

    @Override
    public List<SubscriptionState> all() {
        return List.copyOf(byId.values());
    }

    @Override
    public void addListener(final SubscriptionStateListener listener) {
        listeners.add(listener);
    }

    @Override
    public ApplyResult apply(final long index, final ClusterCommand command) {
        writeLock.lock();
        try {
            if (command instanceof final CreateSubscriptionCommand c) return create(c);
            if (command instanceof final AcknowledgeBatchCommand c) return acknowledge(c);
            if (command instanceof final UpdateResponsibleNodeCommand c) return updateResponsible(c);
            if (command instanceof final ToggleSubscriptionCommand c) return toggle(c);
            if (command instanceof final DeleteSubscriptionCommand c) return delete(c);
            if (command instanceof final RecordConnectionCommand c) return recordConnection(c);
            throw new IllegalArgumentException("Unknown command " + command.getClass().getName());
        } finally {
            writeLock.unlock();
        }
    }

    private ApplyResult create(final CreateSubscriptionCommand c) {
        try {
            c.criteria().validate();
        } catch (final IllegalArgumentException e) {
            return ApplyResult.rejected(-1L, CloseReason.INVALID_REQUEST, e.getMessage());
        }
        if (c.name() != null && idByName.containsKey(c.name())) {
            return ApplyResult.rejected(-1L, CloseReason.INVALID_REQUEST,
                    "subscription name '" + c.name() + "' already exists");
        }
        final long id = lastId + 1;
        final String name = c.name() != null ? c.name() : "subscriptions/" + id;
        if (idByName.containsKey(name)) {
            return ApplyResult.rejected(-1L, CloseReason.INVALID_REQUEST, "subscription name '" + name + "' already exists");
        }
        final SubscriptionState st = new SubscriptionState(id, name, c.criteria(), c.criteria().startEtag(),
                c.mentorNode(), null, false, 0L, 0L, c.timestampMillis());

        persistSequence(id);
        lastId = id;
        store(null, st);
        log.info("Created subscription {} ('{}') on collection '{}'", id, name, c.criteria().collection());
        return ApplyResult.applied(id);
    }

    private ApplyResult acknowledge(final AcknowledgeBatchCommand c) {
        final SubscriptionState st = byId.get(c.subscriptionId());
        if (st == null) return notFound(c.subscriptionId());
        if (st.disabled()) {
            return ApplyResult.rejected(st.id(), CloseReason.DISABLED, "subscription " + st.id() + " is disabled");
        }
        if (c.nodeTag() != null && !c.nodeTag().equals(st.responsibleNode())) {
            return ApplyResult.moved(st.id(), st.responsibleNode());
        }
        if (c.etag().compareTo(st.checkpoint()) <= 0) {
            return ApplyResult.unchanged(st.id());
        }
        store(st, st.withCheckpoint(c.etag(), c.ackTimeMillis()));
        return ApplyResult.applied(st.id());
    }

    private ApplyResult updateResponsible(final UpdateResponsibleNodeCommand c) {
        final SubscriptionState st = byId.get(c.subscriptionId());
        if (st == null) return notFound(c.subscriptionId());
        if (Objects.equals(st.responsibleNode(), c.newNode())) {
            return ApplyResult.unchanged(st.id());
        }
        if (!Objects.equals(st.responsibleNode(), c.expectedNode())) {
            return ApplyResult.assignmentConflict(st.id(), c.expectedNode(), st.responsibleNode());
        }
        store(st, st.withResponsibleNode(c.newNode()));
        log.info("Subscription {} responsible node {} -> {}", st.id(), c.expectedNode(), c.newNode());
        return ApplyResult.applied(st.id());
    }

    private ApplyResult toggle(final ToggleSubscriptionCommand c) {
        final SubscriptionState st = byId.get(c.subscriptionId());
        if (st == null) return notFound(c.subscriptionId());
        if (st.disabled() == c.disabled()) return ApplyResult.unchanged(st.id());
        store(st, st.withDisabled(c.disabled()));
        log.info("Subscription {} {}", st.id(), c.disabled() ? "disabled" : "enabled");
        return ApplyResult.applied(st.id());
    }

    private ApplyResult delete(final DeleteSubscriptionCommand c) {
        final SubscriptionState st = byId.remove(c.subscriptionId());
        if (st == null) return ApplyResult.unchanged(c.subscriptionId());
        idByName.remove(st.name());
        try {
            Files.deleteIfExists(fileFor(st.id()));
        } catch (final IOException ioe) {
            throw new UncheckedIOException("Failed to delete metadata for subscription " + st.id(), ioe);
        }
        log.info("Deleted subscription {} ('{}')", st.id(), st.name());
        fire(st, null);
        return ApplyResult.applied(st.id());
    }

    private ApplyResult recordConnection(final RecordConnectionCommand c) {
        final SubscriptionState st = byId.get(c.subscriptionId());
        if (st == null) return notFound(c.subscriptionId());
        if (c.timestampMillis() <= st.lastClientConnectionTimeMillis()) return ApplyResult.unchanged(st.id());
        store(st, st.withLastClientConnectionTime(c.timestampMillis()));
        return ApplyResult.applied(st.id());
    }

    private static ApplyResult notFound(final long id) {
        return ApplyResult.rejected(id, CloseReason.NOT_FOUND, "subscription " + id + " does not exist");
    }

    private void store(final SubscriptionState before, final SubscriptionState after) {
        try {
            persist(after);
        } catch (final IOException ioe) {
            throw new UncheckedIOException("Failed to persist metadata for subscription " + after.id(), ioe);
        }
        byId.put(after.id(), after);
        idByName.put(after.name(), after.id());
        fire(before, after);
    }

    private void fire(final SubscriptionState before, final SubscriptionState after) {
        for (final SubscriptionStateListener l : listeners) {
            try {
                l.onStateChanged(before, after);
            } catch (final RuntimeException e) {
                log.error("Subscription state listener failed", e);
            }
        }
    }

    private void recover() throws IOException {
        final Path seq = dir.resolve(SEQUENCE_FILE);
        if (Files.exists(seq)) {
            try (final DataInputStream in = new DataInputStream(Files.newInputStream(seq))) {
                lastId = in.readLong();
            }
        }

        final List<Path> files;
        try (final Stream<Path> stream = Files.list(dir)) {
            files = stream.filter(p -> {
                final String n = p.getFileName().toString();
                return n.startsWith(FILE_PREFIX) && n.endsWith(FILE_SUFFIX);
            }).toList();
        }

        for (final Path f : files) {
            try {
                final SubscriptionState st = readFromDisk(f);
                byId.put(st.id(), st);
                idByName.put(st.name(), st.id());
                lastId = Math.max(lastId, st.id());
            } catch (final IOException ioe) {
                log.warn("Failed to load subscription metadata from {}: {}", f, ioe.toString());
            }
        }
        log.info("Recovered {} subscriptions from {}", byId.size(), dir);
    }

    private Path fileFor(final long id) {
        return dir.resolve(FILE_PREFIX + id + FILE_SUFFIX);
    }

    private static SubscriptionState readFromDisk(final Path f) throws IOException {
        try (final DataInputStream in = new DataInputStream(Files.newInputStream(f))) {
            final int version = in.readInt();
            if (version != FORMAT_VERSION) {
                throw new IOException("unsupported metadata format " + version);
            }
            final long id = in.readLong();
            final String name = in.readUTF();
            final byte[] criteriaBytes = new byte[in.readInt()];
            in.readFully(criteriaBytes);
            final SubscriptionCriteria criteria = ModelProtos.fromProto(SubscriptionApi.Criteria.parseFrom(criteriaBytes));
            final Etag checkpoint = Etag.of(in.readLong());
            final String mentor = readNullable(in);
            final String responsible = readNullable(in);
            final boolean disabled = in.readBoolean();
            final long lastAck = in.readLong();
            final long lastConnection = in.readLong();
            final long createdAt = in.readLong();
            return new SubscriptionState(id, name, criteria, checkpoint, mentor, responsible, disabled,
                    lastAck, lastConnection, createdAt);
        }
    }

    private void persist(final SubscriptionState st) throws IOException {
        final Path target = fileFor(st.id());
        final Path tmp = target.resolveSibling(target.getFileName().toString() + ".tmp");
        try (final DataOutputStream out = new DataOutputStream(Files.newOutputStream(tmp))) {
            out.writeInt(FORMAT_VERSION);
            out.writeLong(st.id());
            out.writeUTF(st.name());
            final byte[] criteriaBytes = ModelProtos.toProto(st.criteria()).toByteArray();
            out.writeInt(criteriaBytes.length);
            out.write(criteriaBytes);
            out.writeLong(st.checkpoint().value());
            writeNullable(out, st.mentorNode());
            writeNullable(out, st.responsibleNode());
            out.writeBoolean(st.disabled());
            out.writeLong(st.lastBatchAckTimeMillis());
            out.writeLong(st.lastClientConnectionTimeMillis());
            out.writeLong(st.createdAtMillis());
            out.flush();
        }
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private void persistSequence(final long id) {
        final Path target = dir.resolve(SEQUENCE_FILE);
        final Path tmp = target.resolveSibling(SEQUENCE_FILE + ".tmp");
        try {
            try (final DataOutputStream out = new DataOutputStream(Files.newOutputStream(tmp))) {
                out.writeLong(id);
            }
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (final IOException ioe) {
            throw new UncheckedIOException("Failed to persist subscription id sequence", ioe);
        }
    }

    private static void writeNullable(final DataOutputStream out, final String s) throws IOException {
        out.writeBoolean(s != null);
        if (s != null) out.writeUTF(s);
    }

    private static String readNullable(final DataInputStream in) throws IOException {
        return in.readBoolean() ? in.readUTF() : null;
    }

    /** Highest id ever assigned, including deleted subscriptions. */
    long lastId() {
        return lastId;
    }
}
