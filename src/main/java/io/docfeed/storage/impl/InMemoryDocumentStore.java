package io.docfeed.storage.impl;

import com.google.protobuf.Struct;
import io.docfeed.core.etag.Etag;
import io.docfeed.storage.ChangeNotifier;
import io.docfeed.storage.DocumentStore;
import io.docfeed.storage.StoredDocument;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Heap-backed document store. Writes are serialized so etags enter each collection index in
 * increasing order, which keeps concurrent scans gap-free.
 */
public final class InMemoryDocumentStore implements DocumentStore {

    private final Map<String, NavigableMap<Long, StoredDocument>> byCollection = new ConcurrentHashMap<>();
    private final Map<String, StoredDocument> byId = new ConcurrentHashMap<>();
    private final ChangeNotifier changes = new ChangeNotifier();
    private volatile long lastEtag;

    /**
     * Inserts or replaces a document. A replaced document moves to the new etag.
     */
    public StoredDocument put(final String collection, final String id, final Struct body) {
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(id, "id");
        final StoredDocument doc;
        synchronized (this) {
            final StoredDocument previous = byId.get(id);
            if (previous != null) {
                index(previous.collection()).remove(previous.etag().value());
            }
            doc = new StoredDocument(id, collection, Etag.of(lastEtag + 1), body == null ? Struct.getDefaultInstance() : body);
            index(collection).put(doc.etag().value(), doc);
            byId.put(id, doc);
            lastEtag = doc.etag().value();
        }
        changes.notifyChanged(collection);
        return doc;
    }

    public boolean delete(final String id) {
        synchronized (this) {
            final StoredDocument previous = byId.remove(id);
            if (previous == null) return false;
            index(previous.collection()).remove(previous.etag().value());
            return true;
        }
    }

    public StoredDocument get(final String id) {
        return byId.get(id);
    }

    @Override
    public List<StoredDocument> scanAfter(final String collection, final Etag after, final int limit) {
        final NavigableMap<Long, StoredDocument> index = byCollection.get(collection);
        if (index == null || limit <= 0) return List.of();

        final List<StoredDocument> out = new ArrayList<>(Math.min(limit, 256));
        for (final StoredDocument doc : index.tailMap(after.value(), false).values()) {
            out.add(doc);
            if (out.size() >= limit) break;
        }
        return out;
    }

    @Override
    public Etag lastEtag() {
        return Etag.of(lastEtag);
    }

    @Override
    public ChangeNotifier changes() {
        return changes;
    }

    private NavigableMap<Long, StoredDocument> index(final String collection) {
        return byCollection.computeIfAbsent(collection, c -> new ConcurrentSkipListMap<>());
    }
}
