package io.docfeed.subscription.criteria;

import com.google.protobuf.Struct;
import com.google.protobuf.Value;
import io.docfeed.storage.StoredDocument;
import io.docfeed.subscription.model.SubscriptionCriteria;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Evaluates {@link SubscriptionCriteria} against stored documents.
 */
public final class CriteriaMatcher {

    /** Ids under this prefix belong to the database itself and are never delivered. */
    public static final String SYSTEM_PREFIX = "@system/";

    private static final Pattern DOT = Pattern.compile("\\.");

    private final SubscriptionCriteria criteria;

    public CriteriaMatcher(final SubscriptionCriteria criteria) {
        this.criteria = criteria;
    }

    public boolean matches(final StoredDocument doc) {
        if (!criteria.collection().equals(doc.collection())) return false;
        if (doc.id().startsWith(SYSTEM_PREFIX)) return false;
        if (criteria.keyStartsWith() != null && !doc.id().startsWith(criteria.keyStartsWith())) return false;

        for (final Map.Entry<String, Value> e : criteria.propertiesMatch().entrySet()) {
            final Optional<Value> actual = resolve(doc.body(), e.getKey());
            if (actual.isEmpty() || !actual.get().equals(e.getValue())) return false;
        }
        for (final Map.Entry<String, Value> e : criteria.propertiesNotMatch().entrySet()) {
            final Optional<Value> actual = resolve(doc.body(), e.getKey());
            if (actual.isPresent() && actual.get().equals(e.getValue())) return false;
        }
        return true;
    }

    /** Follows a dotted path through nested structs; absent when any segment is missing. */
    static Optional<Value> resolve(final Struct body, final String path) {
        Struct current = body;
        final String[] segments = DOT.split(path);
        for (int i = 0; i < segments.length; i++) {
            final Value v = current.getFieldsMap().get(segments[i]);
            if (v == null) return Optional.empty();
            if (i == segments.length - 1) return Optional.of(v);
            if (!v.hasStructValue()) return Optional.empty();
            current = v.getStructValue();
        }
        return Optional.empty();
    }
}
