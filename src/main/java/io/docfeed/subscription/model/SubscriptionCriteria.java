package io.docfeed.subscription.model;

import com.google.protobuf.Value;
import io.docfeed.core.etag.Etag;
import lombok.Builder;
import lombok.Singular;

import java.util.Map;

/**
 * Which documents a subscription delivers: a collection plus optional key prefix and field filters.
 * Field paths are dotted ({@code address.city}).
 */
@Builder(toBuilder = true)
public record SubscriptionCriteria(String collection,
                                   String keyStartsWith,
                                   @Singular("match") Map<String, Value> propertiesMatch,
                                   @Singular("notMatch") Map<String, Value> propertiesNotMatch,
                                   Etag startEtag) {

    public SubscriptionCriteria {
        propertiesMatch = propertiesMatch == null ? Map.of() : Map.copyOf(propertiesMatch);
        propertiesNotMatch = propertiesNotMatch == null ? Map.of() : Map.copyOf(propertiesNotMatch);
        startEtag = startEtag == null ? Etag.ZERO : startEtag;
        keyStartsWith = keyStartsWith == null || keyStartsWith.isEmpty() ? null : keyStartsWith;
    }

    public static SubscriptionCriteria forCollection(final String collection) {
        return builder().collection(collection).build();
    }

    public void validate() {
        if (collection == null || collection.isBlank()) {
            throw new IllegalArgumentException("criteria.collection must not be blank");
        }
        for (final String path : propertiesMatch.keySet()) {
            requirePath(path);
        }
        for (final String path : propertiesNotMatch.keySet()) {
            requirePath(path);
        }
    }

    private static void requirePath(final String path) {
        if (path == null || path.isBlank() || path.startsWith(".") || path.endsWith(".") || path.contains("..")) {
            throw new IllegalArgumentException("invalid property path: '" + path + "'");
        }
    }
}
