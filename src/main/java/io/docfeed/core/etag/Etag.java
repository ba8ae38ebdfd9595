package io.docfeed.core.etag;

/**
 * Position of a document in the change stream of its database.
 * Etags are assigned by storage in strictly increasing order; {@link #ZERO} precedes every document.
 */
public record Etag(long value) implements Comparable<Etag> {

    public static final Etag ZERO = new Etag(0L);

    public Etag {
        if (value < 0) {
            throw new IllegalArgumentException("etag must be >= 0: " + value);
        }
    }

    public static Etag of(final long value) {
        return value == 0L ? ZERO : new Etag(value);
    }

    public boolean isAfter(final Etag other) {
        return value > other.value;
    }

    public static Etag max(final Etag a, final Etag b) {
        return a.value >= b.value ? a : b;
    }

    @Override
    public int compareTo(final Etag o) {
        return Long.compare(value, o.value);
    }

    @Override
    public String toString() {
        return "etag:" + value;
    }
}
