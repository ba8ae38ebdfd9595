package io.docfeed.cluster.membership.hash;

import lombok.experimental.UtilityClass;

import java.util.Collection;

/** Highest-Random-Weight hashing, stable under membership churn. */
@UtilityClass
public class HashingProvider {

    private long score(final long key, final String nodeTag) {
        long h = key * 0x9E3779B97F4A7C15L ^ nodeTag.hashCode();
        h ^= (h >>> 33);
        h *= 0xff51afd7ed558ccdL;
        h ^= (h >>> 33);
        h *= 0xc4ceb9fe1a85ec53L;
        h ^= (h >>> 33);
        return h;
    }

    /** Returns the node with the highest weight for this key, or null when there are no candidates. */
    public String primary(final long key, final Collection<String> nodes) {
        long best = Long.MIN_VALUE;
        String bestTag = null;
        for (final String n : nodes) {
            final long s = score(key, n);
            if (bestTag == null || s > best || (s == best && n.compareTo(bestTag) < 0)) {
                best = s;
                bestTag = n;
            }
        }
        return bestTag;
    }
}
