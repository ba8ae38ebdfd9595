package io.docfeed.subscription.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-connection settings sent with {@code OPEN}. Defaults follow the server's documented surface.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public final class SubscriptionConnectionOptions {

    public static final int DEFAULT_MAX_DOC_COUNT = 4096;
    public static final Duration DEFAULT_ACK_TIMEOUT = Duration.ofMinutes(1);
    public static final Duration DEFAULT_CLIENT_ALIVE_INTERVAL = Duration.ofMinutes(2);
    public static final Duration DEFAULT_RETRY_WAIT = Duration.ofSeconds(15);
    public static final int DEFAULT_MAX_CONSECUTIVE_FAILURES = 5;

    private static final AtomicLong CONNECTION_COUNTER = new AtomicLong();
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final char[] BASE62 =
            "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz".toCharArray();

    @Builder.Default
    private final String connectionId = newConnectionId();
    @Builder.Default
    private final SubscriptionOpeningStrategy strategy = SubscriptionOpeningStrategy.OPEN_IF_FREE;
    @Builder.Default
    private final int maxDocCount = DEFAULT_MAX_DOC_COUNT;
    /** Byte cap per batch; {@code null} means unbounded. */
    private final Long maxSize;
    @Builder.Default
    private final Duration acknowledgmentTimeout = DEFAULT_ACK_TIMEOUT;
    @Builder.Default
    private final Duration clientAliveNotificationInterval = DEFAULT_CLIENT_ALIVE_INTERVAL;
    @Builder.Default
    private final Duration timeToWaitBeforeConnectionRetry = DEFAULT_RETRY_WAIT;
    @Builder.Default
    private final boolean ignoreSubscribersErrors = false;
    @Builder.Default
    private final int maxConsecutiveFailures = DEFAULT_MAX_CONSECUTIVE_FAILURES;

    public static SubscriptionConnectionOptions defaults() {
        return builder().build();
    }

    public void validate() {
        if (connectionId == null || connectionId.isBlank()) {
            throw new IllegalArgumentException("connectionId must not be blank");
        }
        if (maxDocCount <= 0) {
            throw new IllegalArgumentException("maxDocCount must be > 0: " + maxDocCount);
        }
        if (maxSize != null && maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0 when set: " + maxSize);
        }
        if (acknowledgmentTimeout.isNegative() || acknowledgmentTimeout.isZero()) {
            throw new IllegalArgumentException("acknowledgmentTimeout must be positive");
        }
        if (clientAliveNotificationInterval.isNegative() || clientAliveNotificationInterval.isZero()) {
            throw new IllegalArgumentException("clientAliveNotificationInterval must be positive");
        }
    }

    /** {@code <process counter>/<random base62>}, unique enough to tell reconnects from new clients. */
    public static String newConnectionId() {
        final StringBuilder sb = new StringBuilder(24);
        sb.append(CONNECTION_COUNTER.incrementAndGet()).append('/');
        for (int i = 0; i < 12; i++) {
            sb.append(BASE62[RANDOM.nextInt(BASE62.length)]);
        }
        return sb.toString();
    }
}
