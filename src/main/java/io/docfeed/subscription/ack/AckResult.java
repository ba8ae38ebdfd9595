package io.docfeed.subscription.ack;

/** Answer sent back for a client {@code ACK}. */
public record AckResult(boolean committed, String error) {

    public static final AckResult COMMITTED = new AckResult(true, null);

    public static AckResult rejected(final String error) {
        return new AckResult(false, error);
    }
}
