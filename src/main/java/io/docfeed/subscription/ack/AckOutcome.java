package io.docfeed.subscription.ack;

/** How the wait for a batch acknowledgment ended. */
public enum AckOutcome {
    ACKNOWLEDGED,
    FAULTED,
    TIMED_OUT,
    CANCELLED
}
