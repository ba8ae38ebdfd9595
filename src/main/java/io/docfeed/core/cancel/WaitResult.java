package io.docfeed.core.cancel;

/** Outcome of a bounded, cancellable wait. */
public enum WaitResult {
    SIGNALLED,
    TIMED_OUT,
    CANCELLED
}
