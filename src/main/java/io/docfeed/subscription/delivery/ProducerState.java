package io.docfeed.subscription.delivery;

/** Lifecycle of the batch loop serving one lease. */
public enum ProducerState {
    IDLE,
    SCANNING,
    DELIVERING,
    AWAITING_ACK,
    CLOSED
}
