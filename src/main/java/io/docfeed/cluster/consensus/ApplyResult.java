package io.docfeed.cluster.consensus;

import io.docfeed.subscription.model.CloseReason;

/**
 * Outcome of applying a committed command.
 *
 * @param applied        state changed
 * @param subscriptionId subscription the command targeted (assigned id for creates)
 * @param rejection      non-null when the command was refused by the state machine
 * @param newNode        responsible node hint for {@link CloseReason#MOVED} rejections
 */
public record ApplyResult(boolean applied,
                          long subscriptionId,
                          CloseReason rejection,
                          String message,
                          String newNode) {

    public static ApplyResult applied(final long subscriptionId) {
        return new ApplyResult(true, subscriptionId, null, null, null);
    }

    public static ApplyResult unchanged(final long subscriptionId) {
        return new ApplyResult(false, subscriptionId, null, null, null);
    }

    public static ApplyResult rejected(final long subscriptionId, final CloseReason reason, final String message) {
        return new ApplyResult(false, subscriptionId, reason, message, null);
    }

    public static ApplyResult moved(final long subscriptionId, final String newNode) {
        return new ApplyResult(false, subscriptionId, CloseReason.MOVED,
                "subscription " + subscriptionId + " is served by " + newNode, newNode);
    }

    /** A compare-and-set on the responsible node lost to a concurrent reassignment to {@code current}. */
    public static ApplyResult assignmentConflict(final long subscriptionId, final String expected, final String current) {
        return new ApplyResult(false, subscriptionId, CloseReason.MOVED,
                "stale assignment: expected " + expected + " but was " + current, current);
    }

    public boolean isRejected() {
        return rejection != null;
    }
}
