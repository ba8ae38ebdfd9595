package io.docfeed.subscription.exception;

import io.docfeed.subscription.model.CloseReason;

/** A cluster proposal was rejected or did not commit in time. */
public final class CommitFailedException extends SubscriptionException {
    public CommitFailedException(final String message, final Throwable cause) {
        super(CloseReason.COMMIT_FAILED, message, cause);
    }
}
