package io.docfeed.client.worker;

/**
 * Outcome of one handler on one document. Failures are values, not exceptions.
 */
public record HandlerResult(boolean ok, String error, Throwable cause) {

    public static final HandlerResult OK = new HandlerResult(true, null, null);

    public static HandlerResult failed(final String error) {
        return new HandlerResult(false, error, null);
    }

    public static HandlerResult failed(final Throwable cause) {
        return new HandlerResult(false, String.valueOf(cause.getMessage()), cause);
    }
}
