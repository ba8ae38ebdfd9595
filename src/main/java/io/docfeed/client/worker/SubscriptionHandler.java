package io.docfeed.client.worker;

/**
 * Processes one delivered document. Handlers run in registration order on the worker thread; a thrown
 * exception is treated like {@link HandlerResult#failed(Throwable)}.
 */
@FunctionalInterface
public interface SubscriptionHandler {
    HandlerResult handle(ReceivedDocument document);
}
