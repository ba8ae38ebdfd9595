package io.docfeed.subscription;

@FunctionalInterface
public interface SubscriptionEventListener {
    void onEvent(SubscriptionEvent event);
}
