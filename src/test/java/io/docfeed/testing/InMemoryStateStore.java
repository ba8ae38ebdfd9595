package io.docfeed.testing;

import io.docfeed.cluster.metadata.SubscriptionState;
import io.docfeed.cluster.metadata.SubscriptionStateListener;
import io.docfeed.cluster.metadata.SubscriptionStateStore;
import io.docfeed.subscription.model.SubscriptionCriteria;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/** Read-only state for components that never commit; tests edit it directly. */
public final class InMemoryStateStore implements SubscriptionStateStore {

    private final ConcurrentNavigableMap<Long, SubscriptionState> byId = new ConcurrentSkipListMap<>();

    public SubscriptionState put(final long id, final SubscriptionCriteria criteria, final String responsibleNode) {
        final SubscriptionState st = new SubscriptionState(id, "subscriptions/" + id, criteria, criteria.startEtag(),
                null, responsibleNode, false, 0L, 0L, 0L);
        byId.put(id, st);
        return st;
    }

    public void disable(final long id) {
        byId.computeIfPresent(id, (k, st) -> st.withDisabled(true));
    }

    public void remove(final long id) {
        byId.remove(id);
    }

    @Override
    public Optional<SubscriptionState> current(final long subscriptionId) {
        return Optional.ofNullable(byId.get(subscriptionId));
    }

    @Override
    public Optional<SubscriptionState> byName(final String name) {
        return byId.values().stream().filter(s -> s.name().equals(name)).findFirst();
    }

    @Override
    public List<SubscriptionState> list(final int start, final int pageSize) {
        return byId.values().stream().skip(start).limit(pageSize).toList();
    }

    @Override
    public List<SubscriptionState> all() {
        return List.copyOf(byId.values());
    }

    @Override
    public void addListener(final SubscriptionStateListener listener) {
    }
}
