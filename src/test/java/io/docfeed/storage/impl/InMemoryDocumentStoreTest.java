package io.docfeed.storage.impl;

import io.docfeed.core.cancel.CancellationToken;
import io.docfeed.core.cancel.WaitResult;
import io.docfeed.core.etag.Etag;
import io.docfeed.storage.ChangeNotifier;
import io.docfeed.storage.StoredDocument;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static io.docfeed.testing.TestCluster.body;
import static org.junit.jupiter.api.Assertions.*;

final class InMemoryDocumentStoreTest {

    @Test
    void etagsIncreaseAcrossCollections() {
        final InMemoryDocumentStore store = new InMemoryDocumentStore();
        final StoredDocument a = store.put("orders", "orders/1", body("status", "open"));
        final StoredDocument b = store.put("users", "users/1", body("name", "ann"));
        final StoredDocument c = store.put("orders", "orders/2", body("status", "open"));

        assertTrue(b.etag().isAfter(a.etag()));
        assertTrue(c.etag().isAfter(b.etag()));
        assertEquals(c.etag(), store.lastEtag());
    }

    @Test
    void scanAfterIsExclusiveAndLimited() {
        final InMemoryDocumentStore store = new InMemoryDocumentStore();
        final StoredDocument d1 = store.put("orders", "orders/1", body());
        store.put("orders", "orders/2", body());
        store.put("users", "users/1", body());
        store.put("orders", "orders/3", body());

        final List<StoredDocument> all = store.scanAfter("orders", Etag.ZERO, 10);
        assertEquals(List.of("orders/1", "orders/2", "orders/3"), all.stream().map(StoredDocument::id).toList());

        final List<StoredDocument> after = store.scanAfter("orders", d1.etag(), 1);
        assertEquals(1, after.size());
        assertEquals("orders/2", after.get(0).id());

        assertTrue(store.scanAfter("missing", Etag.ZERO, 10).isEmpty());
    }

    @Test
    void replacedDocumentMovesToNewPosition() {
        final InMemoryDocumentStore store = new InMemoryDocumentStore();
        final StoredDocument first = store.put("orders", "orders/1", body("v", "1"));
        store.put("orders", "orders/2", body());
        final StoredDocument replaced = store.put("orders", "orders/1", body("v", "2"));

        final List<StoredDocument> docs = store.scanAfter("orders", Etag.ZERO, 10);
        assertEquals(List.of("orders/2", "orders/1"), docs.stream().map(StoredDocument::id).toList());
        assertTrue(replaced.etag().isAfter(first.etag()));
        assertEquals("2", store.get("orders/1").body().getFieldsOrThrow("v").getStringValue());
    }

    @Test
    void deleteRemovesFromScan() {
        final InMemoryDocumentStore store = new InMemoryDocumentStore();
        store.put("orders", "orders/1", body());
        assertTrue(store.delete("orders/1"));
        assertFalse(store.delete("orders/1"));
        assertTrue(store.scanAfter("orders", Etag.ZERO, 10).isEmpty());
    }

    @Test
    void writeWakesArmedSubscriber() throws Exception {
        final InMemoryDocumentStore store = new InMemoryDocumentStore();
        final ChangeNotifier.Subscription changes = store.changes().subscribe("orders");
        changes.arm();

        final CompletableFuture<WaitResult> waiter = CompletableFuture.supplyAsync(
                () -> changes.await(Duration.ofSeconds(10), CancellationToken.create()));
        Thread.sleep(50);
        store.put("orders", "orders/1", body());

        assertEquals(WaitResult.SIGNALLED, waiter.get(5, TimeUnit.SECONDS));
    }

    @Test
    void writesToOtherCollectionsDoNotWake() {
        final InMemoryDocumentStore store = new InMemoryDocumentStore();
        final ChangeNotifier.Subscription changes = store.changes().subscribe("orders");
        changes.arm();
        store.put("users", "users/1", body());

        assertEquals(WaitResult.TIMED_OUT, changes.await(Duration.ofMillis(50), CancellationToken.create()));
    }

    @Test
    void writeBetweenArmAndAwaitIsNotLost() {
        final InMemoryDocumentStore store = new InMemoryDocumentStore();
        final ChangeNotifier.Subscription changes = store.changes().subscribe("orders");
        changes.arm();
        store.put("orders", "orders/1", body());
        store.put("orders", "orders/2", body());

        assertEquals(WaitResult.SIGNALLED, changes.await(Duration.ofMillis(50), CancellationToken.create()));
        // both writes coalesced into the one wake-up
        assertEquals(WaitResult.TIMED_OUT, changes.await(Duration.ofMillis(50), CancellationToken.create()));
    }
}
