package io.docfeed.storage;

import io.docfeed.core.etag.Etag;

import java.util.List;

/**
 * Read side of the storage engine used by subscriptions.
 */
public interface DocumentStore {

    /**
     * Returns up to {@code limit} documents of {@code collection} written strictly after {@code after},
     * ordered by etag. Implementations must never skip a document that is visible to a later scan.
     */
    List<StoredDocument> scanAfter(String collection, Etag after, int limit);

    /** Highest etag assigned so far, {@link Etag#ZERO} when nothing was written. */
    Etag lastEtag();

    /** Broadcast point for "new document available" signals. */
    ChangeNotifier changes();
}
