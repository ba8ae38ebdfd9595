package io.docfeed.storage;

import com.google.protobuf.Struct;
import io.docfeed.core.etag.Etag;

/**
 * Immutable snapshot of a document at the position it was written.
 */
public record StoredDocument(String id, String collection, Etag etag, Struct body) {

    /** Approximate wire size used for batch byte caps. */
    public long sizeInBytes() {
        return (long) body.getSerializedSize() + id.length() + collection.length() + Long.BYTES;
    }
}
