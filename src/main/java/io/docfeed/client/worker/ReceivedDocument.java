package io.docfeed.client.worker;

import com.google.protobuf.Struct;
import io.docfeed.api.SubscriptionApi;
import io.docfeed.core.etag.Etag;

/** A document as delivered to subscription handlers. */
public record ReceivedDocument(long subscriptionId, String id, String collection, Etag etag, Struct body) {

    static ReceivedDocument fromProto(final SubscriptionApi.Document d) {
        return new ReceivedDocument(d.getSubscriptionId(), d.getId(), d.getCollection(), Etag.of(d.getEtag()), d.getBody());
    }
}
