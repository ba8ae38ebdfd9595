package io.docfeed.client.worker;

import io.docfeed.client.DocFeedClient;
import io.docfeed.client.impl.NettyDocFeedClient;

import java.net.InetSocketAddress;

/** Opens a client connection to one node. */
@FunctionalInterface
public interface ClientConnector {

    DocFeedClient connect(InetSocketAddress address) throws InterruptedException;

    static ClientConnector netty() {
        return address -> new NettyDocFeedClient(address.getHostString(), address.getPort());
    }
}
