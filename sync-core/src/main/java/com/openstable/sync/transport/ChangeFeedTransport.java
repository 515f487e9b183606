package com.openstable.sync.transport;

import java.util.concurrent.CompletableFuture;

/**
 * Port to the server's change feed. One channel delivers the changes of one collection,
 * narrowed by an optional server-side filter.
 */
public interface ChangeFeedTransport {

    /**
     * Opens a channel. The future completes once the channel is established and events flow
     * to the listener, or fails when it could not be established.
     *
     * @param serverFilter rendered filter, empty for the whole collection
     */
    CompletableFuture<TransportChannel> open(String collection, String serverFilter, ChannelListener listener);

    /**
     * Releases a channel. Must be idempotent.
     */
    void close(TransportChannel channel);
}
