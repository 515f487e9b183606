package com.openstable.sync.transport;

/**
 * Handle of an open change feed channel.
 */
public interface TransportChannel {

    String id();

    String collection();
}
