package com.chatlive.realtime.ws;

/**
 * Namespace-specific behaviour plugged into {@link RealtimeWsHandler}. Calls for one connection
 * never overlap.
 */
public interface NamespaceDispatcher {

    Namespace namespace();

    /**
     * Joins namespace channels after the connection was registered.
     */
    void onConnected(ConnectionInfo connection);

    void dispatch(ConnectionInfo connection, InboundFrame frame) throws Exception;
}
