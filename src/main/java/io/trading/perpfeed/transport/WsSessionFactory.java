package io.trading.perpfeed.transport;

/**
 * Creates a fresh, unconnected websocket session.
 */
@FunctionalInterface
public interface WsSessionFactory {

    WsSession create();
}
