package io.trading.perpfeed.core;

/**
 * Observer for lifecycle transitions.
 */
@FunctionalInterface
public interface ConnectionStateListener {

    ConnectionStateListener NONE = (url, from, to) -> { };

    void onTransition(String url, ConnectionState from, ConnectionState to);
}
