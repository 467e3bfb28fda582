package io.trading.perpfeed.core;

/**
 * States of the stream connection lifecycle.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    SUBSCRIBING,
    STREAMING,
    ERROR_BACKOFF
}
