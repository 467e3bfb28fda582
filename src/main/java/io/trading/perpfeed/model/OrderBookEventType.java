package io.trading.perpfeed.model;

/**
 * Kind of order book event.
 */
public enum OrderBookEventType {
    /** Full book state, produced only from a REST snapshot. */
    SNAPSHOT,
    /** Incremental update, produced only from the websocket stream. */
    DIFF
}
