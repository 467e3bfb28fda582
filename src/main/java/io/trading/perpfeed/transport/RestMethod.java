package io.trading.perpfeed.transport;

/**
 * HTTP methods used against the exchange REST API.
 */
public enum RestMethod {
    GET
}
