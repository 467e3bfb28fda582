package io.trading.perpfeed.transport;

import java.io.IOException;

/**
 * Failure of the underlying REST or websocket facility: connect, send, receive, or an
 * HTTP-level error response.
 */
public class TransportException extends IOException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
