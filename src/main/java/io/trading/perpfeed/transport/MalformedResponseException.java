package io.trading.perpfeed.transport;

/**
 * Raised when a REST response or stream payload lacks an expected field or carries a
 * value of the wrong shape.
 */
public class MalformedResponseException extends RuntimeException {

    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
