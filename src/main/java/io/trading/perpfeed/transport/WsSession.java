package io.trading.perpfeed.transport;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * One websocket connection. A session is connected once and disconnected once; a new
 * session is created for every reconnect.
 */
public interface WsSession {

    /**
     * Opens the connection and completes the websocket handshake.
     */
    void connect(String url, Duration timeout) throws TransportException, InterruptedException;

    /**
     * Sends a text frame.
     */
    void send(String payload) throws TransportException, InterruptedException;

    /**
     * Waits for the next text message.
     *
     * @throws TimeoutException   if nothing arrives within the timeout; the connection stays usable
     * @throws TransportException if the connection failed or was closed by the peer
     */
    String receive(Duration timeout) throws TransportException, TimeoutException, InterruptedException;

    /**
     * Releases the connection. Safe to call more than once and on a session that never connected.
     */
    void disconnect();
}
