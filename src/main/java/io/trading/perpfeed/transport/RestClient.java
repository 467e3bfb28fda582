package io.trading.perpfeed.transport;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Request/response facility for the exchange REST API. Implementations own connection
 * pooling, signing and throttling and must be safe for concurrent use.
 */
public interface RestClient {

    /**
     * Executes the request and returns the parsed JSON body.
     *
     * @throws TransportException if the call cannot be completed or the exchange rejects it
     */
    JsonNode execute(RestRequest request) throws TransportException;
}
