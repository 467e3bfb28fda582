package io.trading.perpfeed.exchange.okx;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Queue;

/**
 * Converts one classified stream payload into canonical events and enqueues them.
 *
 * @param <T> canonical event type
 */
@FunctionalInterface
public interface MessageNormalizer<T> {

    /**
     * @return number of events enqueued; zero when the payload kind is ignored
     * @throws io.trading.perpfeed.transport.MalformedResponseException if the payload lacks expected fields
     */
    int normalize(JsonNode payload, Queue<? super T> queue);
}
