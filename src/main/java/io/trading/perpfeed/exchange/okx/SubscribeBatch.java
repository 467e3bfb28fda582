package io.trading.perpfeed.exchange.okx;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * The three subscribe requests sent after every connect, in sending order.
 *
 * @param trades      Trade prints request
 * @param orderBook   Order book delta request
 * @param instruments Instrument / funding info request
 */
public record SubscribeBatch(
    ObjectNode trades,
    ObjectNode orderBook,
    ObjectNode instruments
) {
    public List<ObjectNode> inSendOrder() {
        return List.of(trades, orderBook, instruments);
    }
}
