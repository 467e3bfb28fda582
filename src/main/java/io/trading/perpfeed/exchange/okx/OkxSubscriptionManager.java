package io.trading.perpfeed.exchange.okx;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.trading.perpfeed.core.Sleeper;
import io.trading.perpfeed.transport.SymbolTranslator;
import io.trading.perpfeed.transport.TransportException;
import io.trading.perpfeed.transport.WsSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Builds and sends the subscribe requests for trades, order book deltas and instrument
 * info. Format: {"op":"subscribe","args":[{"channel":"trades","instId":"BTC-USDT-SWAP"}, ...]}
 *
 * OKX limits subscribe operations per connection. With zero pacing the three requests go
 * out back to back and any throttling is left to the transport; a positive pacing delay
 * is inserted between requests.
 */
public class OkxSubscriptionManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(OkxSubscriptionManager.class);

    private final ObjectMapper objectMapper;
    private final SymbolTranslator symbols;
    private final Duration pacing;
    private final Sleeper sleeper;

    public OkxSubscriptionManager(ObjectMapper objectMapper, SymbolTranslator symbols) {
        this(objectMapper, symbols, Duration.ZERO, Sleeper.SYSTEM);
    }

    public OkxSubscriptionManager(ObjectMapper objectMapper, SymbolTranslator symbols, Duration pacing, Sleeper sleeper) {
        this.objectMapper = objectMapper;
        this.symbols = symbols;
        this.pacing = pacing;
        this.sleeper = sleeper;
    }

    /**
     * Builds one request per channel kind, each with one argument per instrument in the given order.
     */
    public SubscribeBatch buildSubscribeBatch(List<String> nativeIds) {
        return new SubscribeBatch(
            subscribeRequest(OkxConstants.WS_TRADES_CHANNEL, nativeIds),
            subscribeRequest(OkxConstants.WS_ORDER_BOOK_CHANNEL, nativeIds),
            subscribeRequest(OkxConstants.WS_INSTRUMENTS_CHANNEL, nativeIds)
        );
    }

    /**
     * Sends trades, then order book, then instruments requests for the given canonical pairs.
     * A failed send is logged and rethrown; interruption propagates untouched.
     */
    public void subscribe(WsSession session, List<String> tradingPairs) throws TransportException, InterruptedException {
        List<String> nativeIds = tradingPairs.stream().map(symbols::toNative).toList();
        SubscribeBatch batch = buildSubscribeBatch(nativeIds);

        try {
            List<ObjectNode> requests = batch.inSendOrder();
            for (int i = 0; i < requests.size(); i++) {
                if (i > 0 && !pacing.isZero()) {
                    sleeper.sleep(pacing);
                }
                session.send(objectMapper.writeValueAsString(requests.get(i)));
            }
        } catch (TransportException e) {
            LOGGER.error("[OKX-PERP] Unexpected error occurred subscribing to order book, trade and funding streams", e);
            throw e;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize subscribe request", e);
        }
        LOGGER.info("[OKX-PERP] Subscribed to public order book, trade and funding info channels: {}", nativeIds);
    }

    private ObjectNode subscribeRequest(String channel, List<String> nativeIds) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("op", "subscribe");
        ArrayNode args = request.putArray("args");
        for (String instId : nativeIds) {
            args.addObject()
                .put("channel", channel)
                .put("instId", instId);
        }
        return request;
    }
}
