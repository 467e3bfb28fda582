package io.trading.perpfeed.exchange.okx;

import com.fasterxml.jackson.databind.JsonNode;
import io.trading.perpfeed.core.NonceSequencer;
import io.trading.perpfeed.model.OrderBookEvent;
import io.trading.perpfeed.model.PriceLevel;
import io.trading.perpfeed.transport.SymbolTranslator;

import java.util.List;
import java.util.Queue;

/**
 * Turns "books" channel updates into DIFF events.
 * Format: {"arg":{"channel":"books","instId":"BTC-USDT-SWAP"},"action":"update",
 *          "data":[{"ts":"1704067200000","bids":[["43250.0","1.5","0","1"]],"asks":[...]}]}
 *
 * Only action "update" is handled; snapshots come from REST. OKX sends one depth update
 * per message, so only data[0] is read.
 */
public class OkxDiffNormalizer implements MessageNormalizer<OrderBookEvent> {

    private final SymbolTranslator symbols;
    private final NonceSequencer nonceSequencer;

    public OkxDiffNormalizer(SymbolTranslator symbols, NonceSequencer nonceSequencer) {
        this.symbols = symbols;
        this.nonceSequencer = nonceSequencer;
    }

    @Override
    public int normalize(JsonNode payload, Queue<? super OrderBookEvent> queue) {
        JsonNode action = payload.get("action");
        if (action == null || !OkxConstants.ACTION_UPDATE.equals(action.asText())) {
            return 0;
        }

        String tradingPair = symbols.toCanonical(
            JsonFields.requireText(JsonFields.require(payload, "arg"), "instId"));
        JsonNode update = JsonFields.firstDataRow(payload);
        double timestamp = JsonFields.requireLong(update, "ts") * 1e-3;
        List<PriceLevel> bids = JsonFields.priceLevels(update, "bids");
        List<PriceLevel> asks = JsonFields.priceLevels(update, "asks");

        queue.offer(OrderBookEvent.diff(tradingPair, nonceSequencer.next(timestamp), bids, asks, timestamp));
        return 1;
    }
}
