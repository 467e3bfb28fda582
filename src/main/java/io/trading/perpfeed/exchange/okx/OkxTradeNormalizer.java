package io.trading.perpfeed.exchange.okx;

import com.fasterxml.jackson.databind.JsonNode;
import io.trading.perpfeed.model.TradeEvent;
import io.trading.perpfeed.model.TradeType;
import io.trading.perpfeed.transport.SymbolTranslator;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;

/**
 * Turns "trades" channel messages into one TradeEvent per print, in array order.
 * Format: {"data":[{"instId":"BTC-USDT-SWAP","tradeId":"1","side":"buy","sz":"0.5","px":"43250.5","ts":"1704067200000"}]}
 */
public class OkxTradeNormalizer implements MessageNormalizer<TradeEvent> {

    private final SymbolTranslator symbols;

    public OkxTradeNormalizer(SymbolTranslator symbols) {
        this.symbols = symbols;
    }

    @Override
    public int normalize(JsonNode payload, Queue<? super TradeEvent> queue) {
        JsonNode data = JsonFields.requireArray(payload, "data");

        // Parse the whole batch first so a bad entry drops the message, not half of it
        List<TradeEvent> trades = new ArrayList<>(data.size());
        for (JsonNode trade : data) {
            trades.add(new TradeEvent(
                symbols.toCanonical(JsonFields.requireText(trade, "instId")),
                JsonFields.requireText(trade, "tradeId"),
                TradeType.fromSide(JsonFields.requireText(trade, "side")),
                JsonFields.requireDecimal(trade, "sz"),
                JsonFields.requireDecimal(trade, "px"),
                JsonFields.requireLong(trade, "ts") * 1e-3
            ));
        }
        trades.forEach(queue::offer);
        return trades.size();
    }
}
