package io.trading.perpfeed.model;

import java.math.BigDecimal;

/**
 * Canonical trade print.
 *
 * @param tradingPair Canonical trading pair
 * @param tradeId     Exchange trade identifier
 * @param tradeType   Taker side
 * @param amount      Traded quantity
 * @param price       Trade price
 * @param timestamp   Trade time in seconds since epoch, fractional
 */
public record TradeEvent(
    String tradingPair,
    String tradeId,
    TradeType tradeType,
    BigDecimal amount,
    BigDecimal price,
    double timestamp
) {
    public TradeEvent {
        if (tradingPair == null || tradingPair.isEmpty()) {
            throw new IllegalArgumentException("tradingPair cannot be null or empty");
        }
        if (tradeId == null) {
            throw new IllegalArgumentException("tradeId cannot be null");
        }
        if (tradeType == null) {
            throw new IllegalArgumentException("tradeType cannot be null");
        }
        if (amount == null || price == null) {
            throw new IllegalArgumentException("amount and price cannot be null");
        }
    }
}
