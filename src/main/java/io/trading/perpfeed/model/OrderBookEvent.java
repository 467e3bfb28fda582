package io.trading.perpfeed.model;

import java.util.List;

/**
 * Canonical order book event consumed by the downstream book builder.
 *
 * @param type        SNAPSHOT or DIFF
 * @param tradingPair Canonical trading pair (e.g., "BTC-USDT")
 * @param updateId    Strictly increasing update identifier assigned at ingestion
 * @param bids        Bid levels as received (descending by price)
 * @param asks        Ask levels as received (ascending by price)
 * @param timestamp   Event timestamp in seconds since epoch, fractional
 */
public record OrderBookEvent(
    OrderBookEventType type,
    String tradingPair,
    long updateId,
    List<PriceLevel> bids,
    List<PriceLevel> asks,
    double timestamp
) {
    public OrderBookEvent {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (tradingPair == null || tradingPair.isEmpty()) {
            throw new IllegalArgumentException("tradingPair cannot be null or empty");
        }
        bids = bids == null ? List.of() : List.copyOf(bids);
        asks = asks == null ? List.of() : List.copyOf(asks);
    }

    public static OrderBookEvent snapshot(String tradingPair, long updateId,
                                          List<PriceLevel> bids, List<PriceLevel> asks, double timestamp) {
        return new OrderBookEvent(OrderBookEventType.SNAPSHOT, tradingPair, updateId, bids, asks, timestamp);
    }

    public static OrderBookEvent diff(String tradingPair, long updateId,
                                      List<PriceLevel> bids, List<PriceLevel> asks, double timestamp) {
        return new OrderBookEvent(OrderBookEventType.DIFF, tradingPair, updateId, bids, asks, timestamp);
    }

    public boolean isSnapshot() {
        return type == OrderBookEventType.SNAPSHOT;
    }
}
