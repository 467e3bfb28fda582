package io.trading.perpfeed.core;

import io.trading.perpfeed.model.FundingInfoUpdate;
import io.trading.perpfeed.model.OrderBookEvent;
import io.trading.perpfeed.model.TradeEvent;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * The three consumer-facing output queues, one per channel kind.
 * Queues are unbounded: producers never block, consumers may poll or take.
 */
public class MarketEventQueues {

    private final BlockingQueue<TradeEvent> trades = new LinkedBlockingQueue<>();
    private final BlockingQueue<OrderBookEvent> diffs = new LinkedBlockingQueue<>();
    private final BlockingQueue<FundingInfoUpdate> funding = new LinkedBlockingQueue<>();

    public BlockingQueue<TradeEvent> trades() {
        return trades;
    }

    public BlockingQueue<OrderBookEvent> diffs() {
        return diffs;
    }

    public BlockingQueue<FundingInfoUpdate> funding() {
        return funding;
    }
}
