package io.trading.perpfeed.exchange.okx;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.trading.perpfeed.config.FeedConfig;
import io.trading.perpfeed.core.ConnectionState;
import io.trading.perpfeed.core.ConnectionStateListener;
import io.trading.perpfeed.core.MarketEventQueues;
import io.trading.perpfeed.core.NonceSequencer;
import io.trading.perpfeed.core.Sleeper;
import io.trading.perpfeed.metrics.FeedMetrics;
import io.trading.perpfeed.model.FundingInfo;
import io.trading.perpfeed.model.OrderBookEvent;
import io.trading.perpfeed.transport.RestClient;
import io.trading.perpfeed.transport.SymbolTranslator;
import io.trading.perpfeed.transport.TransportException;
import io.trading.perpfeed.transport.WsSessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Order book, trade and funding-info data source for OKX perpetual swaps.
 *
 * Streams diffs, trades and funding deltas onto {@link #queues()} from a single background
 * listener, and answers snapshot and funding queries on demand. Snapshots and diffs share
 * one {@link NonceSequencer} so their update ids are comparable.
 */
public class OkxPerpetualDataSource implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(OkxPerpetualDataSource.class);

    private static final long STOP_TIMEOUT_MS = 5000;

    private final FeedConfig config;
    private final MarketEventQueues queues = new MarketEventQueues();
    private final NonceSequencer nonceSequencer = new NonceSequencer();
    private final ExecutorService restExecutor;
    private final ExecutorService listenerExecutor;
    private final OkxSnapshotFetcher snapshotFetcher;
    private final OkxStreamListener streamListener;

    private Future<?> listenerTask;
    private CountDownLatch listenerDone;
    private AtomicBoolean listenerStarted;

    public OkxPerpetualDataSource(
        FeedConfig config,
        RestClient restClient,
        WsSessionFactory sessionFactory,
        SymbolTranslator symbols,
        FeedMetrics metrics
    ) {
        this(config, restClient, sessionFactory, symbols, metrics, Sleeper.SYSTEM, ConnectionStateListener.NONE);
    }

    public OkxPerpetualDataSource(
        FeedConfig config,
        RestClient restClient,
        WsSessionFactory sessionFactory,
        SymbolTranslator symbols,
        FeedMetrics metrics,
        Sleeper sleeper,
        ConnectionStateListener stateListener
    ) {
        this.config = config;
        this.restExecutor = Executors.newFixedThreadPool(3, namedThreads("okx-perp-rest"));
        this.listenerExecutor = Executors.newSingleThreadExecutor(namedThreads("okx-perp-stream"));

        ObjectMapper objectMapper = new ObjectMapper();
        this.snapshotFetcher = new OkxSnapshotFetcher(
            restClient, symbols, nonceSequencer, restExecutor, config.restBaseUrl());
        this.streamListener = OkxStreamListener.builder()
            .url(config.publicWsUrl())
            .tradingPairs(config.tradingPairs())
            .connectTimeout(config.connectTimeout())
            .messageTimeout(config.messageTimeout())
            .retryDelay(config.retryDelay())
            .sessionFactory(sessionFactory)
            .subscriptionManager(new OkxSubscriptionManager(objectMapper, symbols, config.subscribePacing(), sleeper))
            .tradeNormalizer(new OkxTradeNormalizer(symbols))
            .diffNormalizer(new OkxDiffNormalizer(symbols, nonceSequencer))
            .fundingNormalizer(new OkxFundingNormalizer(symbols))
            .queues(queues)
            .objectMapper(objectMapper)
            .metrics(metrics)
            .sleeper(sleeper)
            .stateListener(stateListener)
            .build();
    }

    /**
     * Starts the background stream listener. Calling start twice is a no-op.
     */
    public synchronized void start() {
        if (listenerTask != null) {
            LOGGER.warn("[OKX-PERP] Data source already started");
            return;
        }
        LOGGER.info("[OKX-PERP] Starting data source for {}", config.tradingPairs());
        CountDownLatch done = new CountDownLatch(1);
        AtomicBoolean started = new AtomicBoolean(false);
        listenerDone = done;
        listenerStarted = started;
        listenerTask = listenerExecutor.submit(() -> {
            started.set(true);
            try {
                streamListener.listen();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOGGER.info("[OKX-PERP] Stream listener cancelled");
            } finally {
                done.countDown();
            }
        });
    }

    /**
     * Cancels the stream listener and waits until it has released its connection.
     */
    public synchronized void stop() {
        if (listenerTask == null) {
            return;
        }
        listenerTask.cancel(true);
        listenerTask = null;
        try {
            // a task cancelled before it ran never counts down
            if (listenerStarted.get() && !listenerDone.await(STOP_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                LOGGER.warn("[OKX-PERP] Stream listener did not stop within {} ms", STOP_TIMEOUT_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.error("[OKX-PERP] Interrupted while stopping data source", e);
        }
        LOGGER.info("[OKX-PERP] Data source stopped");
    }

    public MarketEventQueues queues() {
        return queues;
    }

    public ConnectionState getConnectionState() {
        return streamListener.getState();
    }

    public List<String> getTradingPairs() {
        return config.tradingPairs();
    }

    public OrderBookEvent fetchOrderBookSnapshot(String tradingPair) throws TransportException {
        return snapshotFetcher.fetchOrderBookSnapshot(tradingPair);
    }

    public FundingInfo fetchFundingInfo(String tradingPair) throws TransportException, InterruptedException {
        return snapshotFetcher.fetchFundingInfo(tradingPair);
    }

    public Map<String, Double> fetchLastTradedPrices(List<String> tradingPairs) throws TransportException {
        return snapshotFetcher.fetchLastTradedPrices(tradingPairs);
    }

    @Override
    public void close() {
        stop();
        listenerExecutor.shutdownNow();
        restExecutor.shutdownNow();
        try {
            if (!listenerExecutor.awaitTermination(STOP_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                LOGGER.warn("[OKX-PERP] Stream listener did not terminate within {} ms", STOP_TIMEOUT_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.error("[OKX-PERP] Interrupted while closing data source", e);
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread thread = new Thread(r, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
