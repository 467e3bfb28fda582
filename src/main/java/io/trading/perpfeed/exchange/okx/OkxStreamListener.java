package io.trading.perpfeed.exchange.okx;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trading.perpfeed.core.ConnectionState;
import io.trading.perpfeed.core.ConnectionStateListener;
import io.trading.perpfeed.core.MarketEventQueues;
import io.trading.perpfeed.core.Sleeper;
import io.trading.perpfeed.metrics.FeedMetrics;
import io.trading.perpfeed.model.ChannelKind;
import io.trading.perpfeed.transport.TransportException;
import io.trading.perpfeed.transport.WsSession;
import io.trading.perpfeed.transport.WsSessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Owns the reconnect loop for one public stream URL.
 *
 * Each iteration connects a fresh session, subscribes every pair, then pumps messages
 * (receive, classify, normalize, enqueue) one at a time so per-queue order matches the
 * wire. An idle receive sends a "ping" and keeps streaming. Any other failure releases the
 * session, waits the retry delay and starts over, forever. Thread interruption is the only
 * way out: it propagates immediately, without backoff.
 */
public class OkxStreamListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(OkxStreamListener.class);

    static final String DROP_UNPARSEABLE = "unparseable";
    static final String DROP_MALFORMED = "malformed";

    private final String url;
    private final List<String> tradingPairs;
    private final Duration connectTimeout;
    private final Duration messageTimeout;
    private final Duration retryDelay;
    private final WsSessionFactory sessionFactory;
    private final OkxSubscriptionManager subscriptionManager;
    private final OkxMessageClassifier classifier;
    private final OkxTradeNormalizer tradeNormalizer;
    private final OkxDiffNormalizer diffNormalizer;
    private final OkxFundingNormalizer fundingNormalizer;
    private final MarketEventQueues queues;
    private final ObjectMapper objectMapper;
    private final FeedMetrics metrics;
    private final Sleeper sleeper;
    private final ConnectionStateListener stateListener;

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;

    private OkxStreamListener(Builder builder) {
        this.url = builder.url;
        this.tradingPairs = List.copyOf(builder.tradingPairs);
        this.connectTimeout = builder.connectTimeout;
        this.messageTimeout = builder.messageTimeout;
        this.retryDelay = builder.retryDelay;
        this.sessionFactory = builder.sessionFactory;
        this.subscriptionManager = builder.subscriptionManager;
        this.classifier = builder.classifier;
        this.tradeNormalizer = builder.tradeNormalizer;
        this.diffNormalizer = builder.diffNormalizer;
        this.fundingNormalizer = builder.fundingNormalizer;
        this.queues = builder.queues;
        this.objectMapper = builder.objectMapper;
        this.metrics = builder.metrics;
        this.sleeper = builder.sleeper;
        this.stateListener = builder.stateListener;
    }

    /**
     * Runs the lifecycle loop on the calling thread until it is interrupted.
     *
     * @throws InterruptedException always, once cancelled
     */
    public void listen() throws InterruptedException {
        boolean reconnecting = false;
        try {
            while (true) {
                if (Thread.interrupted()) {
                    throw new InterruptedException("Stream listener cancelled");
                }
                if (reconnecting) {
                    metrics.recordReconnectAttempt();
                }
                try {
                    runSession();
                } catch (InterruptedException e) {
                    throw e;
                } catch (Exception e) {
                    if (Thread.interrupted()) {
                        InterruptedException cancelled = new InterruptedException("Stream listener cancelled");
                        cancelled.initCause(e);
                        throw cancelled;
                    }
                    metrics.recordConnectionError();
                    LOGGER.error("[OKX-PERP] Unexpected error occurred when listening to order book streams {}. "
                        + "Retrying in {} ms...", url, retryDelay.toMillis(), e);
                    transition(ConnectionState.ERROR_BACKOFF);
                    sleeper.sleep(retryDelay);
                    transition(ConnectionState.DISCONNECTED);
                    reconnecting = true;
                }
            }
        } finally {
            transition(ConnectionState.DISCONNECTED);
            LOGGER.info("[OKX-PERP] Stream listener for {} stopped", url);
        }
    }

    private void runSession() throws Exception {
        WsSession session = sessionFactory.create();
        try {
            transition(ConnectionState.CONNECTING);
            session.connect(url, connectTimeout);

            transition(ConnectionState.SUBSCRIBING);
            subscriptionManager.subscribe(session, tradingPairs);

            transition(ConnectionState.STREAMING);
            metrics.setStreaming(true);
            pump(session);
        } finally {
            metrics.setStreaming(false);
            session.disconnect();
        }
    }

    private void pump(WsSession session) throws TransportException, InterruptedException {
        while (true) {
            String message;
            try {
                message = session.receive(messageTimeout);
            } catch (TimeoutException e) {
                LOGGER.debug("[OKX-PERP] No message for {} ms on {}, sending ping", messageTimeout.toMillis(), url);
                session.send(OkxConstants.WS_PING);
                metrics.recordPingSent();
                continue;
            }
            dispatch(message);
        }
    }

    /**
     * Classifies one raw message and hands it to the matching normalizer. A message that
     * cannot be parsed or normalized is dropped with a warning; it never ends the stream.
     */
    void dispatch(String message) {
        if (OkxConstants.WS_PONG.equals(message)) {
            return;
        }

        JsonNode payload;
        try {
            payload = objectMapper.readTree(message);
        } catch (JsonProcessingException e) {
            metrics.recordMessageDropped(DROP_UNPARSEABLE);
            LOGGER.warn("[OKX-PERP] Dropping unparseable message: {}", message, e);
            return;
        }

        ChannelKind kind = classifier.classify(payload);
        metrics.recordMessageReceived(kind);

        try {
            int enqueued = switch (kind) {
                case TRADE -> tradeNormalizer.normalize(payload, queues.trades());
                case DIFF -> diffNormalizer.normalize(payload, queues.diffs());
                case FUNDING -> fundingNormalizer.normalize(payload, queues.funding());
                case UNROUTED -> {
                    logUnrouted(payload);
                    yield 0;
                }
            };
            metrics.recordEventsEnqueued(kind, enqueued);
        } catch (RuntimeException e) {
            metrics.recordMessageDropped(DROP_MALFORMED);
            LOGGER.warn("[OKX-PERP] Dropping malformed {} message: {}", kind, message, e);
        }
    }

    private void logUnrouted(JsonNode payload) {
        JsonNode event = payload.get("event");
        if (event != null && "error".equals(event.asText())) {
            LOGGER.warn("[OKX-PERP] Error event on {}: {}", url, payload);
        } else {
            LOGGER.debug("[OKX-PERP] Ignoring unrouted message: {}", payload);
        }
    }

    private void transition(ConnectionState next) {
        ConnectionState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        LOGGER.info("[OKX-PERP] {}: {} -> {}", url, previous, next);
        stateListener.onTransition(url, previous, next);
    }

    public ConnectionState getState() {
        return state;
    }

    public String getUrl() {
        return url;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for OkxStreamListener.
     */
    public static class Builder {
        private String url;
        private List<String> tradingPairs = List.of();
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration messageTimeout = Duration.ofSeconds(30);
        private Duration retryDelay = Duration.ofSeconds(5);
        private WsSessionFactory sessionFactory;
        private OkxSubscriptionManager subscriptionManager;
        private OkxMessageClassifier classifier = new OkxMessageClassifier();
        private OkxTradeNormalizer tradeNormalizer;
        private OkxDiffNormalizer diffNormalizer;
        private OkxFundingNormalizer fundingNormalizer;
        private MarketEventQueues queues;
        private ObjectMapper objectMapper = new ObjectMapper();
        private FeedMetrics metrics;
        private Sleeper sleeper = Sleeper.SYSTEM;
        private ConnectionStateListener stateListener = ConnectionStateListener.NONE;

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder tradingPairs(List<String> tradingPairs) {
            this.tradingPairs = tradingPairs;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder messageTimeout(Duration messageTimeout) {
            this.messageTimeout = messageTimeout;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder sessionFactory(WsSessionFactory sessionFactory) {
            this.sessionFactory = sessionFactory;
            return this;
        }

        public Builder subscriptionManager(OkxSubscriptionManager subscriptionManager) {
            this.subscriptionManager = subscriptionManager;
            return this;
        }

        public Builder classifier(OkxMessageClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder tradeNormalizer(OkxTradeNormalizer tradeNormalizer) {
            this.tradeNormalizer = tradeNormalizer;
            return this;
        }

        public Builder diffNormalizer(OkxDiffNormalizer diffNormalizer) {
            this.diffNormalizer = diffNormalizer;
            return this;
        }

        public Builder fundingNormalizer(OkxFundingNormalizer fundingNormalizer) {
            this.fundingNormalizer = fundingNormalizer;
            return this;
        }

        public Builder queues(MarketEventQueues queues) {
            this.queues = queues;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder metrics(FeedMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder stateListener(ConnectionStateListener stateListener) {
            this.stateListener = stateListener;
            return this;
        }

        public OkxStreamListener build() {
            if (url == null || url.isEmpty()) {
                throw new IllegalStateException("url must be set");
            }
            if (tradingPairs == null || tradingPairs.isEmpty()) {
                throw new IllegalStateException("At least one trading pair must be set");
            }
            if (sessionFactory == null || subscriptionManager == null || queues == null || metrics == null) {
                throw new IllegalStateException("sessionFactory, subscriptionManager, queues and metrics must be set");
            }
            if (tradeNormalizer == null || diffNormalizer == null || fundingNormalizer == null) {
                throw new IllegalStateException("All three normalizers must be set");
            }
            return new OkxStreamListener(this);
        }
    }
}
