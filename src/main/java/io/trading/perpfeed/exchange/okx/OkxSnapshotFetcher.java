package io.trading.perpfeed.exchange.okx;

import com.fasterxml.jackson.databind.JsonNode;
import io.trading.perpfeed.core.NonceSequencer;
import io.trading.perpfeed.model.FundingInfo;
import io.trading.perpfeed.model.OrderBookEvent;
import io.trading.perpfeed.model.PriceLevel;
import io.trading.perpfeed.transport.RestClient;
import io.trading.perpfeed.transport.RestRequest;
import io.trading.perpfeed.transport.SymbolTranslator;
import io.trading.perpfeed.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * On-demand REST queries: order book snapshots, funding info and last traded prices.
 *
 * Nothing here retries; transport failures surface as {@link TransportException} and
 * unexpected response shapes as {@link io.trading.perpfeed.transport.MalformedResponseException}.
 */
public class OkxSnapshotFetcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(OkxSnapshotFetcher.class);

    private final RestClient restClient;
    private final SymbolTranslator symbols;
    private final NonceSequencer nonceSequencer;
    private final Executor executor;
    private final String restBaseUrl;

    /**
     * @param restClient     REST facility, shared with other callers
     * @param symbols        Pair translation
     * @param nonceSequencer Sequencer shared with the stream so snapshots and diffs are ordered together
     * @param executor       Runs the concurrent funding-info requests
     * @param restBaseUrl    REST API base URL
     */
    public OkxSnapshotFetcher(
        RestClient restClient,
        SymbolTranslator symbols,
        NonceSequencer nonceSequencer,
        Executor executor,
        String restBaseUrl
    ) {
        this.restClient = restClient;
        this.symbols = symbols;
        this.nonceSequencer = nonceSequencer;
        this.executor = executor;
        this.restBaseUrl = restBaseUrl;
    }

    /**
     * Fetches a depth-100 order book snapshot.
     * Response format: {"data":[{"ts":"<ms>","bids":[[px,sz,...]],"asks":[[px,sz,...]]}]}
     */
    public OrderBookEvent fetchOrderBookSnapshot(String tradingPair) throws TransportException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("instId", symbols.toNative(tradingPair));
        params.put("sz", OkxConstants.SNAPSHOT_DEPTH);

        JsonNode response = restClient.execute(RestRequest.get(
            OkxConstants.restUrl(restBaseUrl, OkxConstants.ORDER_BOOK_PATH),
            params,
            OkxConstants.limitId(OkxConstants.ORDER_BOOK_PATH)
        ));

        JsonNode snapshot = JsonFields.firstDataRow(response);
        double timestamp = JsonFields.requireLong(snapshot, "ts") * 1e-3;
        List<PriceLevel> bids = JsonFields.priceLevels(snapshot, "bids");
        List<PriceLevel> asks = JsonFields.priceLevels(snapshot, "asks");
        long updateId = nonceSequencer.next(timestamp);

        LOGGER.debug("[OKX-PERP] Snapshot {}: {} bids, {} asks, updateId={}",
            tradingPair, bids.size(), asks.size(), updateId);
        return OrderBookEvent.snapshot(tradingPair, updateId, bids, asks, timestamp);
    }

    /**
     * Fetches index price, mark price and funding rate concurrently and combines the first
     * row of each. All three requests are in flight before any result is awaited; the first
     * failure fails the whole call with that same exception.
     */
    public FundingInfo fetchFundingInfo(String tradingPair) throws TransportException, InterruptedException {
        String instId = symbols.toNative(tradingPair);

        CompletableFuture<JsonNode> indexPrice = executeAsync(RestRequest.get(
            OkxConstants.restUrl(restBaseUrl, OkxConstants.INDEX_TICKERS_PATH),
            Map.of("instId", instId),
            OkxConstants.limitId(OkxConstants.INDEX_TICKERS_PATH)
        ));

        Map<String, String> markParams = new LinkedHashMap<>();
        markParams.put("instId", instId);
        markParams.put("instType", OkxConstants.INST_TYPE_SWAP);
        CompletableFuture<JsonNode> markPrice = executeAsync(RestRequest.authenticatedGet(
            OkxConstants.restUrl(restBaseUrl, OkxConstants.MARK_PRICE_PATH),
            markParams,
            OkxConstants.limitId(OkxConstants.MARK_PRICE_PATH, tradingPair)
        ));

        CompletableFuture<JsonNode> fundingRate = executeAsync(RestRequest.get(
            OkxConstants.restUrl(restBaseUrl, OkxConstants.FUNDING_RATE_PATH),
            Map.of("instId", instId),
            OkxConstants.limitId(OkxConstants.FUNDING_RATE_PATH)
        ));

        awaitAllOrFirstFailure(indexPrice, markPrice, fundingRate);

        JsonNode index = JsonFields.firstDataRow(indexPrice.join());
        JsonNode mark = JsonFields.firstDataRow(markPrice.join());
        JsonNode funding = JsonFields.firstDataRow(fundingRate.join());

        return new FundingInfo(
            tradingPair,
            JsonFields.requireDecimal(index, "idxPx"),
            JsonFields.requireDecimal(mark, "markPx"),
            JsonFields.requireLong(funding, "nextFundingTime"),
            JsonFields.requireDecimal(funding, "nextFundingRate")
        );
    }

    /**
     * Returns the last traded price for every requested pair listed by the swap tickers endpoint.
     * Pairs the exchange does not list are absent from the result.
     */
    public Map<String, Double> fetchLastTradedPrices(List<String> tradingPairs) throws TransportException {
        JsonNode response = restClient.execute(RestRequest.get(
            OkxConstants.restUrl(restBaseUrl, OkxConstants.TICKERS_PATH),
            Map.of("instType", OkxConstants.INST_TYPE_SWAP),
            OkxConstants.limitId(OkxConstants.TICKERS_PATH)
        ));

        Map<String, Double> prices = new LinkedHashMap<>();
        for (JsonNode ticker : JsonFields.requireArray(response, "data")) {
            String pair = symbols.toCanonical(JsonFields.requireText(ticker, "instId"));
            if (tradingPairs.contains(pair)) {
                prices.put(pair, JsonFields.requireDouble(ticker, "last"));
            }
        }
        return prices;
    }

    private CompletableFuture<JsonNode> executeAsync(RestRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return restClient.execute(request);
            } catch (TransportException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    @SafeVarargs
    private static void awaitAllOrFirstFailure(CompletableFuture<JsonNode>... futures)
        throws TransportException, InterruptedException {
        CompletableFuture<Void> outcome = new CompletableFuture<>();
        for (CompletableFuture<JsonNode> future : futures) {
            future.whenComplete((result, error) -> {
                if (error != null) {
                    outcome.completeExceptionally(unwrap(error));
                }
            });
        }
        CompletableFuture.allOf(futures).thenRun(() -> outcome.complete(null));

        try {
            outcome.get();
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e.getCause());
            if (cause instanceof TransportException transportException) {
                throw transportException;
            }
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new TransportException("Funding info request failed", cause);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
