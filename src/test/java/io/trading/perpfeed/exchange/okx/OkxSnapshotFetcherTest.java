package io.trading.perpfeed.exchange.okx;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trading.perpfeed.core.NonceSequencer;
import io.trading.perpfeed.model.FundingInfo;
import io.trading.perpfeed.model.OrderBookEvent;
import io.trading.perpfeed.model.PriceLevel;
import io.trading.perpfeed.transport.MalformedResponseException;
import io.trading.perpfeed.transport.RestClient;
import io.trading.perpfeed.transport.RestRequest;
import io.trading.perpfeed.transport.TransportException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OkxSnapshotFetcherTest {

    private static final String BASE_URL = "https://www.okx.com";

    private final ObjectMapper mapper = new ObjectMapper();
    private final NonceSequencer nonceSequencer = new NonceSequencer();
    private final ExecutorService executor = Executors.newFixedThreadPool(3);

    @Mock
    private RestClient restClient;

    private OkxSnapshotFetcher fetcher() {
        return new OkxSnapshotFetcher(restClient, new OkxSwapSymbolTranslator(), nonceSequencer, executor, BASE_URL);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private JsonNode json(String text) {
        try {
            return mapper.readTree(text);
        } catch (Exception e) {
            throw new IllegalArgumentException(text, e);
        }
    }

    private JsonNode respond(RestRequest request) {
        return switch (request.url().substring(BASE_URL.length())) {
            case OkxConstants.INDEX_TICKERS_PATH -> json("{\"code\":\"0\",\"data\":[{\"idxPx\":\"100\"}]}");
            case OkxConstants.MARK_PRICE_PATH -> json("{\"code\":\"0\",\"data\":[{\"markPx\":\"101\"}]}");
            case OkxConstants.FUNDING_RATE_PATH ->
                json("{\"code\":\"0\",\"data\":[{\"nextFundingTime\":\"2000\",\"nextFundingRate\":\"0.0001\"}]}");
            default -> throw new IllegalArgumentException("Unexpected " + request.url());
        };
    }

    @Test
    void testSnapshot() throws Exception {
        when(restClient.execute(any())).thenReturn(json("""
            {"data":[{"ts":"1000","bids":[["10","1"]],"asks":[["11","2"]]}]}
            """));

        OrderBookEvent snapshot = fetcher().fetchOrderBookSnapshot("X");

        assertTrue(snapshot.isSnapshot());
        assertEquals("X", snapshot.tradingPair());
        assertEquals(1.0, snapshot.timestamp(), 1e-9);
        assertTrue(snapshot.updateId() > 0);
        assertEquals(List.of(new PriceLevel(10.0, 1.0)), snapshot.bids());
        assertEquals(List.of(new PriceLevel(11.0, 2.0)), snapshot.asks());

        ArgumentCaptor<RestRequest> request = ArgumentCaptor.forClass(RestRequest.class);
        verify(restClient).execute(request.capture());
        assertEquals(BASE_URL + OkxConstants.ORDER_BOOK_PATH, request.getValue().url());
        assertEquals(Map.of("instId", "X-SWAP", "sz", "100"), request.getValue().params());
        assertFalse(request.getValue().authRequired());
    }

    @Test
    void testSnapshotIgnoresExtraLevelColumns() throws Exception {
        when(restClient.execute(any())).thenReturn(json("""
            {"code":"0","data":[{"asks":[["2","3","0","1"]],"bids":[["1","2","0","1"]],"ts":"1704067200123"}]}
            """));

        OrderBookEvent snapshot = fetcher().fetchOrderBookSnapshot("BTC-USDT");

        assertEquals(1704067200.123, snapshot.timestamp(), 1e-6);
        assertEquals(List.of(new PriceLevel(1.0, 2.0)), snapshot.bids());
        assertEquals(List.of(new PriceLevel(2.0, 3.0)), snapshot.asks());
    }

    @Test
    void testSnapshotsShareSequenceWithStream() throws Exception {
        when(restClient.execute(any())).thenReturn(json("""
            {"code":"0","data":[{"asks":[],"bids":[],"ts":"1000"}]}
            """));
        long streamed = nonceSequencer.next(5.0);

        OrderBookEvent snapshot = fetcher().fetchOrderBookSnapshot("BTC-USDT");

        assertEquals(streamed + 1, snapshot.updateId());
    }

    @Test
    void testSnapshotMissingTimestampIsMalformed() throws Exception {
        when(restClient.execute(any())).thenReturn(json("{\"code\":\"0\",\"data\":[{\"asks\":[],\"bids\":[]}]}"));

        assertThrows(MalformedResponseException.class, () -> fetcher().fetchOrderBookSnapshot("BTC-USDT"));
    }

    @Test
    void testSnapshotTransportFailurePropagates() throws Exception {
        when(restClient.execute(any())).thenThrow(new TransportException("down"));

        assertThrows(TransportException.class, () -> fetcher().fetchOrderBookSnapshot("BTC-USDT"));
    }

    @Test
    void testFundingInfoCombinesThreeResponses() throws Exception {
        when(restClient.execute(any())).thenAnswer(invocation -> respond(invocation.getArgument(0)));

        FundingInfo info = fetcher().fetchFundingInfo("BTC-USDT");

        assertEquals("BTC-USDT", info.tradingPair());
        assertEquals(new BigDecimal("100"), info.indexPrice());
        assertEquals(new BigDecimal("101"), info.markPrice());
        assertEquals(2000L, info.nextFundingUtcTimestamp());
        assertEquals(new BigDecimal("0.0001"), info.rate());
    }

    @Test
    void testFundingRequestsAreInFlightTogether() throws Exception {
        CountDownLatch allStarted = new CountDownLatch(3);
        when(restClient.execute(any())).thenAnswer(invocation -> {
            allStarted.countDown();
            if (!allStarted.await(5, TimeUnit.SECONDS)) {
                throw new TransportException("requests were serialized");
            }
            return respond(invocation.getArgument(0));
        });

        FundingInfo info = fetcher().fetchFundingInfo("BTC-USDT");

        assertEquals(new BigDecimal("101"), info.markPrice());
        ArgumentCaptor<RestRequest> requests = ArgumentCaptor.forClass(RestRequest.class);
        verify(restClient, times(3)).execute(requests.capture());
        RestRequest markPrice = requests.getAllValues().stream()
            .filter(r -> r.url().endsWith(OkxConstants.MARK_PRICE_PATH))
            .findFirst()
            .orElseThrow();
        assertTrue(markPrice.authRequired());
        assertEquals("SWAP", markPrice.params().get("instType"));
    }

    @Test
    void testFirstFundingFailureFailsTheCall() throws Exception {
        TransportException failure = new TransportException("mark price unavailable");
        when(restClient.execute(any())).thenAnswer(invocation -> {
            RestRequest request = invocation.getArgument(0);
            if (request.url().endsWith(OkxConstants.MARK_PRICE_PATH)) {
                throw failure;
            }
            return respond(request);
        });

        TransportException thrown = assertThrows(TransportException.class, () -> fetcher().fetchFundingInfo("BTC-USDT"));
        assertSame(failure, thrown);
    }

    @Test
    void testFailureDoesNotWaitForSlowRequests() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(restClient.execute(any())).thenAnswer(invocation -> {
            RestRequest request = invocation.getArgument(0);
            if (request.url().endsWith(OkxConstants.INDEX_TICKERS_PATH)) {
                throw new TransportException("index unavailable");
            }
            release.await(5, TimeUnit.SECONDS);
            return respond(request);
        });

        long started = System.nanoTime();
        assertThrows(TransportException.class, () -> fetcher().fetchFundingInfo("BTC-USDT"));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        release.countDown();

        assertTrue(elapsedMs < 4000, "call waited " + elapsedMs + " ms for slow requests");
    }

    @Test
    void testLastTradedPrices() throws Exception {
        when(restClient.execute(any())).thenReturn(json("""
            {"code":"0","data":[
                {"instId":"BTC-USDT-SWAP","last":"43250.5"},
                {"instId":"ETH-USDT-SWAP","last":"2300.1"},
                {"instId":"SOL-USDT-SWAP","last":"98.7"}
            ]}
            """));

        Map<String, Double> prices = fetcher().fetchLastTradedPrices(List.of("BTC-USDT", "SOL-USDT", "XRP-USDT"));

        assertEquals(Map.of("BTC-USDT", 43250.5, "SOL-USDT", 98.7), prices);
    }
}
