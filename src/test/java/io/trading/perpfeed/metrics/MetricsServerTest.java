package io.trading.perpfeed.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.prometheus.client.CollectorRegistry;
import io.trading.perpfeed.core.ConnectionState;
import io.trading.perpfeed.core.MarketEventQueues;
import io.trading.perpfeed.model.ChannelKind;
import io.trading.perpfeed.model.FundingInfoUpdate;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class MetricsServerTest {

    private final OkHttpClient client = new OkHttpClient();
    private final ObjectMapper mapper = new ObjectMapper();
    private final FeedMetrics metrics = new FeedMetrics(new CollectorRegistry());
    private final MarketEventQueues queues = new MarketEventQueues();
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private MetricsServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = new MetricsServer(0, metrics, state::get, queues);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private Response get(String path) throws Exception {
        return client.newCall(new Request.Builder()
            .url("http://127.0.0.1:" + server.getPort() + path)
            .build()).execute();
    }

    @Test
    void testMetricsEndpoint() throws Exception {
        metrics.recordMessageReceived(ChannelKind.FUNDING);

        try (Response response = get("/metrics")) {
            assertEquals(200, response.code());
            String body = response.body().string();
            assertTrue(body.contains("okx_perp_messages_received_total{channel=\"funding\",} 1.0"), body);
        }
    }

    @Test
    void testHealthIsUnavailableUntilStreaming() throws Exception {
        try (Response response = get("/health")) {
            assertEquals(503, response.code());
            JsonNode health = mapper.readTree(response.body().string());
            assertFalse(health.get("healthy").asBoolean());
            assertEquals("CONNECTING", health.get("state").asText());
        }

        state.set(ConnectionState.STREAMING);
        queues.funding().offer(FundingInfoUpdate.builder("BTC-USDT").build());

        try (Response response = get("/health")) {
            assertEquals(200, response.code());
            JsonNode health = mapper.readTree(response.body().string());
            assertTrue(health.get("healthy").asBoolean());
            assertEquals(1, health.get("pendingFunding").asInt());
        }
    }
}
