package io.trading.perpfeed.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.exporter.common.TextFormat;
import io.trading.perpfeed.core.ConnectionState;
import io.trading.perpfeed.core.MarketEventQueues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.function.Supplier;

/**
 * HTTP server exposing Prometheus metrics and a health endpoint.
 *
 * /metrics  Prometheus text format
 * /health   JSON; 200 while streaming, 503 otherwise
 */
public class MetricsServer implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(MetricsServer.class);

    private final int port;
    private final FeedMetrics metrics;
    private final Supplier<ConnectionState> connectionState;
    private final MarketEventQueues queues;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final long startTime = System.currentTimeMillis();
    private HttpServer server;

    /**
     * @param port Port to bind; 0 picks a free port
     */
    public MetricsServer(int port, FeedMetrics metrics, Supplier<ConnectionState> connectionState, MarketEventQueues queues) {
        this.port = port;
        this.metrics = metrics;
        this.connectionState = connectionState;
        this.queues = queues;
    }

    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/metrics", handleMetrics());
        server.createContext("/health", handleHealth());
        server.setExecutor(null);
        server.start();

        LOGGER.info("HTTP server started on port {}", getPort());
        LOGGER.info("  Prometheus: http://localhost:{}/metrics", getPort());
        LOGGER.info("  Health:     http://localhost:{}/health", getPort());
    }

    /**
     * Returns the bound port, resolving 0 after start.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    private HttpHandler handleMetrics() {
        return exchange -> {
            try {
                Writer writer = new StringWriter();
                TextFormat.write004(writer, metrics.getRegistry().metricFamilySamples());
                send(exchange, 200, TextFormat.CONTENT_TYPE_004, writer.toString());
            } catch (Exception e) {
                LOGGER.error("Error serving metrics", e);
                exchange.sendResponseHeaders(500, -1);
            }
        };
    }

    private HttpHandler handleHealth() {
        return exchange -> {
            try {
                ConnectionState state = connectionState.get();
                boolean healthy = state == ConnectionState.STREAMING;
                HealthResponse health = new HealthResponse(
                    healthy,
                    state.name(),
                    System.currentTimeMillis() - startTime,
                    queues.trades().size(),
                    queues.diffs().size(),
                    queues.funding().size()
                );
                String response = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(health);
                send(exchange, healthy ? 200 : 503, "application/json", response);
            } catch (Exception e) {
                LOGGER.error("Error handling health request", e);
                send(exchange, 500, "application/json", "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private static void send(HttpExchange exchange, int statusCode, String contentType, String response) throws IOException {
        byte[] bytes = response.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Override
    public void close() {
        if (server != null) {
            server.stop(0);
            LOGGER.info("HTTP server stopped");
        }
    }

    record HealthResponse(boolean healthy, String state, long uptimeMs,
                          int pendingTrades, int pendingDiffs, int pendingFunding) {}
}
