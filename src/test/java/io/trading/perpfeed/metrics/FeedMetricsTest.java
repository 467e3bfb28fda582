package io.trading.perpfeed.metrics;

import io.prometheus.client.CollectorRegistry;
import io.trading.perpfeed.model.ChannelKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FeedMetricsTest {

    private final CollectorRegistry registry = new CollectorRegistry();
    private final FeedMetrics metrics = new FeedMetrics(registry);

    @Test
    void testCountersByChannel() {
        metrics.recordMessageReceived(ChannelKind.TRADE);
        metrics.recordMessageReceived(ChannelKind.TRADE);
        metrics.recordMessageReceived(ChannelKind.DIFF);
        metrics.recordEventsEnqueued(ChannelKind.TRADE, 5);
        metrics.recordEventsEnqueued(ChannelKind.FUNDING, 0);

        assertEquals(2.0, metrics.getMessagesReceived(ChannelKind.TRADE));
        assertEquals(1.0, metrics.getMessagesReceived(ChannelKind.DIFF));
        assertEquals(5.0, metrics.getEventsEnqueued(ChannelKind.TRADE));
        assertEquals(0.0, metrics.getEventsEnqueued(ChannelKind.FUNDING));
        assertEquals(2.0, registry.getSampleValue(
            "okx_perp_messages_received_total", new String[]{"channel"}, new String[]{"trade"}).doubleValue());
    }

    @Test
    void testConnectionMetrics() {
        metrics.recordConnectionError();
        metrics.recordReconnectAttempt();
        metrics.recordPingSent();
        metrics.recordMessageDropped("malformed");

        assertEquals(1.0, metrics.getConnectionErrors());
        assertEquals(1.0, metrics.getPingsSent());
        assertEquals(1.0, metrics.getMessagesDropped("malformed"));
        assertEquals(1.0, registry.getSampleValue("okx_perp_reconnect_attempts_total").doubleValue());
    }

    @Test
    void testStreamingGauge() {
        assertFalse(metrics.isStreaming());
        metrics.setStreaming(true);
        assertTrue(metrics.isStreaming());
        assertEquals(1.0, registry.getSampleValue("okx_perp_connection_status").doubleValue());
        metrics.setStreaming(false);
        assertFalse(metrics.isStreaming());
    }
}
