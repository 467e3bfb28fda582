package io.trading.perpfeed.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.hotspot.DefaultExports;
import io.trading.perpfeed.model.ChannelKind;

/**
 * Prometheus metrics for the perpetual feed.
 *
 * Tracks:
 * - Stream messages received per channel kind
 * - Canonical events enqueued per channel kind
 * - Messages dropped (unparseable or malformed)
 * - Connection errors, reconnect attempts and liveness pings
 * - Connection status
 */
public class FeedMetrics {

    private final CollectorRegistry registry;

    private final Counter messagesReceived;
    private final Counter eventsEnqueued;
    private final Counter messagesDropped;
    private final Counter connectionErrors;
    private final Counter reconnectAttempts;
    private final Counter pingsSent;
    private final Gauge connectionStatus;

    /**
     * Registers on the default registry together with JVM metrics (GC, memory, threads).
     */
    public FeedMetrics() {
        this(CollectorRegistry.defaultRegistry);
        DefaultExports.initialize();
    }

    public FeedMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.messagesReceived = Counter.build()
            .name("okx_perp_messages_received_total")
            .help("Total number of stream messages received")
            .labelNames("channel")
            .register(registry);

        this.eventsEnqueued = Counter.build()
            .name("okx_perp_events_enqueued_total")
            .help("Total number of canonical events placed on output queues")
            .labelNames("channel")
            .register(registry);

        this.messagesDropped = Counter.build()
            .name("okx_perp_messages_dropped_total")
            .help("Total number of stream messages dropped as malformed")
            .labelNames("reason")
            .register(registry);

        this.connectionErrors = Counter.build()
            .name("okx_perp_connection_errors_total")
            .help("Total number of stream failures that forced a reconnect")
            .register(registry);

        this.reconnectAttempts = Counter.build()
            .name("okx_perp_reconnect_attempts_total")
            .help("Total number of connection attempts after a failure")
            .register(registry);

        this.pingsSent = Counter.build()
            .name("okx_perp_pings_sent_total")
            .help("Total number of liveness pings sent on idle connections")
            .register(registry);

        // 1 = streaming, 0 = not streaming
        this.connectionStatus = Gauge.build()
            .name("okx_perp_connection_status")
            .help("Stream connection status (1 = streaming, 0 = not streaming)")
            .register(registry);
    }

    public void recordMessageReceived(ChannelKind channel) {
        messagesReceived.labels(channel.getDisplayName()).inc();
    }

    public void recordEventsEnqueued(ChannelKind channel, int count) {
        if (count > 0) {
            eventsEnqueued.labels(channel.getDisplayName()).inc(count);
        }
    }

    public void recordMessageDropped(String reason) {
        messagesDropped.labels(reason).inc();
    }

    public void recordConnectionError() {
        connectionErrors.inc();
    }

    public void recordReconnectAttempt() {
        reconnectAttempts.inc();
    }

    public void recordPingSent() {
        pingsSent.inc();
    }

    public void setStreaming(boolean streaming) {
        connectionStatus.set(streaming ? 1 : 0);
    }

    public double getMessagesReceived(ChannelKind channel) {
        return messagesReceived.labels(channel.getDisplayName()).get();
    }

    public double getEventsEnqueued(ChannelKind channel) {
        return eventsEnqueued.labels(channel.getDisplayName()).get();
    }

    public double getMessagesDropped(String reason) {
        return messagesDropped.labels(reason).get();
    }

    public double getConnectionErrors() {
        return connectionErrors.get();
    }

    public double getPingsSent() {
        return pingsSent.get();
    }

    public boolean isStreaming() {
        return connectionStatus.get() == 1;
    }

    /**
     * Returns the CollectorRegistry for the HTTP server.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }
}
