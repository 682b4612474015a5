package com.qqsuccubus.social.socket.metrics;

import com.qqsuccubus.social.core.metrics.MetricsNames;
import com.qqsuccubus.social.core.metrics.MetricsTags;
import com.qqsuccubus.social.socket.config.SocketConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics service for the socket node.
 */
public class MetricsService {

    private final MeterRegistry registry;
    private final String nodeId;

    // Counters
    private final Counter presencePublished;
    private final Counter presenceSkipped;
    private final Counter messagesDelivered;
    private final Counter messagesFailed;
    private final Counter updatesCreated;
    private final Counter dropsBufferFull;
    private final Counter dropsClosed;

    // Network traffic counters (bytes)
    private final Counter networkInboundWs;
    private final Counter networkOutboundWs;

    private final DistributionSummary frameSizeInbound;

    public MetricsService(MeterRegistry registry, SocketConfig config) {
        this.registry = registry;
        this.nodeId = config.getNodeId();

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        presencePublished = Counter.builder(MetricsNames.PRESENCE_BROADCAST_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.RESULT, "published")
            .description("Presence snapshots broadcast to all connections")
            .register(registry);

        presenceSkipped = Counter.builder(MetricsNames.PRESENCE_BROADCAST_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.RESULT, "skipped")
            .description("Presence broadcasts skipped because the store could not be read")
            .register(registry);

        messagesDelivered = Counter.builder(MetricsNames.MESSAGES_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.RESULT, "delivered")
            .register(registry);

        messagesFailed = Counter.builder(MetricsNames.MESSAGES_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.RESULT, "failed")
            .register(registry);

        updatesCreated = Counter.builder(MetricsNames.UPDATES_CREATED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .register(registry);

        dropsBufferFull = Counter.builder(MetricsNames.DROPS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, "buffer_full")
            .description("Frames dropped because a connection's outbound buffer was full")
            .register(registry);

        dropsClosed = Counter.builder(MetricsNames.DROPS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, "closed")
            .description("Frames dropped because the connection was already closing")
            .register(registry);

        networkInboundWs = Counter.builder(MetricsNames.NETWORK_INBOUND_WS_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Total bytes received from WebSocket clients")
            .baseUnit("bytes")
            .register(registry);

        networkOutboundWs = Counter.builder(MetricsNames.NETWORK_OUTBOUND_WS_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Total bytes sent to WebSocket clients")
            .baseUnit("bytes")
            .register(registry);

        frameSizeInbound = DistributionSummary.builder(MetricsNames.NETWORK_INBOUND_WS_BYTES + ".size")
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Inbound frame size distribution")
            .baseUnit("bytes")
            .register(registry);
    }

    /**
     * Registers the gauges that read live state.
     *
     * @param activeConnections open connection count
     * @param onlineUsers       users currently present in the registry
     */
    public void bindGauges(Supplier<Number> activeConnections, Supplier<Number> onlineUsers) {
        Gauge.builder(MetricsNames.CONNECTIONS_ACTIVE, activeConnections)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Open WebSocket connections")
            .register(registry);

        Gauge.builder(MetricsNames.PRESENCE_ONLINE_USERS, onlineUsers)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Users with at least one live connection")
            .register(registry);
    }

    public void recordPresencePublished() {
        presencePublished.increment();
    }

    public void recordPresenceSkipped() {
        presenceSkipped.increment();
    }

    public void recordMessageDelivered() {
        messagesDelivered.increment();
    }

    public void recordMessageFailed() {
        messagesFailed.increment();
    }

    public void recordReaction(String transitionKind) {
        Counter.builder(MetricsNames.REACTIONS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.TYPE, transitionKind)
            .register(registry)
            .increment();
    }

    public void recordUpdateCreated() {
        updatesCreated.increment();
    }

    public void recordDropBufferFull() {
        dropsBufferFull.increment();
    }

    public void recordDropClosed() {
        dropsClosed.increment();
    }

    /**
     * Records how long an inbound event took to handle, including store round trips.
     *
     * @param event      inbound event name
     * @param startNanos start nanos
     */
    public void recordEventLatency(String event, long startNanos) {
        Timer.builder(MetricsNames.EVENT_LATENCY)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.EVENT, event)
            .description("Inbound event handling latency")
            .publishPercentileHistogram()
            .register(registry)
            .record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    /**
     * Records bytes received from a WebSocket client.
     *
     * @param bytes number of bytes received
     */
    public void recordNetworkInboundWs(long bytes) {
        networkInboundWs.increment(bytes);
        frameSizeInbound.record(bytes);
    }

    public void recordNetworkOutboundWs(long bytes) {
        networkOutboundWs.increment(bytes);
    }
}
