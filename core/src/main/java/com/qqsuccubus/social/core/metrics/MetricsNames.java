package com.qqsuccubus.social.core.metrics;

/**
 * Micrometer metric names used across the system.
 * <p>
 * <b>Naming convention:</b> {@code social.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Gauge: open WebSocket connections.
     */
    public static final String CONNECTIONS_ACTIVE = "social.socket.connections.active";

    /**
     * Gauge: users with at least one registered connection.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String PRESENCE_ONLINE_USERS = "social.presence.online.users";

    /**
     * Counter: presence snapshots computed.
     * <p>
     * Tags: nodeId, result (published/skipped)
     * </p>
     */
    public static final String PRESENCE_BROADCAST_TOTAL = "social.presence.broadcast.total";

    /**
     * Counter: direct messages handled.
     * <p>
     * Tags: nodeId, result (delivered/failed)
     * </p>
     */
    public static final String MESSAGES_TOTAL = "social.message.total";

    /**
     * Counter: reaction transitions applied.
     * <p>
     * Tags: nodeId, type (added/removed/switched)
     * </p>
     */
    public static final String REACTIONS_TOTAL = "social.reaction.total";

    /**
     * Counter: updates created.
     */
    public static final String UPDATES_CREATED_TOTAL = "social.update.created.total";

    /**
     * Counter: frames not handed to a connection.
     * <p>
     * Tags: nodeId, reason (buffer_full/closed)
     * </p>
     */
    public static final String DROPS_TOTAL = "social.socket.drops.total";

    /**
     * Timer: inbound event handling latency.
     * <p>
     * Tags: nodeId, event
     * </p>
     */
    public static final String EVENT_LATENCY = "social.socket.event.latency";

    /**
     * Counter: bytes received from WebSocket clients.
     */
    public static final String NETWORK_INBOUND_WS_BYTES = "social.socket.network.inbound.ws.bytes";

    /**
     * Counter: bytes sent to WebSocket clients.
     */
    public static final String NETWORK_OUTBOUND_WS_BYTES = "social.socket.network.outbound.ws.bytes";
}
