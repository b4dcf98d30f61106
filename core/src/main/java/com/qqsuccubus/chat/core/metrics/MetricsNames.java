package com.qqsuccubus.chat.core.metrics;

/**
 * Micrometer metric names used by chat nodes.
 * <p>
 * <b>Naming convention:</b> {@code chat.<component>.<metric>}; counters end in {@code .total},
 * gauges carry no suffix, timers end in {@code .latency}.
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Gauge: live WebSocket connections.
     */
    public static final String CONNECTIONS_ACTIVE = "chat.socket.connections.active";

    /**
     * Gauge: distinct users holding at least one connection.
     */
    public static final String USERS_ONLINE = "chat.socket.users.online";

    /**
     * Counter: upgrade attempts refused.
     * <p>
     * Tags: nodeId, reason (auth/origin)
     * </p>
     */
    public static final String CONNECTIONS_REJECTED_TOTAL = "chat.socket.connections.rejected.total";

    /**
     * Counter: inbound events accepted from clients.
     * <p>
     * Tags: nodeId, event
     * </p>
     */
    public static final String EVENTS_INBOUND_TOTAL = "chat.socket.events.inbound.total";

    /**
     * Counter: outbound frames pushed to a connection.
     * <p>
     * Tags: nodeId, event
     * </p>
     */
    public static final String DELIVERIES_TOTAL = "chat.socket.deliveries.total";

    /**
     * Counter: outbound frames that could not be pushed.
     * <p>
     * Tags: nodeId, reason (buffer_full/closed)
     * </p>
     */
    public static final String DROPS_TOTAL = "chat.socket.drops.total";

    /**
     * Counter: error frames sent back to an originator.
     * <p>
     * Tags: nodeId, reason (validation/persistence)
     * </p>
     */
    public static final String EVENT_ERRORS_TOTAL = "chat.socket.event.errors.total";

    /**
     * Counter: connections that started with no subscriptions because the room lookup failed.
     */
    public static final String MEMBERSHIP_DEGRADED_TOTAL = "chat.socket.membership.degraded.total";

    /**
     * Counter: partially applied writes (message saved, chat pointer not updated).
     */
    public static final String STORE_INCONSISTENCY_TOTAL = "chat.store.inconsistency.total";

    /**
     * Timer: storage call latency.
     * <p>
     * Tags: operation, outcome
     * </p>
     */
    public static final String STORE_LATENCY = "chat.store.latency";

    /**
     * Counter: bytes received from WebSocket clients.
     */
    public static final String NETWORK_INBOUND_WS_BYTES = "chat.socket.network.inbound.ws.bytes";

    /**
     * Counter: bytes sent to WebSocket clients.
     */
    public static final String NETWORK_OUTBOUND_WS_BYTES = "chat.socket.network.outbound.ws.bytes";
}
