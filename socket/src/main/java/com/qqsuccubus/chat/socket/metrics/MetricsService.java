package com.qqsuccubus.chat.socket.metrics;

import com.qqsuccubus.chat.core.metrics.MetricsNames;
import com.qqsuccubus.chat.core.metrics.MetricsTags;
import com.qqsuccubus.chat.core.msg.EventNames;
import com.qqsuccubus.chat.socket.config.SocketConfig;
import com.qqsuccubus.chat.socket.session.ISessionRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized metrics service for a chat node.
 */
public class MetricsService {

    private static final List<String> KNOWN_EVENTS = List.of(
        EventNames.SEND_MESSAGE, EventNames.TYPING, EventNames.READ_MESSAGE, EventNames.PING,
        EventNames.NEW_MESSAGE, EventNames.MESSAGES_READ, EventNames.USER_STATUS, EventNames.ERROR
    );

    private final MeterRegistry registry;
    private final String nodeId;

    // Counters keyed by tag value
    private final Map<String, Counter> inboundEvents = new ConcurrentHashMap<>();
    private final Map<String, Counter> deliveries = new ConcurrentHashMap<>();
    private final Map<String, Counter> drops = new ConcurrentHashMap<>();
    private final Map<String, Counter> eventErrors = new ConcurrentHashMap<>();
    private final Map<String, Counter> rejections = new ConcurrentHashMap<>();

    private final Counter membershipDegraded;
    private final Counter storeInconsistency;

    // Network traffic counters (bytes)
    private final Counter networkInboundWs;
    private final Counter networkOutboundWs;

    public MetricsService(MeterRegistry registry, SocketConfig config) {
        this.registry = registry;
        this.nodeId = config.getNodeId();

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        for (String event : KNOWN_EVENTS) {
            inboundCounter(event);
            deliveryCounter(event);
        }

        membershipDegraded = Counter.builder(MetricsNames.MEMBERSHIP_DEGRADED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Connections established with no room subscriptions after a lookup failure")
            .register(registry);

        storeInconsistency = Counter.builder(MetricsNames.STORE_INCONSISTENCY_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Messages persisted without their chat's last-message pointer")
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
    }

    /**
     * Registers the connection and online-user gauges against a live registry.
     */
    public void bindSessionGauges(ISessionRegistry sessionRegistry) {
        Gauge.builder(MetricsNames.CONNECTIONS_ACTIVE, sessionRegistry, ISessionRegistry::connectionCount)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Live WebSocket connections")
            .register(registry);

        Gauge.builder(MetricsNames.USERS_ONLINE, sessionRegistry, ISessionRegistry::onlineUserCount)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Users holding at least one connection")
            .register(registry);
    }

    public void recordInboundEvent(String event) {
        inboundCounter(KNOWN_EVENTS.contains(event) ? event : "unknown").increment();
    }

    public void recordDelivery(String event) {
        deliveryCounter(event).increment();
    }

    public void recordDrop(String reason) {
        drops.computeIfAbsent(reason, r -> Counter.builder(MetricsNames.DROPS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, r)
            .description("Outbound frames dropped")
            .register(registry)).increment();
    }

    public void recordEventError(String reason) {
        eventErrors.computeIfAbsent(reason, r -> Counter.builder(MetricsNames.EVENT_ERRORS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, r)
            .description("Error frames returned to originators")
            .register(registry)).increment();
    }

    public void recordConnectionRejected(String reason) {
        rejections.computeIfAbsent(reason, r -> Counter.builder(MetricsNames.CONNECTIONS_REJECTED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, r)
            .description("WebSocket upgrades refused")
            .register(registry)).increment();
    }

    public void recordMembershipDegraded() {
        membershipDegraded.increment();
    }

    public void recordStoreInconsistency() {
        storeInconsistency.increment();
    }

    /**
     * Records the latency of one storage call.
     *
     * @param operation  storage operation name
     * @param startNanos value of {@link System#nanoTime()} taken before the call
     * @param success    whether the call completed without error
     */
    public void recordStoreLatency(String operation, long startNanos, boolean success) {
        Timer.builder(MetricsNames.STORE_LATENCY)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.OPERATION, operation)
            .tag(MetricsTags.OUTCOME, success ? "success" : "failure")
            .description("Storage call latency")
            .publishPercentileHistogram()
            .register(registry)
            .record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    /**
     * Records bytes received from WebSocket client.
     *
     * @param bytes number of bytes received
     */
    public void recordNetworkInboundWs(long bytes) {
        networkInboundWs.increment(bytes);
    }

    /**
     * Records bytes sent to WebSocket client.
     *
     * @param bytes number of bytes sent
     */
    public void recordNetworkOutboundWs(long bytes) {
        networkOutboundWs.increment(bytes);
    }

    private Counter inboundCounter(String event) {
        return inboundEvents.computeIfAbsent(event, e -> Counter.builder(MetricsNames.EVENTS_INBOUND_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.EVENT, e)
            .description("Inbound events received from clients")
            .register(registry));
    }

    private Counter deliveryCounter(String event) {
        return deliveries.computeIfAbsent(event, e -> Counter.builder(MetricsNames.DELIVERIES_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.EVENT, e)
            .description("Outbound frames pushed to connections")
            .register(registry));
    }
}
