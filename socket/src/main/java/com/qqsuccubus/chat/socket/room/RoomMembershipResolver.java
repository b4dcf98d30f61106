package com.qqsuccubus.chat.socket.room;

import com.qqsuccubus.chat.core.util.JitterBackoff;
import com.qqsuccubus.chat.socket.metrics.MetricsService;
import com.qqsuccubus.chat.socket.session.Connection;
import com.qqsuccubus.chat.socket.session.ISessionRegistry;
import com.qqsuccubus.chat.socket.store.ChatStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Set;

/**
 * Subscribes a newly established connection to every chat its user belongs to.
 * <p>
 * Subscriptions are resolved once per connection. A user added to a chat while connected
 * receives that chat's events after reconnecting.
 * </p>
 * <p>
 * A failing lookup is retried with jittered backoff; when retries are exhausted the connection
 * stays up with no subscriptions. That degradation is logged and counted, never reported to
 * the client.
 * </p>
 */
public class RoomMembershipResolver {
    private static final Logger log = LoggerFactory.getLogger(RoomMembershipResolver.class);

    private final ChatStore store;
    private final ISessionRegistry sessionRegistry;
    private final MetricsService metricsService;
    private final int maxRetries;
    private final Duration retryBase;

    public RoomMembershipResolver(ChatStore store, ISessionRegistry sessionRegistry, MetricsService metricsService,
                                  int maxRetries, Duration retryBase) {
        this.store = store;
        this.sessionRegistry = sessionRegistry;
        this.metricsService = metricsService;
        this.maxRetries = maxRetries;
        this.retryBase = retryBase;
    }

    /**
     * Resolves and records the connection's subscriptions.
     *
     * @return the room ids the connection was subscribed to; empty on degradation. Never errors.
     */
    public Mono<Set<String>> subscribe(Connection connection) {
        String userId = connection.getUserId();

        return store.findRoomsForUser(userId)
            .defaultIfEmpty(Set.of())
            .retryWhen(retrySpec(userId))
            .onErrorResume(err -> {
                log.warn("Room lookup failed for user {}, connection {} starts with no subscriptions",
                    userId, connection.getConnectionId(), err);
                metricsService.recordMembershipDegraded();
                return Mono.just(Set.of());
            })
            .map(roomIds -> {
                if (!sessionRegistry.subscribe(connection, roomIds)) {
                    return Set.<String>of();
                }
                log.debug("Connection {} of {} subscribed to {} rooms", connection.getConnectionId(), userId, roomIds.size());
                return roomIds;
            });
    }

    private Retry retrySpec(String userId) {
        return Retry.from(signals -> signals.concatMap(signal -> {
            if (signal.totalRetries() >= maxRetries) {
                return Mono.error(signal.failure());
            }
            Duration delay = JitterBackoff.next(signal.totalRetries(), retryBase);
            log.debug("Retrying room lookup for {} in {} ms (attempt {})",
                userId, delay.toMillis(), signal.totalRetries() + 1);
            return Mono.delay(delay);
        }));
    }
}
