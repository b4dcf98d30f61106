package com.qqsuccubus.chat.socket.room;

import com.qqsuccubus.chat.core.metrics.MetricsNames;
import com.qqsuccubus.chat.core.model.ChatRoom;
import com.qqsuccubus.chat.socket.config.SocketConfig;
import com.qqsuccubus.chat.socket.metrics.MetricsService;
import com.qqsuccubus.chat.socket.session.Connection;
import com.qqsuccubus.chat.socket.session.ConnectionFactory;
import com.qqsuccubus.chat.socket.session.SessionRegistry;
import com.qqsuccubus.chat.socket.store.FlakyChatStore;
import com.qqsuccubus.chat.socket.store.InMemoryChatStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RoomMembershipResolverTest {

    private FlakyChatStore store;
    private SessionRegistry registry;
    private SimpleMeterRegistry meterRegistry;
    private RoomMembershipResolver resolver;
    private ConnectionFactory factory;

    @BeforeEach
    void setUp() {
        store = new FlakyChatStore(new InMemoryChatStore()
                .putChat(ChatRoom.builder().id("chat1").participant("alice").participant("bob").build())
                .putChat(ChatRoom.builder().id("group1").participant("alice").participant("carol").group(true).build()));
        registry = new SessionRegistry();
        meterRegistry = new SimpleMeterRegistry();
        MetricsService metrics = new MetricsService(meterRegistry, SocketConfig.builder().nodeId("test-node").build());
        resolver = new RoomMembershipResolver(store, registry, metrics, 2, Duration.ofMillis(5));
        factory = new ConnectionFactory(16, Clock.systemUTC());
    }

    @Test
    void testSubscribesToAllChatsOfUser() {
        Connection alice = register("alice");

        StepVerifier.create(resolver.subscribe(alice))
                .expectNext(Set.of("chat1", "group1"))
                .verifyComplete();

        assertEquals(Set.of(alice), registry.connectionsInRoom("group1"));
        assertTrue(alice.isSubscribedTo("chat1"));
    }

    @Test
    @DisplayName("Transient lookup failures are retried")
    void testRetriesThenSucceeds() {
        store.roomLookupFailuresLeft.set(2);
        Connection alice = register("alice");

        StepVerifier.create(resolver.subscribe(alice))
                .expectNext(Set.of("chat1", "group1"))
                .verifyComplete();

        assertEquals(3, store.roomLookupCalls.get());
        assertEquals(0.0, degradedCount());
    }

    @Test
    @DisplayName("Exhausted retries leave the connection up with no subscriptions")
    void testDegradesToEmptySubscriptions() {
        store.roomLookupFailuresLeft.set(100);
        Connection alice = register("alice");

        StepVerifier.create(resolver.subscribe(alice))
                .expectNext(Set.of())
                .verifyComplete();

        assertEquals(3, store.roomLookupCalls.get());
        assertEquals(1.0, degradedCount());
        assertTrue(registry.isOnline("alice"));
        assertTrue(registry.connectionsInRoom("chat1").isEmpty());
    }

    @Test
    void testConnectionClosedBeforeLookupCompletes() {
        Connection alice = register("alice");
        registry.unregister("alice", alice);

        StepVerifier.create(resolver.subscribe(alice))
                .expectNext(Set.of())
                .verifyComplete();

        assertTrue(registry.connectionsInRoom("chat1").isEmpty());
    }

    private Connection register(String userId) {
        Connection connection = factory.create(userId);
        registry.register(userId, connection);
        return connection;
    }

    private double degradedCount() {
        return meterRegistry.get(MetricsNames.MEMBERSHIP_DEGRADED_TOTAL).counter().count();
    }
}
