package com.qqsuccubus.chat.socket;

import com.qqsuccubus.chat.socket.auth.AuthenticationGate;
import com.qqsuccubus.chat.socket.auth.TokenService;
import com.qqsuccubus.chat.socket.config.SocketConfig;
import com.qqsuccubus.chat.socket.http.HttpServer;
import com.qqsuccubus.chat.socket.metrics.MetricsService;
import com.qqsuccubus.chat.socket.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.chat.socket.presence.PresenceTracker;
import com.qqsuccubus.chat.socket.room.RoomMembershipResolver;
import com.qqsuccubus.chat.socket.router.EventRouter;
import com.qqsuccubus.chat.socket.session.ConnectionFactory;
import com.qqsuccubus.chat.socket.session.SessionLifecycle;
import com.qqsuccubus.chat.socket.session.SessionRegistry;
import com.qqsuccubus.chat.socket.store.ChatStore;
import com.qqsuccubus.chat.socket.store.InMemoryChatStore;
import com.qqsuccubus.chat.socket.store.RedisChatStore;
import com.qqsuccubus.chat.socket.store.TimedChatStore;
import com.qqsuccubus.chat.socket.ws.ChatWebSocketHandler;
import com.qqsuccubus.chat.socket.ws.WebSocketUpgradeHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Hooks;

import java.time.Clock;

/**
 * Main entry point for a chat node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Serve authenticated WebSockets at /ws (token in query or Authorization header)</li>
 *   <li>Track live connections and the chats each one is subscribed to</li>
 *   <li>Persist messages and read receipts, then fan them out to chat members</li>
 *   <li>Broadcast presence changes</li>
 *   <li>Expose /health, /healthz, /readyz and /metrics endpoints</li>
 * </ul>
 * </p>
 */
public class ChatSocketApp {
    private static final Logger log = LoggerFactory.getLogger(ChatSocketApp.class);

    private static final String DEFAULT_JWT_SECRET = "default_jwt_secret_key_for_development";

    public static void main(String[] args) {
        SocketConfig config = SocketConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());
        installErrorHandlers();

        log.info("Starting chat node: {}", config.getNodeId());
        log.info("  Store: {}", config.isInMemoryStore() ? "memory" : config.getRedisUrl());
        log.info("  Allowed origin: {}", config.getFrontendUrl());
        if (DEFAULT_JWT_SECRET.equals(config.getJwtSecret())) {
            log.warn("JWT_SECRET is not set, using the development secret");
        }

        Clock clock = Clock.systemUTC();

        TokenService tokenService;
        try {
            tokenService = new TokenService(config.getJwtSecret(), config.getJwtClockSkewSec(), clock);
        } catch (RuntimeException e) {
            exit("Invalid JWT_SECRET (HS256 needs at least 256 bits)", e);
            return;
        }

        // Setup metrics registry with Prometheus support
        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry(), config);

        ChatStore store;
        try {
            store = new TimedChatStore(createStore(config, clock), config.getStoreTimeout(), metricsService);
            store.ping().block(config.getStoreTimeout().plusSeconds(1));
        } catch (RuntimeException e) {
            exit("Store is not reachable", e);
            return;
        }

        SessionRegistry sessionRegistry = new SessionRegistry();
        metricsService.bindSessionGauges(sessionRegistry);

        EventRouter eventRouter = new EventRouter(sessionRegistry, store, metricsService);
        PresenceTracker presenceTracker = new PresenceTracker(eventRouter, sessionRegistry, store, clock);
        RoomMembershipResolver membershipResolver = new RoomMembershipResolver(
            store, sessionRegistry, metricsService, config.getMembershipRetries(), config.getMembershipRetryBase()
        );
        SessionLifecycle sessionLifecycle = new SessionLifecycle(
            new ConnectionFactory(config.getPerConnBufferSize(), clock),
            sessionRegistry,
            membershipResolver,
            presenceTracker
        );

        AuthenticationGate authenticationGate = new AuthenticationGate(tokenService, store);
        WebSocketUpgradeHandler upgradeHandler = new WebSocketUpgradeHandler(
            config,
            authenticationGate,
            new ChatWebSocketHandler(config, sessionLifecycle, eventRouter, metricsService),
            metricsService
        );

        // Start HTTP + WebSocket server
        HttpServer httpServer = new HttpServer(config, upgradeHandler, metricsExporter, store);
        try {
            httpServer.start();
        } catch (RuntimeException e) {
            store.close();
            exit("Failed to bind port " + config.getHttpPort(), e);
            return;
        }

        log.info("Chat node {} is ready", config.getNodeId());

        handleShutdown(config, sessionLifecycle, httpServer, store);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static ChatStore createStore(SocketConfig config, Clock clock) {
        if (config.isInMemoryStore()) {
            log.warn("Using the in-memory store, data is lost on restart");
            return new InMemoryChatStore(clock);
        }
        return new RedisChatStore(config, clock);
    }

    private static void installErrorHandlers() {
        Thread.setDefaultUncaughtExceptionHandler((thread, err) ->
            log.error("Uncaught exception in thread {}", thread.getName(), err));
        Hooks.onErrorDropped(err -> log.error("Dropped reactive error", err));
    }

    private static void exit(String reason, Throwable cause) {
        log.error("Startup failed: {}", reason, cause);
        System.exit(1);
    }

    private static void handleShutdown(SocketConfig config,
                                       SessionLifecycle sessionLifecycle,
                                       HttpServer httpServer,
                                       ChatStore store) {
        // Graceful shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("nodeId", config.getNodeId());
            log.info("Shutdown signal received, initiating graceful shutdown...");

            // Close sessions first so their lastSeen writes can still reach the store
            sessionLifecycle.disconnectAll();

            // Stop WS server
            httpServer.stop();

            store.close();
            log.info("Shutdown complete");
        }));
    }
}
