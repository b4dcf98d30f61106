package com.qqsuccubus.chat.socket.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for a chat node, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class SocketConfig {

    String nodeId;
    int httpPort;

    /**
     * Storage backend: {@code redis} or {@code memory}.
     */
    String store;
    String redisUrl;

    /**
     * HS256 secret shared with the service that issues access tokens.
     */
    String jwtSecret;
    long jwtClockSkewSec;

    /**
     * Allowed WebSocket {@code Origin}; {@code *} allows any.
     */
    String frontendUrl;

    int perConnBufferSize;
    int pingInterval;
    int idleTimeout;

    /**
     * Upper bound of every storage call made while handling an event.
     */
    Duration storeTimeout;

    /**
     * Retries of the room lookup before a connection starts with no subscriptions.
     */
    int membershipRetries;
    Duration membershipRetryBase;

    public static SocketConfig fromEnv() {
        return SocketConfig.builder()
                .nodeId(getEnv("NODE_ID", "chat-node-1"))
                .httpPort(Integer.parseInt(getEnv("PORT", "5000")))
                .store(getEnv("STORE", "redis"))
                .redisUrl(getEnv("REDIS_URL", "redis://localhost:6379"))
                .jwtSecret(getEnv("JWT_SECRET", "default_jwt_secret_key_for_development"))
                .jwtClockSkewSec(Long.parseLong(getEnv("JWT_CLOCK_SKEW_SEC", "30")))
                .frontendUrl(getEnv("FRONTEND_URL", "http://localhost:3000"))
                .perConnBufferSize(Integer.parseInt(getEnv("PER_CONN_BUFFER_SIZE", "256")))
                .pingInterval(Integer.parseInt(getEnv("PING_INTERVAL", "25")))
                .idleTimeout(Integer.parseInt(getEnv("IDLE_TIMEOUT", "60")))
                .storeTimeout(Duration.ofMillis(Long.parseLong(getEnv("STORE_TIMEOUT_MS", "5000"))))
                .membershipRetries(Integer.parseInt(getEnv("MEMBERSHIP_RETRIES", "2")))
                .membershipRetryBase(Duration.ofMillis(Long.parseLong(getEnv("MEMBERSHIP_RETRY_BASE_MS", "200"))))
                .build();
    }

    public boolean isInMemoryStore() {
        return "memory".equalsIgnoreCase(store);
    }

    public boolean allowsAnyOrigin() {
        return frontendUrl == null || frontendUrl.isBlank() || "*".equals(frontendUrl.trim());
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
