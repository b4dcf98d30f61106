package com.qqsuccubus.chat.socket.session;

import com.qqsuccubus.chat.core.msg.Frame;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.util.UUID;

/**
 * Factory for {@link Connection} objects.
 * <p>
 * Separated from the registry to isolate sink sizing and id generation.
 * </p>
 */
public class ConnectionFactory {
    private final int perConnBufferSize;
    private final Clock clock;

    public ConnectionFactory(int perConnBufferSize, Clock clock) {
        this.perConnBufferSize = perConnBufferSize;
        this.clock = clock;
    }

    /**
     * Creates a connection for an authenticated user.
     * <p>
     * Frames queued before the transport subscribes are retained (up to the buffer size); once
     * the buffer is full further sends fail with {@code FAIL_OVERFLOW} instead of blocking.
     * </p>
     *
     * @param userId authenticated user
     * @return new, unregistered connection
     */
    public Connection create(String userId) {
        Sinks.Many<Frame> sink = Sinks.many().multicast().onBackpressureBuffer(perConnBufferSize, false);
        return new Connection(UUID.randomUUID().toString(), userId, clock.instant(), sink);
    }
}
