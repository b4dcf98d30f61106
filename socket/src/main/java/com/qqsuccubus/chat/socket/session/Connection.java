package com.qqsuccubus.chat.socket.session;

import com.qqsuccubus.chat.core.msg.Frame;
import lombok.Getter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Instant;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One live WebSocket session of an authenticated user.
 * <p>
 * The outbound sink is the connection's send-capability. It is written from many threads
 * (fan-out triggered by other connections), so every emission goes through the synchronized
 * {@link #send(Frame)}. The subscribed room set is assigned exactly once, when the connection
 * is established, and never changes afterwards.
 * </p>
 */
public class Connection {
    @Getter
    private final String connectionId;
    @Getter
    private final String userId;
    @Getter
    private final Instant connectedAt;

    private final Sinks.Many<Frame> sink;
    private final AtomicBoolean subscribed = new AtomicBoolean(false);
    private volatile Set<String> rooms = Set.of();
    private volatile boolean closed;

    public Connection(String connectionId, String userId, Instant connectedAt, Sinks.Many<Frame> sink) {
        this.connectionId = connectionId;
        this.userId = userId;
        this.connectedAt = connectedAt;
        this.sink = sink;
    }

    /**
     * Pushes a frame to this connection's outbound stream.
     *
     * @return the emission outcome; failures mean the frame was not queued
     */
    public synchronized Sinks.EmitResult send(Frame frame) {
        if (closed) {
            return Sinks.EmitResult.FAIL_TERMINATED;
        }
        return sink.tryEmitNext(frame);
    }

    /**
     * Frames to write to the transport, in the order they were queued.
     */
    public Flux<Frame> outbound() {
        return sink.asFlux();
    }

    /**
     * Completes the outbound stream. Frames sent afterwards are rejected.
     */
    public synchronized void close() {
        if (!closed) {
            closed = true;
            sink.tryEmitComplete();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Assigns the room subscriptions. Only the first call has an effect.
     *
     * @return true if this call assigned the rooms
     */
    boolean assignRooms(Set<String> roomIds) {
        if (subscribed.compareAndSet(false, true)) {
            rooms = Set.copyOf(roomIds);
            return true;
        }
        return false;
    }

    public Set<String> getRooms() {
        return rooms;
    }

    public boolean isSubscribedTo(String roomId) {
        return roomId != null && rooms.contains(roomId);
    }

    @Override
    public String toString() {
        return "Connection{" + connectionId + ", user=" + userId + "}";
    }
}
