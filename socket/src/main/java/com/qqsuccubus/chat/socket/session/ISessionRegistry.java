package com.qqsuccubus.chat.socket.session;

import java.util.Collection;
import java.util.Set;

/**
 * Registry of live connections, keyed by user and by subscribed room.
 * <p>
 * Ground truth for "is user X reachable" and the routing table of room fan-out. Every
 * operation is safe to call concurrently from any connection's lifecycle.
 * </p>
 */
public interface ISessionRegistry {
    /**
     * Adds a connection under its user, leaving the user's other connections untouched.
     * Registering the same connection twice is a no-op.
     *
     * @return {@link PresenceTransition#CAME_ONLINE} if it is the user's first connection
     */
    PresenceTransition register(String userId, Connection connection);

    /**
     * Removes exactly this connection, including its room subscriptions.
     *
     * @return {@link PresenceTransition#WENT_OFFLINE} if it was the user's last connection
     */
    PresenceTransition unregister(String userId, Connection connection);

    /**
     * Subscribes a registered connection to rooms. A connection's subscriptions are set once;
     * later calls, and calls for connections no longer registered, are ignored.
     *
     * @return true if the subscriptions were recorded
     */
    boolean subscribe(Connection connection, Set<String> roomIds);

    boolean isOnline(String userId);

    /**
     * Snapshot of the user's live connections (empty if offline).
     */
    Set<Connection> connectionsFor(String userId);

    /**
     * Snapshot of the connections subscribed to a room.
     */
    Set<Connection> connectionsInRoom(String roomId);

    /**
     * Snapshot of every live connection.
     */
    Collection<Connection> allConnections();

    int connectionCount();

    int onlineUserCount();
}
