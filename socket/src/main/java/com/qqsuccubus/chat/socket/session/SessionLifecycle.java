package com.qqsuccubus.chat.socket.session;

import com.qqsuccubus.chat.socket.presence.PresenceTracker;
import com.qqsuccubus.chat.socket.room.RoomMembershipResolver;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Establishes and tears down connections of authenticated users.
 * <p>
 * Connect order: create, register, announce presence, subscribe to rooms. Presence is announced
 * right after the registry change, independent of how long room resolution takes. The connection
 * is returned only after its subscriptions are in place, so every event it sends is routed
 * against its final room set.
 * </p>
 */
@RequiredArgsConstructor
public class SessionLifecycle {
	private static final Logger log = LoggerFactory.getLogger(SessionLifecycle.class);

	private final ConnectionFactory connectionFactory;
	private final ISessionRegistry sessionRegistry;
	private final RoomMembershipResolver membershipResolver;
	private final PresenceTracker presenceTracker;

	public Mono<Connection> connect(String userId) {
		return Mono.defer(() -> {
			Connection connection = connectionFactory.create(userId);
			PresenceTransition transition = sessionRegistry.register(userId, connection);
			log.info("Connection {} opened for user {} ({} connections on node)",
					connection.getConnectionId(), userId, sessionRegistry.connectionCount());

			presenceTracker.onRegistered(userId, transition);
			return membershipResolver.subscribe(connection).thenReturn(connection);
		});
	}

	/**
	 * Removes the connection and completes its outbound stream. Repeated calls announce nothing.
	 */
	public void disconnect(Connection connection) {
		String userId = connection.getUserId();
		PresenceTransition transition = sessionRegistry.unregister(userId, connection);
		connection.close();

		log.info("Connection {} closed for user {}", connection.getConnectionId(), userId);
		presenceTracker.onUnregistered(userId, transition);
	}

	public void disconnectAll() {
		int count = 0;
		for (Connection connection : sessionRegistry.allConnections()) {
			disconnect(connection);
			count++;
		}
		log.info("Closed {} connections", count);
	}
}
