package com.qqsuccubus.chat.socket.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * In-process {@link ISessionRegistry} backed by two concurrent indexes.
 * <p>
 * Both indexes are only modified inside {@code compute} calls, so changes to one user's entry
 * (or one room's entry) are serialized on that key while unrelated keys proceed in parallel.
 * Room index updates for a connection happen inside the compute of its user entry, which
 * orders {@link #subscribe} against {@link #unregister} for the same user: a connection that
 * was already removed can never be left behind in a room.
 * </p>
 */
public class SessionRegistry implements ISessionRegistry {
	private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

	// userId -> live connections of that user
	private final Map<String, Set<Connection>> connectionsByUser = new ConcurrentHashMap<>();

	// roomId -> connections subscribed to that room
	private final Map<String, Set<Connection>> connectionsByRoom = new ConcurrentHashMap<>();

	@Override
	public PresenceTransition register(String userId, Connection connection) {
		AtomicBoolean first = new AtomicBoolean(false);

		connectionsByUser.compute(userId, (key, connections) -> {
			Set<Connection> target = connections;
			if (target == null) {
				target = ConcurrentHashMap.newKeySet();
				first.set(true);
			}
			target.add(connection);
			return target;
		});

		log.debug("Registered {} (first={})", connection, first.get());
		return first.get() ? PresenceTransition.CAME_ONLINE : PresenceTransition.NONE;
	}

	@Override
	public PresenceTransition unregister(String userId, Connection connection) {
		AtomicBoolean last = new AtomicBoolean(false);

		connectionsByUser.computeIfPresent(userId, (key, connections) -> {
			if (!connections.remove(connection)) {
				return connections;
			}
			connection.getRooms().forEach(roomId -> removeFromRoom(roomId, connection));
			if (connections.isEmpty()) {
				last.set(true);
				return null;
			}
			return connections;
		});

		log.debug("Unregistered {} (last={})", connection, last.get());
		return last.get() ? PresenceTransition.WENT_OFFLINE : PresenceTransition.NONE;
	}

	@Override
	public boolean subscribe(Connection connection, Set<String> roomIds) {
		AtomicBoolean applied = new AtomicBoolean(false);

		connectionsByUser.computeIfPresent(connection.getUserId(), (key, connections) -> {
			if (connections.contains(connection) && connection.assignRooms(roomIds)) {
				roomIds.forEach(roomId -> addToRoom(roomId, connection));
				applied.set(true);
			}
			return connections;
		});

		if (!applied.get()) {
			log.debug("Subscription of {} ignored (closed or already subscribed)", connection);
		}
		return applied.get();
	}

	@Override
	public boolean isOnline(String userId) {
		Set<Connection> connections = connectionsByUser.get(userId);
		return connections != null && !connections.isEmpty();
	}

	@Override
	public Set<Connection> connectionsFor(String userId) {
		return Set.copyOf(connectionsByUser.getOrDefault(userId, Set.of()));
	}

	@Override
	public Set<Connection> connectionsInRoom(String roomId) {
		return Set.copyOf(connectionsByRoom.getOrDefault(roomId, Set.of()));
	}

	@Override
	public Collection<Connection> allConnections() {
		return connectionsByUser.values().stream()
				.flatMap(Set::stream)
				.collect(Collectors.toUnmodifiableList());
	}

	@Override
	public int connectionCount() {
		return connectionsByUser.values().stream().mapToInt(Set::size).sum();
	}

	@Override
	public int onlineUserCount() {
		return connectionsByUser.size();
	}

	private void addToRoom(String roomId, Connection connection) {
		connectionsByRoom.compute(roomId, (key, connections) -> {
			Set<Connection> target = connections != null ? connections : ConcurrentHashMap.newKeySet();
			target.add(connection);
			return target;
		});
	}

	private void removeFromRoom(String roomId, Connection connection) {
		connectionsByRoom.computeIfPresent(roomId, (key, connections) -> {
			connections.remove(connection);
			return connections.isEmpty() ? null : connections;
		});
	}
}
