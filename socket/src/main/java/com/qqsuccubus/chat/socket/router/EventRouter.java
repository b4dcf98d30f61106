package com.qqsuccubus.chat.socket.router;

import com.qqsuccubus.chat.core.model.ChatMessage;
import com.qqsuccubus.chat.core.model.UserStatus;
import com.qqsuccubus.chat.core.msg.ChatEvents;
import com.qqsuccubus.chat.core.msg.EventNames;
import com.qqsuccubus.chat.core.msg.Frame;
import com.qqsuccubus.chat.core.util.JsonUtils;
import com.qqsuccubus.chat.socket.error.ChatException;
import com.qqsuccubus.chat.socket.error.PersistenceException;
import com.qqsuccubus.chat.socket.error.ValidationException;
import com.qqsuccubus.chat.socket.metrics.MetricsService;
import com.qqsuccubus.chat.socket.session.Connection;
import com.qqsuccubus.chat.socket.session.ISessionRegistry;
import com.qqsuccubus.chat.socket.store.ChatStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.Collection;

/**
 * Validates inbound client events, persists what needs persisting and fans the resulting
 * events out to subscribed connections.
 * <p>
 * Routing table (inbound → outbound):
 * <ul>
 *   <li>send_message {content, chatId} → new_message to every connection of the chat,
 *       the sender's own connections included</li>
 *   <li>typing {chatId, isTyping} → typing to the chat, originator excluded</li>
 *   <li>read_message {chatId} → messages_read {chatId, userId} to the chat, originator excluded</li>
 *   <li>ping → nothing</li>
 * </ul>
 * Presence changes are published globally through {@link #publishPresence}.
 * </p>
 * <p>
 * Any failure while handling an inbound event ends up as an {@code error} frame for the
 * originating connection only. The returned {@code Mono} of {@link #handleInbound} never
 * errors, so one bad event cannot tear down the connection's inbound stream.
 * </p>
 * <p>
 * A message is fanned out only after it has been stored. If the chat's last-message pointer
 * cannot be updated afterwards, the stored message is still delivered and the inconsistency is
 * logged and counted; nothing retries it.
 * </p>
 */
public class EventRouter {
	private static final Logger log = LoggerFactory.getLogger(EventRouter.class);

	private final ISessionRegistry sessionRegistry;
	private final ChatStore store;
	private final MetricsService metricsService;

	public EventRouter(ISessionRegistry sessionRegistry, ChatStore store, MetricsService metricsService) {
		this.sessionRegistry = sessionRegistry;
		this.store = store;
		this.metricsService = metricsService;
	}

	/**
	 * Handles one text frame received from a connection.
	 *
	 * @param origin    connection the frame arrived on
	 * @param frameJson raw frame text
	 * @return Mono completing once the event is persisted and fanned out (or rejected)
	 */
	public Mono<Void> handleInbound(Connection origin, String frameJson) {
		return Mono.defer(() -> {
					Frame frame = decode(frameJson);
					String event = frame.getEvent();
					metricsService.recordInboundEvent(event);
					log.debug("Event '{}' from {}", event, origin);

					switch (event) {
						case EventNames.SEND_MESSAGE -> {
							return sendMessage(origin, payload(frame, ChatEvents.SendMessage.class));
						}
						case EventNames.TYPING -> {
							return typing(origin, payload(frame, ChatEvents.Typing.class));
						}
						case EventNames.READ_MESSAGE -> {
							return readMessages(origin, payload(frame, ChatEvents.ReadMessage.class));
						}
						case EventNames.PING -> {
							return Mono.<Void>empty();
						}
						default -> {
							return Mono.<Void>error(new ValidationException("Unknown event '" + event + "'"));
						}
					}
				})
				.onErrorResume(err -> {
					replyError(origin, err);
					return Mono.empty();
				});
	}

	/**
	 * Broadcasts a user's presence change to every live connection.
	 *
	 * @return number of connections the change was delivered to
	 */
	public int publishPresence(String userId, UserStatus status) {
		Frame frame = Frame.of(EventNames.USER_STATUS, new ChatEvents.UserStatusChange(userId, status));
		int delivered = deliverAll(sessionRegistry.allConnections(), frame, null);
		log.debug("Presence {} of {} delivered to {} connections", status, userId, delivered);
		return delivered;
	}

	/**
	 * Pushes a frame to every connection subscribed to a room.
	 *
	 * @param exclude connection to skip, or null to include all
	 * @return number of connections the frame was delivered to
	 */
	public int broadcastToRoom(String roomId, Frame frame, Connection exclude) {
		return deliverAll(sessionRegistry.connectionsInRoom(roomId), frame, exclude);
	}

	private Mono<Void> sendMessage(Connection origin, ChatEvents.SendMessage command) {
		String chatId = requireSubscribed(origin, command.getChatId());
		String content = command.getContent();
		if (content == null || content.isBlank()) {
			throw new ValidationException("Message content must not be empty");
		}

		return store.createMessage(origin.getUserId(), chatId, content)
				.switchIfEmpty(Mono.error(() -> new IllegalStateException("Store returned no message")))
				.onErrorMap(err -> new PersistenceException("Failed to send message", err))
				.flatMap(message -> updateLastMessage(message).thenReturn(message))
				.doOnNext(message -> {
					int delivered = broadcastToRoom(chatId, Frame.of(EventNames.NEW_MESSAGE, message), null);
					log.debug("Message {} in chat {} delivered to {} connections", message.getId(), chatId, delivered);
				})
				.then();
	}

	private Mono<Void> updateLastMessage(ChatMessage message) {
		return store.setRoomLastMessage(message.getChatId(), message.getId())
				.onErrorResume(err -> {
					log.error("Inconsistent chat {}: message {} stored but last-message pointer not updated",
							message.getChatId(), message.getId(), err);
					metricsService.recordStoreInconsistency();
					return Mono.empty();
				});
	}

	private Mono<Void> typing(Connection origin, ChatEvents.Typing typing) {
		String chatId = requireSubscribed(origin, typing.getChatId());
		if (typing.getTyping() == null) {
			throw new ValidationException("Malformed 'typing' payload: isTyping is required");
		}

		broadcastToRoom(chatId, Frame.of(EventNames.TYPING, new ChatEvents.Typing(chatId, typing.getTyping())), origin);
		return Mono.empty();
	}

	private Mono<Void> readMessages(Connection origin, ChatEvents.ReadMessage readMessage) {
		String chatId = requireSubscribed(origin, readMessage.getChatId());
		String userId = origin.getUserId();

		return store.markMessagesRead(chatId, userId)
				.onErrorMap(err -> new PersistenceException("Failed to mark messages as read", err))
				.doOnNext(marked -> {
					log.debug("User {} read chat {} ({} messages marked)", userId, chatId, marked);
					broadcastToRoom(chatId, Frame.of(EventNames.MESSAGES_READ,
							new ChatEvents.MessagesRead(chatId, userId)), origin);
				})
				.then();
	}

	private static String requireSubscribed(Connection origin, String chatId) {
		if (chatId == null || chatId.isBlank()) {
			throw new ValidationException("chatId is required");
		}
		if (!origin.isSubscribedTo(chatId)) {
			throw new ValidationException("Not a participant of chat " + chatId);
		}
		return chatId;
	}

	private static Frame decode(String frameJson) {
		Frame frame;
		try {
			frame = JsonUtils.readValue(frameJson, Frame.class);
		} catch (IllegalArgumentException e) {
			throw new ValidationException("Malformed event: not a JSON frame");
		}
		if (frame == null || frame.getEvent() == null || frame.getEvent().isBlank()) {
			throw new ValidationException("Malformed event: missing 'event'");
		}
		return frame;
	}

	private static <T> T payload(Frame frame, Class<T> type) {
		if (frame.getData() == null) {
			throw new ValidationException("Malformed '" + frame.getEvent() + "' payload");
		}
		try {
			return JsonUtils.convert(frame.getData(), type);
		} catch (IllegalArgumentException e) {
			throw new ValidationException("Malformed '" + frame.getEvent() + "' payload");
		}
	}

	private int deliverAll(Collection<Connection> targets, Frame frame, Connection exclude) {
		int delivered = 0;
		for (Connection connection : targets) {
			if (connection == exclude) {
				continue;
			}
			if (deliver(connection, frame)) {
				delivered++;
			}
		}
		return delivered;
	}

	private boolean deliver(Connection connection, Frame frame) {
		try {
			Sinks.EmitResult result = connection.send(frame);
			if (result.isSuccess()) {
				metricsService.recordDelivery(frame.getEvent());
				return true;
			}
			log.warn("Failed to push '{}' to {}: {}", frame.getEvent(), connection, result);
			metricsService.recordDrop(result == Sinks.EmitResult.FAIL_OVERFLOW ? "buffer_full" : "closed");
		} catch (RuntimeException e) {
			log.warn("Error pushing '{}' to {}", frame.getEvent(), connection, e);
			metricsService.recordDrop("send_error");
		}
		return false;
	}

	private void replyError(Connection origin, Throwable err) {
		String message;
		String reason;
		if (err instanceof ChatException chatException) {
			message = chatException.getMessage();
			reason = chatException.reason();
			if (err instanceof PersistenceException) {
				log.warn("{} for {}: {}", message, origin, String.valueOf(err.getCause()));
			} else {
				log.debug("Rejected event from {}: {}", origin, message);
			}
		} else {
			message = "Failed to process event";
			reason = "internal";
			log.error("Unexpected error handling event from {}", origin, err);
		}

		metricsService.recordEventError(reason);
		deliver(origin, Frame.of(EventNames.ERROR, new ChatEvents.ErrorNotice(message)));
	}
}
