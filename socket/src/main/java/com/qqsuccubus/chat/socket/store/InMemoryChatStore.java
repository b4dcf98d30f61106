package com.qqsuccubus.chat.socket.store;

import com.qqsuccubus.chat.core.model.ChatMessage;
import com.qqsuccubus.chat.core.model.ChatRoom;
import com.qqsuccubus.chat.core.model.UserProfile;
import com.qqsuccubus.chat.core.model.UserStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Process-local {@link ChatStore} for development ({@code STORE=memory}) and tests.
 * <p>
 * Seed users and chats with {@link #putUser} and {@link #putChat}. All maps are concurrent and
 * every read-flag flip is a per-message atomic update, so concurrent read receipts never count
 * the same message twice.
 * </p>
 */
public class InMemoryChatStore implements ChatStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryChatStore.class);

    private final Clock clock;

    private final Map<String, UserRecord> users = new ConcurrentHashMap<>();
    private final Map<String, ChatRoom> chats = new ConcurrentHashMap<>();
    private final Map<String, ChatMessage> messages = new ConcurrentHashMap<>();
    private final Map<String, List<String>> chatMessageIds = new ConcurrentHashMap<>();

    public InMemoryChatStore() {
        this(Clock.systemUTC());
    }

    public InMemoryChatStore(Clock clock) {
        this.clock = clock;
    }

    public InMemoryChatStore putUser(UserProfile profile) {
        users.put(profile.getId(), new UserRecord(profile, UserStatus.OFFLINE, null));
        return this;
    }

    public InMemoryChatStore putChat(ChatRoom chat) {
        chats.put(chat.getId(), chat);
        chatMessageIds.computeIfAbsent(chat.getId(), id -> new CopyOnWriteArrayList<>());
        return this;
    }

    public Optional<ChatRoom> chat(String chatId) {
        return Optional.ofNullable(chats.get(chatId));
    }

    public Optional<UserStatus> statusOf(String userId) {
        return Optional.ofNullable(users.get(userId)).map(UserRecord::status);
    }

    public Optional<Instant> lastSeenOf(String userId) {
        return Optional.ofNullable(users.get(userId)).map(UserRecord::lastSeen);
    }

    /**
     * Messages of a chat, oldest first, with their current read flags.
     */
    public List<ChatMessage> messagesIn(String chatId) {
        return chatMessageIds.getOrDefault(chatId, List.of()).stream()
            .map(messages::get)
            .collect(Collectors.toList());
    }

    @Override
    public Mono<Set<String>> findRoomsForUser(String userId) {
        return Mono.fromCallable(() -> chats.values().stream()
            .filter(chat -> chat.hasParticipant(userId))
            .map(ChatRoom::getId)
            .collect(Collectors.toSet()));
    }

    @Override
    public Mono<ChatMessage> createMessage(String senderId, String chatId, String content) {
        return Mono.fromCallable(() -> {
            List<String> ids = chatMessageIds.get(chatId);
            if (ids == null) {
                throw new NoSuchElementException("Chat not found: " + chatId);
            }

            UserRecord sender = users.get(senderId);
            ChatMessage message = ChatMessage.builder()
                .id(UUID.randomUUID().toString())
                .sender(sender != null ? sender.profile() : UserProfile.unknown(senderId))
                .chatId(chatId)
                .content(content)
                .read(false)
                .createdAt(clock.instant())
                .build();

            messages.put(message.getId(), message);
            ids.add(message.getId());
            log.debug("Stored message {} in chat {}", message.getId(), chatId);
            return message;
        });
    }

    @Override
    public Mono<Void> setRoomLastMessage(String chatId, String messageId) {
        return Mono.fromRunnable(() -> {
            ChatRoom updated = chats.computeIfPresent(chatId, (id, chat) -> chat.withLastMessageId(messageId));
            if (updated == null) {
                throw new NoSuchElementException("Chat not found: " + chatId);
            }
        });
    }

    @Override
    public Mono<Long> markMessagesRead(String chatId, String readerId) {
        return Mono.fromCallable(() -> {
            AtomicLong marked = new AtomicLong();
            for (String id : chatMessageIds.getOrDefault(chatId, List.of())) {
                messages.computeIfPresent(id, (key, message) -> {
                    if (message.isRead() || readerId.equals(message.getSenderId())) {
                        return message;
                    }
                    marked.incrementAndGet();
                    return message.withRead(true);
                });
            }
            return marked.get();
        });
    }

    @Override
    public Mono<Void> setUserStatus(String userId, UserStatus status, Instant lastSeen) {
        return Mono.fromRunnable(() -> {
            UserRecord updated = users.computeIfPresent(userId, (id, user) ->
                new UserRecord(user.profile(), status, lastSeen != null ? lastSeen : user.lastSeen()));
            if (updated == null) {
                log.debug("Status update for unknown user {} ignored", userId);
            }
        });
    }

    @Override
    public Mono<Void> ping() {
        return Mono.empty();
    }

    @Override
    public void close() {
        // nothing to release
    }

    private record UserRecord(UserProfile profile, UserStatus status, Instant lastSeen) {
    }
}
