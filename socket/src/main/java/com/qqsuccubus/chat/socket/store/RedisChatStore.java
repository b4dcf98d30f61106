package com.qqsuccubus.chat.socket.store;

import com.qqsuccubus.chat.core.model.ChatMessage;
import com.qqsuccubus.chat.core.model.UserProfile;
import com.qqsuccubus.chat.core.model.UserStatus;
import com.qqsuccubus.chat.core.redis.Keys;
import com.qqsuccubus.chat.socket.config.SocketConfig;
import io.lettuce.core.KeyValue;
import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Reactive Redis {@link ChatStore}.
 * <p>
 * All operations are non-blocking using the Lettuce reactive API. Key layout is described in
 * {@link Keys}.
 * </p>
 */
public class RedisChatStore implements ChatStore {
    private static final Logger log = LoggerFactory.getLogger(RedisChatStore.class);

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisReactiveCommands<String, String> commands;
    private final Clock clock;

    public RedisChatStore(SocketConfig config) {
        this(config, Clock.systemUTC());
    }

    public RedisChatStore(SocketConfig config, Clock clock) {
        this.clock = clock;
        this.client = RedisClient.create(config.getRedisUrl());
        this.connection = client.connect();
        this.commands = connection.reactive();
        log.info("Connected to Redis: {}", config.getRedisUrl());
    }

    @Override
    public Mono<Set<String>> findRoomsForUser(String userId) {
        return commands.smembers(Keys.userChats(userId))
            .collect(Collectors.toSet())
            .doOnError(err -> log.error("Failed to load chats of user {}", userId, err));
    }

    /**
     * Writes the message hash, appends its id to the chat history and to the chat's unread
     * set, then resolves the sender's display fields.
     */
    @Override
    public Mono<ChatMessage> createMessage(String senderId, String chatId, String content) {
        String messageId = UUID.randomUUID().toString();
        Instant createdAt = clock.instant();

        Map<String, String> fields = new HashMap<>();
        fields.put("sender", senderId);
        fields.put("chatId", chatId);
        fields.put("content", content);
        fields.put("read", "false");
        fields.put("createdAt", createdAt.toString());

        return commands.exists(Keys.chatParticipants(chatId))
            .flatMap(count -> {
                if (count == 0) {
                    return Mono.error(new NoSuchElementException("Chat not found: " + chatId));
                }
                return commands.hset(Keys.message(messageId), fields)
                    .then(commands.rpush(Keys.chatMessages(chatId), messageId))
                    .then(commands.sadd(Keys.chatUnread(chatId), messageId))
                    .then(loadProfile(senderId));
            })
            .map(sender -> ChatMessage.builder()
                .id(messageId)
                .sender(sender)
                .chatId(chatId)
                .content(content)
                .read(false)
                .createdAt(createdAt)
                .build())
            .doOnSuccess(message -> log.debug("Stored message {} in chat {}", messageId, chatId))
            .doOnError(err -> log.error("Failed to store message in chat {}", chatId, err));
    }

    @Override
    public Mono<Void> setRoomLastMessage(String chatId, String messageId) {
        return commands.hset(Keys.chat(chatId), Map.of(
                "lastMessage", messageId,
                "updatedAt", clock.instant().toString()
            ))
            .then()
            .doOnError(err -> log.error("Failed to update last message of chat {}", chatId, err));
    }

    /**
     * Walks the chat's unread set. A message is counted only when this call removed it from
     * the set, so concurrent or repeated receipts never count it twice.
     */
    @Override
    public Mono<Long> markMessagesRead(String chatId, String readerId) {
        String unreadKey = Keys.chatUnread(chatId);

        return commands.smembers(unreadKey)
            .concatMap(messageId -> commands.hget(Keys.message(messageId), "sender")
                .defaultIfEmpty("")
                .filter(sender -> !sender.equals(readerId))
                .flatMap(sender -> commands.srem(unreadKey, messageId))
                .filter(removed -> removed > 0)
                .flatMap(removed -> commands.hset(Keys.message(messageId), "read", "true").thenReturn(1L)))
            .count()
            .doOnError(err -> log.error("Failed to mark chat {} read for {}", chatId, readerId, err));
    }

    @Override
    public Mono<Void> setUserStatus(String userId, UserStatus status, Instant lastSeen) {
        Map<String, String> fields = new HashMap<>();
        fields.put("status", status.wireName());
        if (lastSeen != null) {
            fields.put("lastSeen", lastSeen.toString());
        }

        return commands.hset(Keys.user(userId), fields)
            .then()
            .doOnError(err -> log.error("Failed to set status {} for {}", status, userId, err));
    }

    @Override
    public Mono<Void> ping() {
        return commands.ping().then();
    }

    @Override
    public void close() {
        connection.close();
        client.shutdown();
        log.info("Redis connection closed");
    }

    private Mono<UserProfile> loadProfile(String userId) {
        return commands.hmget(Keys.user(userId), "name", "avatar")
            .collectList()
            .map(values -> new UserProfile(userId, valueAt(values, 0), valueAt(values, 1)));
    }

    private static String valueAt(List<KeyValue<String, String>> values, int index) {
        return index < values.size() ? values.get(index).getValueOrElse(null) : null;
    }
}
