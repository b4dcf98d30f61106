package com.qqsuccubus.chat.socket.store;

import com.qqsuccubus.chat.core.model.ChatMessage;
import com.qqsuccubus.chat.core.model.UserStatus;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Set;

/**
 * Storage operations the real-time layer depends on.
 * <p>
 * Users and chats are created and edited elsewhere (the REST side); a chat node only reads
 * memberships, appends messages, flips read flags and writes presence. It issues no storage
 * query outside this interface.
 * </p>
 */
public interface ChatStore {
    /**
     * Ids of every chat the user participates in.
     */
    Mono<Set<String>> findRoomsForUser(String userId);

    /**
     * Appends a new unread message to a chat.
     *
     * @return the stored message with the sender's display fields resolved
     */
    Mono<ChatMessage> createMessage(String senderId, String chatId, String content);

    /**
     * Points the chat's last-message reference at {@code messageId}.
     */
    Mono<Void> setRoomLastMessage(String chatId, String messageId);

    /**
     * Marks read every unread message of the chat not authored by {@code readerId}.
     *
     * @return number of messages this call flipped from unread to read
     */
    Mono<Long> markMessagesRead(String chatId, String readerId);

    /**
     * Updates a user's presence.
     *
     * @param lastSeen last-seen instant to record, or null to leave it unchanged
     */
    Mono<Void> setUserStatus(String userId, UserStatus status, Instant lastSeen);

    /**
     * Round-trip used to check the store is reachable at startup.
     */
    Mono<Void> ping();

    /**
     * Releases connections held by the store.
     */
    void close();
}
