package com.qqsuccubus.chat.core.redis;

/**
 * Redis keyspace of the chat store.
 * <p>
 * <b>Key design principles:</b>
 * <ul>
 *   <li>Namespace prefixes avoid collisions ({@code user:}, {@code chat:}, {@code msg:})</li>
 *   <li>Hashes for records, sets for memberships, lists for ordered history</li>
 * </ul>
 * Users and chats are written by the REST side; the chat node reads memberships, appends
 * messages, flips read flags and writes presence.
 * </p>
 */
public final class Keys {
    private Keys() {
    }

    /**
     * User record: {@code user:{userId}}
     * <p>
     * <b>Type:</b> Hash
     * <br>
     * <b>Fields:</b> {@code name}, {@code avatar}, {@code status} (online/offline),
     * {@code lastSeen} (ISO-8601)
     * </p>
     */
    public static String user(String userId) {
        return "user:" + userId;
    }

    /**
     * Chats a user participates in: {@code user:{userId}:chats}
     * <p>
     * <b>Type:</b> Set of chat ids
     * </p>
     */
    public static String userChats(String userId) {
        return "user:" + userId + ":chats";
    }

    /**
     * Chat record: {@code chat:{chatId}}
     * <p>
     * <b>Type:</b> Hash
     * <br>
     * <b>Fields:</b> {@code isGroup}, {@code groupName}, {@code lastMessage}, {@code updatedAt}
     * </p>
     */
    public static String chat(String chatId) {
        return "chat:" + chatId;
    }

    /**
     * Participants of a chat: {@code chat:{chatId}:participants}
     * <p>
     * <b>Type:</b> Set of user ids
     * </p>
     */
    public static String chatParticipants(String chatId) {
        return "chat:" + chatId + ":participants";
    }

    /**
     * Message history of a chat: {@code chat:{chatId}:messages}
     * <p>
     * <b>Type:</b> List of message ids, oldest first
     * </p>
     */
    public static String chatMessages(String chatId) {
        return "chat:" + chatId + ":messages";
    }

    /**
     * Unread messages of a chat: {@code chat:{chatId}:unread}
     * <p>
     * <b>Type:</b> Set of message ids whose {@code read} flag is still false
     * </p>
     */
    public static String chatUnread(String chatId) {
        return "chat:" + chatId + ":unread";
    }

    /**
     * Message record: {@code msg:{messageId}}
     * <p>
     * <b>Type:</b> Hash
     * <br>
     * <b>Fields:</b> {@code sender}, {@code chatId}, {@code content}, {@code read},
     * {@code createdAt} (ISO-8601)
     * </p>
     */
    public static String message(String messageId) {
        return "msg:" + messageId;
    }
}
