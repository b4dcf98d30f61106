package com.qqsuccubus.chat.core.msg;

/**
 * Event names carried in the {@code event} field of a {@link Frame}.
 */
public final class EventNames {
    private EventNames() {
    }

    // client -> server

    /**
     * {@code {content, chatId}}; answered with {@link #NEW_MESSAGE} to the room.
     */
    public static final String SEND_MESSAGE = "send_message";

    /**
     * {@code {chatId, isTyping}}; relayed as {@link #TYPING} to the other room members.
     * The same name is used in both directions.
     */
    public static final String TYPING = "typing";

    /**
     * {@code {chatId}}; answered with {@link #MESSAGES_READ} to the other room members.
     */
    public static final String READ_MESSAGE = "read_message";

    /**
     * Keepalive, no payload and no reply.
     */
    public static final String PING = "ping";

    // server -> client

    public static final String NEW_MESSAGE = "new_message";

    public static final String MESSAGES_READ = "messages_read";

    public static final String USER_STATUS = "user_status";

    public static final String ERROR = "error";
}
