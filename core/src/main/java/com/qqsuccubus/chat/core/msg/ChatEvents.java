package com.qqsuccubus.chat.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.qqsuccubus.chat.core.model.UserStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Payloads of the events exchanged between clients and a chat node.
 * <p>
 * Inbound payloads are lenient on decode: a missing field becomes null and is rejected by the
 * router's validation, so a malformed event is answered with an {@code error} frame rather than
 * tearing the connection down.
 * </p>
 */
public final class ChatEvents {
    private ChatEvents() {
    }

    /**
     * Client asks to post a message to a chat.
     */
    @Value
    @Builder(toBuilder = true)
    public static class SendMessage {
        @JsonProperty("content")
        String content;

        @JsonProperty("chatId")
        String chatId;

        @JsonCreator
        public SendMessage(
            @JsonProperty("content") String content,
            @JsonProperty("chatId") String chatId
        ) {
            this.content = content;
            this.chatId = chatId;
        }
    }

    /**
     * Typing indicator. Received from the typist and relayed unchanged to the other members.
     */
    @Value
    @Builder(toBuilder = true)
    public static class Typing {
        @JsonProperty("chatId")
        String chatId;

        @JsonProperty("isTyping")
        Boolean typing;

        @JsonCreator
        public Typing(
            @JsonProperty("chatId") String chatId,
            @JsonProperty("isTyping") Boolean typing
        ) {
            this.chatId = chatId;
            this.typing = typing;
        }
    }

    /**
     * Client reports it has read a chat up to now.
     */
    @Value
    public static class ReadMessage {
        @JsonProperty("chatId")
        String chatId;

        @JsonCreator
        public ReadMessage(@JsonProperty("chatId") String chatId) {
            this.chatId = chatId;
        }
    }

    /**
     * Sent to the other members of a chat after {@code userId} read it.
     */
    @Value
    public static class MessagesRead {
        @JsonProperty("chatId")
        String chatId;

        @JsonProperty("userId")
        String userId;
    }

    /**
     * Global presence change.
     */
    @Value
    public static class UserStatusChange {
        @JsonProperty("userId")
        String userId;

        @JsonProperty("status")
        UserStatus status;
    }

    /**
     * Unicast to the originator of an event that could not be processed.
     */
    @Value
    public static class ErrorNotice {
        @JsonProperty("message")
        String message;
    }
}
