package com.qqsuccubus.chat.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * A persisted chat message.
 * <p>
 * Messages are append-only: once created only the {@code read} flag ever changes, and that
 * change happens in storage, never on an instance already handed to the router.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class ChatMessage {
    @JsonProperty("id")
    String id;

    /**
     * Sender with resolved display fields.
     */
    @JsonProperty("sender")
    UserProfile sender;

    @JsonProperty("chatId")
    String chatId;

    @JsonProperty("content")
    String content;

    @JsonProperty("read")
    boolean read;

    @JsonProperty("createdAt")
    Instant createdAt;

    @JsonCreator
    public ChatMessage(
        @JsonProperty("id") String id,
        @JsonProperty("sender") UserProfile sender,
        @JsonProperty("chatId") String chatId,
        @JsonProperty("content") String content,
        @JsonProperty("read") boolean read,
        @JsonProperty("createdAt") Instant createdAt
    ) {
        this.id = id;
        this.sender = sender;
        this.chatId = chatId;
        this.content = content;
        this.read = read;
        this.createdAt = createdAt;
    }

    /**
     * Same instant as {@link #getCreatedAt()}; clients read this field for display ordering.
     */
    @JsonProperty(value = "timestamp", access = JsonProperty.Access.READ_ONLY)
    public Instant getTimestamp() {
        return createdAt;
    }

    @JsonIgnore
    public String getSenderId() {
        return sender == null ? null : sender.getId();
    }
}
