package com.qqsuccubus.chat.core.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.util.Set;

/**
 * A conversation, either a direct chat between two users or a group chat.
 * <p>
 * Membership is owned by storage. The socket node never keeps rooms in memory; it only
 * caches which connection is subscribed to which room id.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class ChatRoom {
    String id;

    @Singular
    Set<String> participants;

    boolean group;

    /**
     * Display name for group chats, null for direct chats.
     */
    String groupName;

    /**
     * Id of the most recent message, null while the chat is empty.
     */
    String lastMessageId;

    public boolean hasParticipant(String userId) {
        return participants.contains(userId);
    }
}
