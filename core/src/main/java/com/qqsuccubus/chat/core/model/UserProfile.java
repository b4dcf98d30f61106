package com.qqsuccubus.chat.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Public profile fields of a user, as attached to the messages they send.
 */
@Value
@Builder(toBuilder = true)
public class UserProfile {
    @JsonProperty("id")
    String id;

    @JsonProperty("name")
    String name;

    /**
     * Avatar URL, may be null.
     */
    @JsonProperty("avatar")
    String avatar;

    @JsonCreator
    public UserProfile(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("avatar") String avatar
    ) {
        this.id = id;
        this.name = name;
        this.avatar = avatar;
    }

    /**
     * Profile used when the sender record cannot be found: the id alone.
     */
    public static UserProfile unknown(String id) {
        return new UserProfile(id, null, null);
    }
}
