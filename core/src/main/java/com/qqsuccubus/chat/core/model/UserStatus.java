package com.qqsuccubus.chat.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Presence status of a user. Serialized in lower case ("online" / "offline").
 */
public enum UserStatus {
    ONLINE,
    OFFLINE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static UserStatus fromWireName(String value) {
        return UserStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
