package com.qqsuccubus.chat.socket.session;

/**
 * Effect of a registry change on the owning user's presence.
 */
public enum PresenceTransition {
    /**
     * The user had no connection before this registration.
     */
    CAME_ONLINE,
    /**
     * The unregistered connection was the user's last one.
     */
    WENT_OFFLINE,
    NONE
}
